package io.eventrelay.spring.boot.starter;

import io.eventrelay.json.spi.JsonCodec;
import io.eventrelay.server.core.EventPublisher;
import io.eventrelay.server.core.EventRelayServer;
import io.eventrelay.servlet.EventRelayServlet;
import jakarta.servlet.Servlet;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.ServletRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for the event relay.
 *
 * <p>Provides an {@link EventRelayServer} configured from {@code event-relay.server.*}. Inject it as an
 * {@link EventPublisher} to push events. In a servlet web application the connect endpoint is also
 * registered at {@code event-relay.server.path}, with async support enabled.
 *
 * <p>Every bean backs off when the application defines its own.
 */
@AutoConfiguration
@ConditionalOnClass(EventRelayServer.class)
@EnableConfigurationProperties(EventRelayProperties.class)
public class EventRelayAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public EventRelayServer eventRelayServer(EventRelayProperties properties, ObjectProvider<JsonCodec> jsonCodec) {
        EventRelayServer.Builder builder = EventRelayServer.builder()
                .maxConnections(properties.getMaxConnections())
                .keepAliveInterval(properties.getKeepAliveInterval())
                .broadcastTimeout(properties.getBroadcastTimeout())
                .handshakeTimeout(properties.getHandshakeTimeout())
                .allowedOrigins(properties.getAllowedOrigins());
        jsonCodec.ifAvailable(builder::jsonCodec);
        return builder.build();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({Servlet.class, EventRelayServlet.class})
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    static class ServletEndpointConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public EventRelayServlet eventRelayServlet(EventRelayServer relay) {
            return new EventRelayServlet(relay);
        }

        @Bean
        @ConditionalOnMissingBean(name = "eventRelayServletRegistration")
        public ServletRegistrationBean<EventRelayServlet> eventRelayServletRegistration(
                EventRelayServlet servlet, EventRelayProperties properties) {
            ServletRegistrationBean<EventRelayServlet> registration =
                    new ServletRegistrationBean<>(servlet, properties.getPath());
            registration.setName("eventRelayServlet");
            registration.setAsyncSupported(true);
            return registration;
        }
    }
}
