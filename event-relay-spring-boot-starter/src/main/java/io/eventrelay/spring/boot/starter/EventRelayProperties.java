package io.eventrelay.spring.boot.starter;

import io.eventrelay.core.Protocol;
import io.eventrelay.server.core.EventRelayServer;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code event-relay.server.*} settings.
 */
@ConfigurationProperties(prefix = "event-relay.server")
public class EventRelayProperties {

    /**
     * Maximum number of concurrently registered streams.
     */
    private int maxConnections = EventRelayServer.DEFAULT_MAX_CONNECTIONS;

    /**
     * Interval between keepalive comments on each stream.
     */
    private Duration keepAliveInterval = EventRelayServer.DEFAULT_KEEP_ALIVE_INTERVAL;

    /**
     * Upper bound on a single send, across all recipients.
     */
    private Duration broadcastTimeout = EventRelayServer.DEFAULT_BROADCAST_TIMEOUT;

    /**
     * Deadline for the {@code connected} event on a new stream.
     */
    private Duration handshakeTimeout = EventRelayServer.DEFAULT_HANDSHAKE_TIMEOUT;

    /**
     * Origins allowed by CORS. Empty allows any origin.
     */
    private List<String> allowedOrigins = new ArrayList<>();

    /**
     * Servlet mapping of the connect endpoint.
     */
    private String path = Protocol.DEFAULT_CONNECT_PATH;

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public Duration getKeepAliveInterval() {
        return keepAliveInterval;
    }

    public void setKeepAliveInterval(Duration keepAliveInterval) {
        this.keepAliveInterval = keepAliveInterval;
    }

    public Duration getBroadcastTimeout() {
        return broadcastTimeout;
    }

    public void setBroadcastTimeout(Duration broadcastTimeout) {
        this.broadcastTimeout = broadcastTimeout;
    }

    public Duration getHandshakeTimeout() {
        return handshakeTimeout;
    }

    public void setHandshakeTimeout(Duration handshakeTimeout) {
        this.handshakeTimeout = handshakeTimeout;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
