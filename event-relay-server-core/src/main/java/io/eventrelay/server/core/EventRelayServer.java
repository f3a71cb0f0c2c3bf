package io.eventrelay.server.core;

import io.eventrelay.core.RelayMessage;
import io.eventrelay.json.jackson.JacksonJsonCodec;
import io.eventrelay.json.spi.JsonCodec;

import java.io.IOException;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Server side of the event relay: one registry, its dispatcher, keepalive pinger and stream endpoint.
 *
 * <p>Instances are independent of each other; create as many as needed (one per test, for example).
 * Use {@link #builder()} to configure:
 * <pre>{@code
 * EventRelayServer relay = EventRelayServer.builder()
 *     .maxConnections(500)
 *     .keepAliveInterval(Duration.ofSeconds(15))
 *     .allowedOrigins(List.of("https://app.example.com"))
 *     .build();
 *
 * relay.publish("tick", Map.of("n", 1));           // broadcast
 * relay.publish("job", payload, "agent-7");         // targeted
 * }</pre>
 */
public final class EventRelayServer implements EventPublisher, AutoCloseable {

    public static final int DEFAULT_MAX_CONNECTIONS = 10_000;
    public static final Duration DEFAULT_KEEP_ALIVE_INTERVAL = Duration.ofSeconds(10);
    public static final Duration DEFAULT_BROADCAST_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(2);

    private final ConnectionRegistry registry;
    private final EventDispatcher dispatcher;
    private final StreamEndpoint endpoint;
    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;
    private final Duration keepAliveInterval;
    private final Duration broadcastTimeout;
    private final CorsPolicy corsPolicy;

    /**
     * Creates a new builder for configuring a relay server.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static EventRelayServer createDefault() {
        return builder().build();
    }

    private EventRelayServer(Builder builder) {
        int maxConnections = builder.maxConnections > 0 ? builder.maxConnections : DEFAULT_MAX_CONNECTIONS;
        this.keepAliveInterval = positiveOr(builder.keepAliveInterval, DEFAULT_KEEP_ALIVE_INTERVAL);
        this.broadcastTimeout = positiveOr(builder.broadcastTimeout, DEFAULT_BROADCAST_TIMEOUT);
        Duration handshakeTimeout = positiveOr(builder.handshakeTimeout, DEFAULT_HANDSHAKE_TIMEOUT);
        JsonCodec codec = builder.jsonCodec != null ? builder.jsonCodec : new JacksonJsonCodec();
        ClientIdGenerator idGenerator = builder.idGenerator != null ? builder.idGenerator : ClientIdGenerator.random();
        this.corsPolicy = new CorsPolicy(builder.allowedOrigins);

        this.executor = RelayThreads.newExecutor("event-relay-send");
        this.scheduler = RelayThreads.newScheduler("event-relay-keepalive");
        this.registry = new ConnectionRegistry(maxConnections);
        this.dispatcher = new EventDispatcher(registry, codec, executor, broadcastTimeout);
        KeepAlivePinger pinger = new KeepAlivePinger(registry, scheduler, executor, keepAliveInterval);
        this.endpoint = new StreamEndpoint(registry, dispatcher, pinger, corsPolicy, idGenerator, handshakeTimeout);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }

    /**
     * Builder for {@link EventRelayServer}.
     */
    public static final class Builder {
        private int maxConnections;
        private Duration keepAliveInterval;
        private Duration broadcastTimeout;
        private Duration handshakeTimeout;
        private List<String> allowedOrigins = List.of();
        private JsonCodec jsonCodec;
        private ClientIdGenerator idGenerator;

        private Builder() {
        }

        /** Sets the maximum number of simultaneous connections. Default: 10000. */
        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        /** Sets the keepalive comment interval. Default: 10 seconds. */
        public Builder keepAliveInterval(Duration keepAliveInterval) {
            this.keepAliveInterval = keepAliveInterval;
            return this;
        }

        /** Sets the deadline applied to a whole send. Default: 5 seconds. */
        public Builder broadcastTimeout(Duration broadcastTimeout) {
            this.broadcastTimeout = broadcastTimeout;
            return this;
        }

        /** Sets the deadline for delivering the {@code connected} event. Default: 2 seconds. */
        public Builder handshakeTimeout(Duration handshakeTimeout) {
            this.handshakeTimeout = handshakeTimeout;
            return this;
        }

        /** Sets the CORS allow-list. Default: empty, which allows any origin. */
        public Builder allowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins == null ? List.of() : allowedOrigins;
            return this;
        }

        /** Sets the payload codec. Default: {@link JacksonJsonCodec}. */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /** Sets the generator for clients connecting without {@code client_id}. Default: random UUIDs. */
        public Builder idGenerator(ClientIdGenerator idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        /** Builds the server with the configured settings. */
        public EventRelayServer build() {
            return new EventRelayServer(this);
        }
    }

    /**
     * Serves one connect request; blocks for the lifetime of the stream.
     */
    public void handle(ServerRequest request, StreamExchange exchange) throws IOException {
        endpoint.handle(request, exchange);
    }

    @Override
    public void publish(String eventType, Object payload, String... targetIds) {
        dispatcher.publish(eventType, payload, targetIds);
    }

    public void send(RelayMessage message, String... targetIds) {
        dispatcher.send(message, targetIds);
    }

    public void send(RelayMessage message, Duration timeout, Collection<String> targetIds) {
        dispatcher.send(message, timeout, targetIds);
    }

    public List<String> connectedClientIds() {
        return registry.ids();
    }

    public int connectedClientCount() {
        return registry.count();
    }

    public boolean isClientConnected(String clientId) {
        return registry.contains(clientId);
    }

    /**
     * Evicts one client; its stream request returns shortly after.
     */
    public boolean disconnect(String clientId) {
        return registry.remove(clientId);
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public EventDispatcher dispatcher() {
        return dispatcher;
    }

    public Duration keepAliveInterval() {
        return keepAliveInterval;
    }

    public Duration broadcastTimeout() {
        return broadcastTimeout;
    }

    public CorsPolicy corsPolicy() {
        return corsPolicy;
    }

    /**
     * Ends every stream and stops the relay's threads.
     */
    @Override
    public void close() {
        registry.removeAll();
        scheduler.shutdownNow();
        executor.shutdown();
    }
}
