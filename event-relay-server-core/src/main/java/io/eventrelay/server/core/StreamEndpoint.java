package io.eventrelay.server.core;

import io.eventrelay.core.EventRelayException;
import io.eventrelay.core.Protocol;
import io.eventrelay.core.RelayMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Framework-neutral handler for the long-lived SSE connect request.
 *
 * <p>A request moves through negotiation (method and CORS), registration, streaming and close. The
 * calling thread is held for the lifetime of the stream; {@link #handle} returns once the request is
 * cancelled or the connection is evicted, after removing the connection from the registry.
 */
public final class StreamEndpoint {
    private static final Logger log = LoggerFactory.getLogger(StreamEndpoint.class);

    private final ConnectionRegistry registry;
    private final EventDispatcher dispatcher;
    private final KeepAlivePinger pinger;
    private final CorsPolicy corsPolicy;
    private final ClientIdGenerator idGenerator;
    private final Duration handshakeTimeout;

    StreamEndpoint(
            ConnectionRegistry registry,
            EventDispatcher dispatcher,
            KeepAlivePinger pinger,
            CorsPolicy corsPolicy,
            ClientIdGenerator idGenerator,
            Duration handshakeTimeout
    ) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.pinger = Objects.requireNonNull(pinger, "pinger");
        this.corsPolicy = Objects.requireNonNull(corsPolicy, "corsPolicy");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.handshakeTimeout = Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
    }

    /**
     * Serves one request to completion.
     *
     * @throws IOException if writing a non-streaming response fails
     */
    public void handle(ServerRequest request, StreamExchange exchange) throws IOException {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(exchange, "exchange");
        String origin = request.header(Protocol.H_ORIGIN).orElse(null);

        if (request.method() == HttpMethod.OPTIONS) {
            exchange.respond(withCors(ServerResponse.empty(200), origin));
            return;
        }
        if (request.method() != HttpMethod.GET) {
            exchange.respond(ServerResponse.text(405, "Method not allowed"));
            return;
        }

        EventSink sink;
        try {
            sink = exchange.sink();
        } catch (EventRelayException.StreamingUnsupported e) {
            log.warn("Rejecting stream request: {}", e.getMessage());
            exchange.respond(ServerResponse.text(500, e.getMessage()));
            return;
        }

        Connection connection = new Connection(clientId(request), sink);
        try {
            registry.register(connection);
        } catch (EventRelayException.CapacityExceeded e) {
            log.warn("Rejecting client {}: {}", connection.id(), e.getMessage());
            exchange.respond(ServerResponse.text(503, e.getMessage()));
            return;
        }

        ScheduledFuture<?> keepalive = null;
        try {
            exchange.beginStream(streamHeaders(origin));
            dispatcher.send(
                    RelayMessage.of(Protocol.EVENT_CONNECTED, Map.of(Protocol.FIELD_CLIENT_ID, connection.id())),
                    handshakeTimeout,
                    List.of(connection.id()));
            log.info("Client {} connected", connection.id());

            keepalive = pinger.start(connection, exchange.cancelled());
            awaitEnd(connection, exchange.cancelled());
        } catch (IOException | EventRelayException | CancellationException e) {
            log.warn("Failed to open stream for client {}: {}", connection.id(), e.getMessage());
        } finally {
            if (keepalive != null) {
                keepalive.cancel(false);
            }
            registry.remove(connection);
        }
    }

    private void awaitEnd(Connection connection, CompletableFuture<Void> requestCancelled) {
        try {
            CompletableFuture.anyOf(connection.doneSignal(), requestCancelled).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Client {} stream thread interrupted", connection.id());
            return;
        } catch (ExecutionException e) {
            log.debug("Client {} request ended with error: {}", connection.id(), e.getCause().getMessage());
            return;
        }
        if (requestCancelled.isDone()) {
            log.info("Client {} connection context done", connection.id());
        } else {
            log.info("Client {} connection closed", connection.id());
        }
    }

    private String clientId(ServerRequest request) {
        String supplied = QueryString.parse(request.uri()).get(Protocol.Q_CLIENT_ID);
        if (supplied == null || supplied.isBlank()) {
            return idGenerator.nextId();
        }
        return supplied;
    }

    private Map<String, List<String>> streamHeaders(String origin) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        corsPolicy.headersFor(origin).forEach((k, v) -> headers.put(k, List.of(v)));
        headers.put(Protocol.H_CONTENT_TYPE, List.of(Protocol.CT_EVENT_STREAM));
        headers.put(Protocol.H_CACHE_CONTROL, List.of(Protocol.NO_CACHE));
        headers.put(Protocol.H_CONNECTION, List.of(Protocol.KEEP_ALIVE));
        return headers;
    }

    private ServerResponse withCors(ServerResponse response, String origin) {
        corsPolicy.headersFor(origin).forEach(response::header);
        return response;
    }
}
