package io.eventrelay.server.core;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Binding between {@link StreamEndpoint} and a concrete HTTP server for one request.
 *
 * <p>Nothing may be written to the client before either {@link #respond(ServerResponse)} or
 * {@link #beginStream(Map)} is called, so that a rejected registration can still answer with an
 * ordinary status.
 */
public interface StreamExchange {

    /**
     * Writes a complete, non-streaming response.
     */
    void respond(ServerResponse response) throws IOException;

    /**
     * Returns the sink the stream will be written to, without committing the response.
     *
     * @throws io.eventrelay.core.EventRelayException.StreamingUnsupported if the transport cannot flush
     */
    EventSink sink();

    /**
     * Commits status 200 with the given headers and flushes them to the client.
     */
    void beginStream(Map<String, List<String>> headers) throws IOException;

    /**
     * Completes when the inbound request ends (client gone, container shutdown, async timeout).
     */
    CompletableFuture<Void> cancelled();
}
