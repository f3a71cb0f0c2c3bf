package io.eventrelay.client;

import java.io.InputStream;

/**
 * HTTP seam used by {@link EventRelayClient}. The returned body is read until EOF or until the client
 * closes it.
 */
public interface EventRelayTransport {
    TransportResponse<InputStream> openStream(TransportRequest request) throws Exception;
}
