package io.eventrelay.client;

/**
 * Status line and body of a stream request; the client has no use for response headers.
 */
public record TransportResponse<T>(int status, T body) {
}
