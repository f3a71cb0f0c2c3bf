package io.eventrelay.client;

/**
 * Callback for one event type. Receives the raw JSON payload bytes.
 */
@FunctionalInterface
public interface EventHandler {
    void handle(byte[] data) throws Exception;
}
