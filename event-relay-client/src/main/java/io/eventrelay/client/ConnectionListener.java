package io.eventrelay.client;

/**
 * Observer of stream lifecycle changes. Called on the client's internal threads.
 */
public interface ConnectionListener {

    default void onConnected() {
    }

    /**
     * @param cause the read error, or {@code null} when the server closed the stream or the client was closed
     */
    default void onDisconnected(Throwable cause) {
    }
}
