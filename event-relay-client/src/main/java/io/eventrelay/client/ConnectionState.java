package io.eventrelay.client;

/**
 * Lifecycle of the client's stream.
 */
public enum ConnectionState {
    /** Never connected. */
    IDLE,

    /** Attempting to connect, possibly waiting between attempts. */
    CONNECTING,

    /** Stream open and being read. */
    CONNECTED,

    /** Stream ended, retry budget exhausted, or client closed. */
    DISCONNECTED
}
