package io.eventrelay.core;

/**
 * Base class for event relay failures.
 *
 * <p>Provides a common hierarchy for the failures callers can observe. Subclasses keep the original
 * cause when one exists.
 */
public abstract class EventRelayException extends RuntimeException {

    protected EventRelayException(String message) {
        super(message);
    }

    protected EventRelayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the registry already holds the maximum number of connections.
     */
    public static class CapacityExceeded extends EventRelayException {
        private final int maxConnections;

        public CapacityExceeded(int maxConnections) {
            super("maximum connections (" + maxConnections + ") reached");
            this.maxConnections = maxConnections;
        }

        public int maxConnections() {
            return maxConnections;
        }
    }

    /**
     * Raised when a message has an empty event type, an absent payload, or a payload that cannot be
     * serialized.
     */
    public static class InvalidMessage extends EventRelayException {
        public InvalidMessage(String message) {
            super(message);
        }

        public InvalidMessage(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a targeted send resolves to no registered connection.
     */
    public static class NoMatchingClients extends EventRelayException {
        public NoMatchingClients() {
            super("no clients found from the specified IDs");
        }
    }

    /**
     * Raised when some recipients of a send failed. Failed recipients have already been evicted.
     */
    public static class PartialDeliveryFailure extends EventRelayException {
        private final int failed;
        private final int total;

        public PartialDeliveryFailure(int failed, int total, Throwable firstCause) {
            super("failed to deliver to " + failed + "/" + total + " clients: "
                    + (firstCause == null ? "unknown" : firstCause.getMessage()), firstCause);
            this.failed = failed;
            this.total = total;
        }

        public int failed() {
            return failed;
        }

        public int total() {
            return total;
        }
    }

    /**
     * Raised when the transport cannot flush a streaming response.
     */
    public static class StreamingUnsupported extends EventRelayException {
        public StreamingUnsupported(String message) {
            super(message);
        }
    }

    /**
     * Raised when a client used up its connection attempts.
     */
    public static class ConnectionExhausted extends EventRelayException {
        private final int attempts;

        public ConnectionExhausted(int attempts, Throwable lastError) {
            super("could not connect after " + attempts + " attempts: "
                    + (lastError == null ? "unknown" : lastError.getMessage()), lastError);
            this.attempts = attempts;
        }

        public int attempts() {
            return attempts;
        }
    }
}
