package io.eventrelay.core;

/**
 * An event to push to connected clients.
 *
 * <p>Validation happens at send time so that a rejected message surfaces as
 * {@link EventRelayException.InvalidMessage} rather than a constructor failure.
 *
 * @param eventType the SSE event name, must be non-empty
 * @param payload any JSON-serializable value, must not be {@code null}
 */
public record RelayMessage(String eventType, Object payload) {

    public static RelayMessage of(String eventType, Object payload) {
        return new RelayMessage(eventType, payload);
    }

    /**
     * Checks the message is sendable.
     *
     * @throws EventRelayException.InvalidMessage if the event type is empty or the payload is absent
     */
    public void validate() {
        if (eventType == null || eventType.isEmpty()) {
            throw new EventRelayException.InvalidMessage("invalid message: eventType cannot be empty");
        }
        if (payload == null) {
            throw new EventRelayException.InvalidMessage("invalid message: payload cannot be null");
        }
    }
}
