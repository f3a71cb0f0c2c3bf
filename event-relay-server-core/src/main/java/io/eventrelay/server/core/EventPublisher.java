package io.eventrelay.server.core;

/**
 * Entry point for business code that needs to push events to connected clients.
 */
@FunctionalInterface
public interface EventPublisher {

    /**
     * Sends an event to the given clients, or to every connected client when no id is given.
     *
     * @throws io.eventrelay.core.EventRelayException.InvalidMessage if the event type is empty or the payload is null
     * @throws io.eventrelay.core.EventRelayException.NoMatchingClients if none of the given ids is connected
     * @throws io.eventrelay.core.EventRelayException.PartialDeliveryFailure if some recipients failed
     */
    void publish(String eventType, Object payload, String... targetIds);
}
