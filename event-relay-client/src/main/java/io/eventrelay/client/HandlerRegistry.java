package io.eventrelay.client;

import io.eventrelay.core.EventFramer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event type to ordered callbacks. Handlers can be added at any time, never removed.
 */
final class HandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, List<EventHandler>> handlers = new ConcurrentHashMap<>();

    void add(String eventType, EventHandler handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        handlers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(handler);
    }

    /**
     * Invokes every handler for the event's type in registration order. A failing handler is logged and
     * the rest still run.
     */
    void dispatch(EventFramer.Event event) {
        List<EventHandler> forType = handlers.get(event.eventType());
        if (forType == null || forType.isEmpty()) {
            log.debug("Received event without handler: {}", event.eventType());
            return;
        }
        byte[] data = event.data().getBytes(StandardCharsets.UTF_8);
        for (EventHandler handler : forType) {
            try {
                handler.handle(data);
            } catch (Exception e) {
                log.warn("Handler for event {} failed", event.eventType(), e);
            }
        }
    }
}
