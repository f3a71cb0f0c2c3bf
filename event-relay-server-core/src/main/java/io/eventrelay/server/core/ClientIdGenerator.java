package io.eventrelay.server.core;

import java.util.UUID;

/**
 * Supplies identifiers for clients that connect without one.
 */
@FunctionalInterface
public interface ClientIdGenerator {

    String nextId();

    /**
     * Random UUID based ids, {@code client-<uuid>}. Safe under concurrent connects.
     */
    static ClientIdGenerator random() {
        return () -> "client-" + UUID.randomUUID();
    }
}
