package io.eventrelay.client;

/**
 * What the reader does when the dispatch queue is full.
 */
public enum BackpressurePolicy {
    /** Evict the oldest queued event to make room. The reader never blocks. */
    DROP_OLDEST,

    /** Block the reader up to the enqueue timeout, then drop the incoming event. */
    BLOCK_WITH_TIMEOUT
}
