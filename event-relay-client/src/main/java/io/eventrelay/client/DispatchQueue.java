package io.eventrelay.client;

import io.eventrelay.core.EventFramer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off between the stream reader and handler invocation.
 *
 * <p>One worker thread drains the queue, so handlers still see events in arrival order, but a slow
 * handler no longer stalls reading the stream.
 */
final class DispatchQueue implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DispatchQueue.class);

    private final BlockingQueue<EventFramer.Event> queue;
    private final HandlerRegistry handlers;
    private final BackpressurePolicy policy;
    private final Duration enqueueTimeout;
    private Thread worker;
    private volatile boolean closed;

    DispatchQueue(int capacity, BackpressurePolicy policy, Duration enqueueTimeout, HandlerRegistry handlers) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.policy = Objects.requireNonNull(policy, "policy");
        this.enqueueTimeout = Objects.requireNonNull(enqueueTimeout, "enqueueTimeout");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
    }

    synchronized void start() {
        if (worker != null || closed) {
            return;
        }
        worker = new Thread(this::drain, "event-relay-dispatch");
        worker.setDaemon(true);
        worker.start();
    }

    /**
     * Queues an event for dispatch according to the backpressure policy.
     *
     * @return {@code false} if the event itself was dropped
     */
    boolean offer(EventFramer.Event event) throws InterruptedException {
        if (closed) {
            return false;
        }
        if (policy == BackpressurePolicy.DROP_OLDEST) {
            while (!queue.offer(event)) {
                EventFramer.Event dropped = queue.poll();
                if (dropped != null) {
                    log.warn("Dispatch queue full, dropped oldest {} event", dropped.eventType());
                }
            }
            return true;
        }
        if (queue.offer(event, enqueueTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
            return true;
        }
        log.warn("Dispatch queue full for {}, dropped {} event", enqueueTimeout, event.eventType());
        return false;
    }

    int size() {
        return queue.size();
    }

    private void drain() {
        while (!closed) {
            EventFramer.Event event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            handlers.dispatch(event);
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (worker != null) {
            worker.interrupt();
        }
        queue.clear();
    }
}
