package io.eventrelay.server.core;

import io.eventrelay.core.EventFrame;
import io.eventrelay.core.EventRelayException;
import io.eventrelay.core.RelayMessage;
import io.eventrelay.json.spi.JsonCodec;
import io.eventrelay.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans one serialized message out to registered connections.
 *
 * <p>The payload is serialized once per send. A single recipient is written on the calling thread;
 * several recipients are written concurrently on the relay executor, all bounded by one deadline.
 * Every recipient that fails, by write error or by missing the deadline, is evicted from the registry.
 */
public final class EventDispatcher implements EventPublisher {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final ConnectionRegistry registry;
    private final JsonCodec codec;
    private final ExecutorService executor;
    private final Duration broadcastTimeout;

    public EventDispatcher(ConnectionRegistry registry, JsonCodec codec, ExecutorService executor, Duration broadcastTimeout) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.broadcastTimeout = Objects.requireNonNull(broadcastTimeout, "broadcastTimeout");
        if (broadcastTimeout.isNegative() || broadcastTimeout.isZero()) {
            throw new IllegalArgumentException("broadcastTimeout must be positive");
        }
    }

    @Override
    public void publish(String eventType, Object payload, String... targetIds) {
        send(RelayMessage.of(eventType, payload), targetIds);
    }

    /**
     * Sends to the given ids, or broadcasts when none are given, within the broadcast timeout.
     */
    public void send(RelayMessage message, String... targetIds) {
        send(message, broadcastTimeout, targetIds == null ? List.of() : Arrays.asList(targetIds));
    }

    /**
     * Sends with a caller-supplied timeout. The effective deadline is the shorter of {@code timeout} and
     * the configured broadcast timeout; a missing, zero or negative timeout means the broadcast timeout.
     * A single recipient is written on the calling thread and waits for its write lock only until the
     * deadline.
     *
     * @throws java.util.concurrent.CancellationException if the calling thread is interrupted; nothing is
     *         evicted and the interrupt flag stays set
     */
    public void send(RelayMessage message, Duration timeout, Collection<String> targetIds) {
        Objects.requireNonNull(message, "message");
        message.validate();
        byte[] frame = frame(message);

        boolean broadcast = targetIds == null || targetIds.isEmpty();
        List<Connection> recipients = broadcast ? registry.list() : registry.resolve(targetIds);
        if (recipients.isEmpty()) {
            if (broadcast) {
                log.debug("No clients to broadcast {} to", message.eventType());
                return;
            }
            throw new EventRelayException.NoMatchingClients();
        }

        long deadline = System.nanoTime() + effectiveTimeout(timeout).toNanos();
        if (recipients.size() == 1) {
            sendOne(recipients.get(0), frame, deadline);
        } else {
            sendMany(recipients, frame, deadline);
        }
    }

    private void sendOne(Connection connection, byte[] frame, long deadline) {
        try {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0 || !connection.tryWrite(frame, remaining, TimeUnit.NANOSECONDS)) {
                throw new TimeoutException("send deadline exceeded");
            }
        } catch (IOException | TimeoutException e) {
            if (callerInterrupted(e)) {
                throw new CancellationException("send interrupted");
            }
            evict(connection, e);
            throw new EventRelayException.PartialDeliveryFailure(1, 1, e);
        }
    }

    private void sendMany(List<Connection> recipients, byte[] frame, long deadline) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("send interrupted");
        }
        List<Callable<Void>> tasks = new ArrayList<>(recipients.size());
        for (Connection c : recipients) {
            tasks.add(() -> {
                try {
                    c.write(frame);
                } catch (IOException e) {
                    // a task cancelled at the deadline is evicted by the caller
                    if (!callerInterrupted(e)) {
                        evict(c, e);
                    }
                    throw e;
                }
                return null;
            });
        }

        List<Future<Void>> futures;
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            futures = executor.invokeAll(tasks, remaining, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("send interrupted");
        }

        int failed = 0;
        Throwable first = null;
        for (int i = 0; i < futures.size(); i++) {
            Throwable error = outcome(futures.get(i));
            if (error == null) continue;
            failed++;
            if (first == null) first = error;
            if (error instanceof TimeoutException) {
                evict(recipients.get(i), error);
            }
        }

        if (failed > 0) {
            throw new EventRelayException.PartialDeliveryFailure(failed, recipients.size(), first);
        }
    }

    /**
     * {@link Connection} restores the interrupt flag when it gives up waiting for the write lock, which
     * tells an interrupted waiter apart from a sink that timed out.
     */
    private static boolean callerInterrupted(Exception e) {
        return e instanceof InterruptedIOException && Thread.currentThread().isInterrupted();
    }

    private static Throwable outcome(Future<Void> future) {
        try {
            future.get();
            return null;
        } catch (CancellationException e) {
            return new TimeoutException("send deadline exceeded");
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return e;
        }
    }

    private void evict(Connection connection, Throwable cause) {
        log.warn("Failed to send to client {}: {}", connection.id(), cause.getMessage());
        registry.remove(connection);
    }

    private byte[] frame(RelayMessage message) {
        String json;
        try {
            json = codec.writeString(message.payload());
        } catch (JsonException e) {
            throw new EventRelayException.InvalidMessage("failed to marshal message data", e);
        }
        try {
            return new EventFrame(message.eventType(), json).toBytes();
        } catch (IllegalArgumentException e) {
            throw new EventRelayException.InvalidMessage("invalid message: " + e.getMessage(), e);
        }
    }

    private Duration effectiveTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero() || timeout.compareTo(broadcastTimeout) > 0) {
            return broadcastTimeout;
        }
        return timeout;
    }
}
