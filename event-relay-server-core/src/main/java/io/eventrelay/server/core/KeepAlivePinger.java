package io.eventrelay.server.core;

import io.eventrelay.core.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically writes an SSE comment to each live connection so idle intermediaries keep the stream open.
 *
 * <p>The scheduler only triggers ticks; the write itself runs on the relay executor so that one slow
 * connection cannot delay pings to the others. A failed ping evicts the connection.
 */
final class KeepAlivePinger {
    private static final Logger log = LoggerFactory.getLogger(KeepAlivePinger.class);
    private static final byte[] KEEPALIVE = Protocol.KEEPALIVE_FRAME.getBytes(StandardCharsets.UTF_8);

    private final ConnectionRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Executor writer;
    private final Duration interval;

    KeepAlivePinger(ConnectionRegistry registry, ScheduledExecutorService scheduler, Executor writer, Duration interval) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    /**
     * Starts pinging {@code connection} until it is done or {@code requestCancelled} completes.
     */
    ScheduledFuture<?> start(Connection connection, CompletableFuture<Void> requestCancelled) {
        long millis = interval.toMillis();
        ScheduledFuture<?> task = scheduler.scheduleAtFixedRate(
                () -> tick(connection), millis, millis, TimeUnit.MILLISECONDS);
        connection.onDone(() -> task.cancel(false));
        requestCancelled.whenComplete((v, t) -> task.cancel(false));
        return task;
    }

    private void tick(Connection connection) {
        if (connection.isDone()) {
            return;
        }
        try {
            writer.execute(() -> ping(connection));
        } catch (RejectedExecutionException e) {
            log.debug("Keepalive for client {} skipped, relay is shutting down", connection.id());
        }
    }

    void ping(Connection connection) {
        if (connection.isDone()) {
            return;
        }
        try {
            connection.write(KEEPALIVE);
        } catch (IOException e) {
            log.warn("Keepalive to client {} failed: {}", connection.id(), e.getMessage());
            registry.remove(connection);
        }
    }
}
