package io.eventrelay.server.core;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A registered streaming session.
 *
 * <p>All writes to the sink go through {@link #write(byte[])}, which holds the connection's own lock so
 * that event frames and keepalive comments never interleave. The done signal completes once, when the
 * connection leaves the registry.
 */
public final class Connection {
    private final String id;
    private final EventSink sink;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    public Connection(String id, EventSink sink) {
        this.id = Objects.requireNonNull(id, "id");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("id must not be empty");
        }
    }

    public String id() {
        return id;
    }

    /**
     * Writes and flushes one frame under the connection's write lock.
     *
     * @throws InterruptedIOException if the calling thread is interrupted while waiting for the lock
     * @throws IOException if the sink fails
     */
    public void write(byte[] frame) throws IOException {
        try {
            writeLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted waiting to write to " + id);
        }
        try {
            sink.write(frame);
            sink.flush();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Like {@link #write(byte[])}, but waits at most {@code timeout} for a concurrent writer to finish.
     *
     * @return {@code false} if the lock was not acquired in time; nothing was written
     * @throws InterruptedIOException if the calling thread is interrupted while waiting for the lock
     */
    public boolean tryWrite(byte[] frame, long timeout, TimeUnit unit) throws IOException {
        try {
            if (!writeLock.tryLock(timeout, unit)) {
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted waiting to write to " + id);
        }
        try {
            sink.write(frame);
            sink.flush();
        } finally {
            writeLock.unlock();
        }
        return true;
    }

    public boolean isDone() {
        return done.isDone();
    }

    /**
     * Runs {@code action} once the connection is removed, immediately if it already is.
     */
    public void onDone(Runnable action) {
        done.thenRun(action);
    }

    CompletableFuture<Void> doneSignal() {
        return done;
    }

    /** @return {@code true} only for the call that actually fired the signal */
    boolean signalDone() {
        return done.complete(null);
    }

    @Override
    public String toString() {
        return "Connection[" + id + "]";
    }
}
