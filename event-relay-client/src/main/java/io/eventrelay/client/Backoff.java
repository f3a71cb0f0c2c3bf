package io.eventrelay.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential reconnect delay: starts at the initial delay, doubles after each failed attempt, capped at
 * the maximum. Not thread-safe; the client only touches it from one connect at a time.
 */
public final class Backoff {
    private final Duration initial;
    private final Duration max;
    private Duration current;

    public Backoff(Duration initial, Duration max) {
        this.initial = Objects.requireNonNull(initial, "initial");
        this.max = Objects.requireNonNull(max, "max");
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial must be positive");
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max must not be smaller than initial");
        }
        this.current = initial;
    }

    /**
     * Delay to wait after failed attempt {@code attempt} (1-based): {@code min(initial * 2^(attempt-1), max)}.
     */
    public static Duration delayForAttempt(Duration initial, Duration max, int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        Duration d = initial;
        for (int i = 1; i < attempt && d.compareTo(max) < 0; i++) {
            d = d.multipliedBy(2);
        }
        return d.compareTo(max) > 0 ? max : d;
    }

    /**
     * Returns the delay for the current failure and advances to the next one.
     */
    public Duration next() {
        Duration d = current;
        Duration doubled = current.multipliedBy(2);
        current = doubled.compareTo(max) > 0 ? max : doubled;
        return d;
    }

    public Duration current() {
        return current;
    }

    public void reset() {
        current = initial;
    }
}
