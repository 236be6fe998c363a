package com.signalplatform.signal.refresh;

import java.time.Duration;
import java.util.Objects;

/**
 * Cadence and deadlines of the refresh loop.
 *
 * @param interval       time between cycle starts
 * @param sourceTimeout  deadline for each source fetch
 * @param shutdownGrace  extra wait on shutdown beyond {@code sourceTimeout}
 */
public record RefreshSettings(Duration interval, Duration sourceTimeout, Duration shutdownGrace) {

    public static final Duration DEFAULT_INTERVAL       = Duration.ofSeconds(45);
    public static final Duration DEFAULT_SOURCE_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(5);

    public RefreshSettings {
        requirePositive("interval", interval);
        requirePositive("sourceTimeout", sourceTimeout);
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");
        if (shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("shutdownGrace must be >= 0, was " + shutdownGrace);
        }
    }

    public static RefreshSettings defaults() {
        return new RefreshSettings(DEFAULT_INTERVAL, DEFAULT_SOURCE_TIMEOUT, DEFAULT_SHUTDOWN_GRACE);
    }

    /** Upper bound on how long shutdown waits for an in-flight cycle. */
    public Duration shutdownWait() {
        return sourceTimeout.plus(shutdownGrace);
    }

    private static void requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0, was " + value);
        }
    }
}
