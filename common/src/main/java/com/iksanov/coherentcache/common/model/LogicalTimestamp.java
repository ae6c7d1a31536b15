package com.iksanov.coherentcache.common.model;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Caller-supplied (seconds, nanoseconds) pair that orders writes and invalidations of a key.
 * <p>
 * Ordered by seconds, then nanoseconds. Timestamps come from the writer's clock, so two writers
 * on different machines are only ordered as well as their clocks agree. Seconds are capped at
 * {@link #MAX_SECONDS} so that server-side scripts, which hold numbers as doubles, order them exactly.
 */
public record LogicalTimestamp(long seconds, int nanoseconds) implements Comparable<LogicalTimestamp> {

    public static final LogicalTimestamp ZERO = new LogicalTimestamp(0, 0);
    public static final long MAX_SECONDS = 1L << 53;
    private static final int NANOS_PER_SECOND = 1_000_000_000;

    public LogicalTimestamp {
        if (seconds < 0 || seconds > MAX_SECONDS) {
            throw new IllegalArgumentException("seconds must be in [0, " + MAX_SECONDS + "]: " + seconds);
        }
        if (nanoseconds < 0 || nanoseconds >= NANOS_PER_SECOND) {
            throw new IllegalArgumentException("nanoseconds must be in [0, 999999999]: " + nanoseconds);
        }
    }

    public static LogicalTimestamp of(long seconds, int nanoseconds) {
        return new LogicalTimestamp(seconds, nanoseconds);
    }

    public static LogicalTimestamp ofInstant(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        return new LogicalTimestamp(instant.getEpochSecond(), instant.getNano());
    }

    public static LogicalTimestamp now(Clock clock) {
        Objects.requireNonNull(clock, "clock");
        return ofInstant(clock.instant());
    }

    @Override
    public int compareTo(LogicalTimestamp other) {
        int bySeconds = Long.compare(seconds, other.seconds);
        return bySeconds != 0 ? bySeconds : Integer.compare(nanoseconds, other.nanoseconds);
    }

    public boolean isBefore(LogicalTimestamp other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(LogicalTimestamp other) {
        return compareTo(other) > 0;
    }

    public static LogicalTimestamp max(LogicalTimestamp a, LogicalTimestamp b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public Instant toInstant() {
        return Instant.ofEpochSecond(seconds, nanoseconds);
    }

    @Override
    public String toString() {
        return seconds + "." + String.format("%09d", nanoseconds);
    }
}
