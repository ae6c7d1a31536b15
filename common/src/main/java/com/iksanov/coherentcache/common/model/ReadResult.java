package com.iksanov.coherentcache.common.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a freshness-checked read: either the stored bytes or a miss. Each call to
 * {@link #value()} returns a fresh copy.
 */
public final class ReadResult {

    private static final ReadResult MISS = new ReadResult(null);
    private final byte[] value;

    private ReadResult(byte[] value) {
        this.value = value;
    }

    public static ReadResult miss() {
        return MISS;
    }

    public static ReadResult value(byte[] value) {
        return new ReadResult(Objects.requireNonNull(value, "value").clone());
    }

    public boolean isHit() {
        return value != null;
    }

    public boolean isMiss() {
        return value == null;
    }

    public Optional<byte[]> value() {
        return Optional.ofNullable(value).map(byte[]::clone);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ReadResult that)) return false;
        return Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return isMiss() ? "Miss" : "Value(length=" + value.length + ")";
    }
}
