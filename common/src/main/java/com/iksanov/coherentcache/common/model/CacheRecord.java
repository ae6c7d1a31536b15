package com.iksanov.coherentcache.common.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per-key state kept by the shared store.
 * <p>
 * {@code value} is {@code null} when no value was ever written. A record whose
 * {@code writeTs} is older than its {@code invalidateTs} keeps its bytes but is not visible.
 * The value bytes are copied on the way in and on the way out.
 */
public record CacheRecord(byte[] value, LogicalTimestamp writeTs, LogicalTimestamp invalidateTs) {

    public static final CacheRecord ABSENT = new CacheRecord(null, LogicalTimestamp.ZERO, LogicalTimestamp.ZERO);

    public CacheRecord {
        Objects.requireNonNull(writeTs, "writeTs");
        Objects.requireNonNull(invalidateTs, "invalidateTs");
        value = value == null ? null : value.clone();
    }

    @Override
    public byte[] value() {
        return value == null ? null : value.clone();
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean isFresh() {
        return !writeTs.isBefore(invalidateTs);
    }

    public boolean isVisible() {
        return hasValue() && isFresh();
    }

    public boolean isTombstone() {
        return !hasValue();
    }

    public CacheRecord withValue(byte[] newValue, LogicalTimestamp newWriteTs) {
        return new CacheRecord(Objects.requireNonNull(newValue, "value"), newWriteTs, invalidateTs);
    }

    public CacheRecord withInvalidation(LogicalTimestamp newInvalidateTs) {
        return new CacheRecord(value, writeTs, newInvalidateTs);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        CacheRecord that = (CacheRecord) obj;
        return Arrays.equals(value, that.value)
                && writeTs.equals(that.writeTs)
                && invalidateTs.equals(that.invalidateTs);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(writeTs, invalidateTs) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "CacheRecord{" +
                "value.length=" + (value == null ? "none" : value.length) +
                ", writeTs=" + writeTs +
                ", invalidateTs=" + invalidateTs +
                '}';
    }
}
