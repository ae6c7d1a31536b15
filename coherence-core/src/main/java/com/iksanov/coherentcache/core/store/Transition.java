package com.iksanov.coherentcache.core.store;

import com.iksanov.coherentcache.common.model.CacheRecord;

import java.util.Objects;

/**
 * Outcome of applying a {@link RecordOperation} to the current record.
 *
 * @param next      record to store, or {@code null} to leave the current one untouched
 * @param retention what happens to the key's expiry when {@code next} is stored
 * @param result    value returned to the caller
 */
public record Transition<R>(CacheRecord next, Retention retention, R result) {

    public enum Retention {
        KEEP,
        REFRESH,
        CLEAR
    }

    public Transition {
        Objects.requireNonNull(retention, "retention");
    }

    public static <R> Transition<R> unchanged(R result) {
        return new Transition<>(null, Retention.KEEP, result);
    }

    public static <R> Transition<R> write(CacheRecord next, Retention retention, R result) {
        return new Transition<>(Objects.requireNonNull(next, "next"), retention, result);
    }

    public boolean changesRecord() {
        return next != null;
    }
}
