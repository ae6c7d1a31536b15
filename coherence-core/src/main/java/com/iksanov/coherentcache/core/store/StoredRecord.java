package com.iksanov.coherentcache.core.store;

import com.iksanov.coherentcache.common.model.CacheRecord;

/**
 * In-process holder pairing a record with its expiry deadline ({@code -1} for none).
 */
final class StoredRecord {
    final CacheRecord record;
    final long expireAtMillis;

    StoredRecord(CacheRecord record, long expireAtMillis) {
        this.record = record;
        this.expireAtMillis = expireAtMillis;
    }

    boolean isExpired(long nowMillis) {
        return expireAtMillis > 0 && nowMillis >= expireAtMillis;
    }
}
