package com.iksanov.coherentcache.core.store;

import com.google.common.util.concurrent.Striped;
import com.iksanov.coherentcache.common.codec.RecordLayout;
import com.iksanov.coherentcache.common.model.CacheRecord;
import com.iksanov.coherentcache.core.metrics.CoherenceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * In-process {@link AtomicStore}.
 * <p>
 * Every operation runs under a striped per-key lock, so two operations on the same key never
 * interleave between the read and the write. Expired tombstones are treated as absent on access
 * and swept lazily every {@value #LAZY_CLEANUP_INTERVAL} writes. Each sweep continues where the
 * previous one stopped and checks more entries than writes happened since, so expired tombstones
 * of keys that are never touched again are still reclaimed.
 */
public class InMemoryAtomicStore implements AtomicStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAtomicStore.class);
    private static final int LOCK_STRIPES = 64;
    private static final int LAZY_CLEANUP_INTERVAL = 100;
    private static final int LAZY_CLEANUP_MAX_CHECKS = 2 * LAZY_CLEANUP_INTERVAL;
    private final ConcurrentMap<String, StoredRecord> store = new ConcurrentHashMap<>();
    private final Striped<Lock> locks = Striped.lock(LOCK_STRIPES);
    private final AtomicInteger writeCounter = new AtomicInteger();
    private final ReentrantLock cleanupLock = new ReentrantLock();
    private Iterator<Map.Entry<String, StoredRecord>> cleanupCursor = Collections.emptyIterator();
    private final long retentionMillis;
    private final Clock clock;
    private final CoherenceMetrics metrics;

    public InMemoryAtomicStore(Duration tombstoneRetention) {
        this(tombstoneRetention, Clock.systemUTC(), new CoherenceMetrics());
    }

    public InMemoryAtomicStore(Duration tombstoneRetention, Clock clock, CoherenceMetrics metrics) {
        Objects.requireNonNull(tombstoneRetention, "tombstoneRetention");
        if (tombstoneRetention.isNegative() || tombstoneRetention.isZero()) {
            throw new IllegalArgumentException("tombstoneRetention must be > 0");
        }
        this.retentionMillis = tombstoneRetention.toMillis();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        log.info("InMemoryAtomicStore initialized: tombstoneRetention={}ms, lockStripes={}", retentionMillis, LOCK_STRIPES);
    }

    @Override
    public <R> R executeAtomic(String key, RecordOperation<R> operation) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(operation, "operation");

        Transition<R> transition;
        Lock lock = locks.get(key);
        lock.lock();
        try {
            long now = clock.millis();
            StoredRecord stored = liveRecord(key, now);
            CacheRecord current = stored == null ? CacheRecord.ABSENT : stored.record;
            transition = operation.apply(current);
            if (transition.changesRecord()) {
                store.put(key, new StoredRecord(transition.next(), expiryFor(transition.retention(), stored, now)));
            }
        } finally {
            lock.unlock();
        }

        if (transition.changesRecord()) {
            metrics.updateSize(store.size());
            if (writeCounter.incrementAndGet() % LAZY_CLEANUP_INTERVAL == 0) lazyCleanupExpired();
        }
        return transition.result();
    }

    @Override
    public Map<String, CacheRecord> scan(String pattern) {
        Pattern regex = GlobPattern.compile(pattern);
        long now = clock.millis();
        Map<String, CacheRecord> result = new TreeMap<>();
        for (Map.Entry<String, StoredRecord> entry : store.entrySet()) {
            if (regex.matcher(entry.getKey()).matches() && !entry.getValue().isExpired(now)) {
                result.put(entry.getKey(), entry.getValue().record);
            }
        }
        return result;
    }

    @Override
    public void ping() {
        // always reachable
    }

    public int size() {
        return store.size();
    }

    public void clear() {
        store.clear();
        metrics.updateSize(0);
        log.info("Store cleared");
    }

    @Override
    public void close() {
        clear();
        log.info("Store closed");
    }

    /**
     * Live records in the persisted field layout. Expiry deadlines are not exported.
     */
    public Map<String, Map<String, byte[]>> exportData() {
        long now = clock.millis();
        Map<String, Map<String, byte[]>> data = new HashMap<>();
        store.forEach((key, stored) -> {
            if (!stored.isExpired(now)) data.put(key, RecordLayout.toFields(stored.record));
        });
        return data;
    }

    /**
     * Replaces the store contents. Imported tombstones start a fresh retention window.
     */
    public void importData(Map<String, Map<String, byte[]>> data) {
        Map<String, StoredRecord> parsed = new HashMap<>();
        long now = clock.millis();
        data.forEach((key, fields) -> {
            CacheRecord record = RecordLayout.fromFields(key, fields);
            long expireAt = record.isTombstone() ? now + retentionMillis : -1;
            parsed.put(key, new StoredRecord(record, expireAt));
        });
        store.clear();
        store.putAll(parsed);
        metrics.updateSize(store.size());
        log.info("Imported {} records", parsed.size());
    }

    private StoredRecord liveRecord(String key, long now) {
        StoredRecord stored = store.get(key);
        if (stored != null && stored.isExpired(now)) {
            store.remove(key, stored);
            return null;
        }
        return stored;
    }

    private long expiryFor(Transition.Retention retention, StoredRecord previous, long now) {
        return switch (retention) {
            case REFRESH -> now + retentionMillis;
            case CLEAR -> -1;
            case KEEP -> previous == null ? -1 : previous.expireAtMillis;
        };
    }

    private void lazyCleanupExpired() {
        if (!cleanupLock.tryLock()) return;
        int cleaned = 0;
        try {
            long now = clock.millis();
            int maxChecks = Math.min(LAZY_CLEANUP_MAX_CHECKS, store.size());
            for (int i = 0; i < maxChecks; i++) {
                if (!cleanupCursor.hasNext()) {
                    cleanupCursor = store.entrySet().iterator();
                    if (!cleanupCursor.hasNext()) break;
                }
                Map.Entry<String, StoredRecord> entry = cleanupCursor.next();
                if (!entry.getValue().isExpired(now)) continue;
                Lock lock = locks.get(entry.getKey());
                if (!lock.tryLock()) continue;
                try {
                    if (store.remove(entry.getKey(), entry.getValue())) cleaned++;
                } finally {
                    lock.unlock();
                }
            }
        } finally {
            cleanupLock.unlock();
        }
        if (cleaned > 0) {
            metrics.updateSize(store.size());
            log.debug("Lazy cleanup removed {} expired tombstones", cleaned);
        }
    }
}
