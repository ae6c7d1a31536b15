package com.iksanov.coherentcache.core.protocol;

import com.iksanov.coherentcache.common.exception.CacheException;
import com.iksanov.coherentcache.common.exception.InvalidCacheRequestException;
import com.iksanov.coherentcache.common.exception.TransientStoreException;
import com.iksanov.coherentcache.common.model.CacheRecord;
import com.iksanov.coherentcache.common.model.LogicalTimestamp;
import com.iksanov.coherentcache.common.model.ReadResult;
import com.iksanov.coherentcache.common.model.WriteOutcome;
import com.iksanov.coherentcache.core.config.CoherenceConfig;
import com.iksanov.coherentcache.core.metrics.CoherenceMetrics;
import com.iksanov.coherentcache.core.store.AtomicStore;
import com.iksanov.coherentcache.core.store.RecordOperation;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Timestamp-ordered cache coherence over an {@link AtomicStore}.
 * <p>
 * Each call is one atomic store operation on one key. Writers pass the logical time of the data
 * they write; invalidators pass the logical time of the change that made it stale. A write older
 * than the latest invalidation, or older than the value already cached, is rejected, so a slow
 * populate can never resurrect data that a later update invalidated.
 * <p>
 * {@link TransientStoreException}s are retried with linear backoff since every operation is
 * idempotent for fixed arguments. Once retries are exhausted the outcome of a write is unknown
 * and the exception propagates. Store errors are never reported as a miss or a rejection.
 */
public class CoherenceProtocol {

    private static final Logger log = LoggerFactory.getLogger(CoherenceProtocol.class);
    private final AtomicStore store;
    private final CoherenceMetrics metrics;
    private final int maxRetries;
    private final long retryBackoffMillis;
    private final int maxKeyLength;

    public CoherenceProtocol(AtomicStore store, CoherenceMetrics metrics) {
        this(store, metrics, CoherenceConfig.defaults());
    }

    public CoherenceProtocol(AtomicStore store, CoherenceMetrics metrics, CoherenceConfig config) {
        this(store, metrics, config.maxRetries(), config.retryBackoffMillis(), config.maxKeyLength());
    }

    public CoherenceProtocol(AtomicStore store, CoherenceMetrics metrics, int maxRetries, long retryBackoffMillis, int maxKeyLength) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (retryBackoffMillis < 0) throw new IllegalArgumentException("retryBackoffMillis must be >= 0");
        if (maxKeyLength <= 0) throw new IllegalArgumentException("maxKeyLength must be > 0");
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.maxRetries = maxRetries;
        this.retryBackoffMillis = retryBackoffMillis;
        this.maxKeyLength = maxKeyLength;
    }

    /**
     * Stores {@code value} as of {@code ts} unless the key was invalidated after {@code ts} or
     * already holds a value written after {@code ts}.
     */
    public WriteOutcome set(String key, byte[] value, LogicalTimestamp ts) {
        validateKey(key);
        validateValue(value);
        validateTimestamp(ts);
        return doSet(key, value, ts);
    }

    /**
     * Marks everything cached under {@code key} before {@code ts} as stale. Rejected only when a
     * later invalidation is already recorded.
     */
    public WriteOutcome invalidate(String key, LogicalTimestamp ts) {
        validateKey(key);
        validateTimestamp(ts);
        return doInvalidate(key, ts);
    }

    /**
     * Freshness-checked read. Never mutates the store.
     */
    public ReadResult get(String key) {
        validateKey(key);
        Timer.Sample sample = metrics.startTimer();
        try {
            ReadResult result = executeWithRetry(key, GetOperation.INSTANCE);
            if (result.isHit()) {
                metrics.recordHit();
            } else {
                metrics.recordMiss();
            }
            log.debug("GET '{}' -> {}", key, result);
            return result;
        } catch (CacheException e) {
            metrics.recordError("get", e);
            log.warn("GET '{}' failed: {}", key, e.getMessage());
            throw e;
        } finally {
            metrics.stopGetTimer(sample);
        }
    }

    /**
     * Sets every pair with the same timestamp, one atomic call per key in input order.
     * All keys are validated before the first write.
     *
     * @return outcomes in input order
     */
    public List<WriteOutcome> setAll(List<Map.Entry<String, byte[]>> orderedPairs, LogicalTimestamp ts) {
        Objects.requireNonNull(orderedPairs, "orderedPairs");
        validateTimestamp(ts);
        for (Map.Entry<String, byte[]> pair : orderedPairs) {
            validateKey(pair.getKey());
            validateValue(pair.getValue());
        }
        List<WriteOutcome> outcomes = new ArrayList<>(orderedPairs.size());
        for (Map.Entry<String, byte[]> pair : orderedPairs) {
            outcomes.add(doSet(pair.getKey(), pair.getValue(), ts));
        }
        return outcomes;
    }

    public List<WriteOutcome> invalidateAll(Collection<String> keys, LogicalTimestamp ts) {
        Objects.requireNonNull(keys, "keys");
        validateTimestamp(ts);
        keys.forEach(this::validateKey);
        List<WriteOutcome> outcomes = new ArrayList<>(keys.size());
        for (String key : keys) {
            outcomes.add(doInvalidate(key, ts));
        }
        return outcomes;
    }

    /**
     * Raw records of matching keys, including invalidated ones. Not a consistent snapshot.
     */
    public Map<String, CacheRecord> scan(String pattern) {
        if (pattern == null || pattern.isBlank()) throw new InvalidCacheRequestException("Pattern cannot be null or empty");
        return store.scan(pattern);
    }

    private WriteOutcome doSet(String key, byte[] value, LogicalTimestamp ts) {
        Timer.Sample sample = metrics.startTimer();
        try {
            WriteOutcome outcome = executeWithRetry(key, new SetOperation(value, ts));
            metrics.recordSet(outcome);
            log.debug("SET '{}' at {} -> {}", key, ts, outcome);
            return outcome;
        } catch (CacheException e) {
            metrics.recordError("set", e);
            log.warn("SET '{}' at {} failed: {}", key, ts, e.getMessage());
            throw e;
        } finally {
            metrics.stopSetTimer(sample);
        }
    }

    private WriteOutcome doInvalidate(String key, LogicalTimestamp ts) {
        Timer.Sample sample = metrics.startTimer();
        try {
            WriteOutcome outcome = executeWithRetry(key, new InvalidateOperation(ts));
            metrics.recordInvalidate(outcome);
            log.debug("INVALIDATE '{}' at {} -> {}", key, ts, outcome);
            return outcome;
        } catch (CacheException e) {
            metrics.recordError("invalidate", e);
            log.warn("INVALIDATE '{}' at {} failed: {}", key, ts, e.getMessage());
            throw e;
        } finally {
            metrics.stopInvalidateTimer(sample);
        }
    }

    private <R> R executeWithRetry(String key, RecordOperation<R> operation) {
        TransientStoreException lastException = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return store.executeAtomic(key, operation);
            } catch (TransientStoreException e) {
                lastException = e;
                log.warn("Transient failure on attempt {}/{} for {} '{}': {}",
                        attempt + 1, maxRetries + 1, operation.kind(), key, e.getMessage());
            }
            if (attempt < maxRetries) {
                metrics.recordRetry();
                try {
                    Thread.sleep(retryBackoffMillis * (attempt + 1));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TransientStoreException("Interrupted during retry", ie);
                }
            }
        }
        throw lastException;
    }

    private void validateKey(String key) {
        if (key == null || key.isBlank()) throw new InvalidCacheRequestException("Key cannot be null or empty");
        if (key.length() > maxKeyLength) throw new InvalidCacheRequestException("Key too long (max " + maxKeyLength + " chars)");
    }

    private void validateValue(byte[] value) {
        if (value == null) throw new InvalidCacheRequestException("Value cannot be null");
    }

    private void validateTimestamp(LogicalTimestamp ts) {
        if (ts == null) throw new InvalidCacheRequestException("Timestamp cannot be null");
    }
}
