package com.iksanov.coherentcache.core.store;

import com.iksanov.coherentcache.common.exception.TransientStoreException;
import com.iksanov.coherentcache.common.model.CacheRecord;

import java.time.Duration;
import java.util.Map;

/**
 * Shared store that executes {@link RecordOperation}s atomically per key.
 * <p>
 * Calls on the same key are linearizable: none observes another's intermediate state and each
 * call's write is visible before it returns. Calls on different keys are not ordered.
 * Failures surface as {@link com.iksanov.coherentcache.common.exception.TransientStoreException}
 * or {@link com.iksanov.coherentcache.common.exception.StoreCorruptionException}.
 */
public interface AtomicStore extends AutoCloseable {

    <R> R executeAtomic(String key, RecordOperation<R> operation);

    /**
     * Raw records of keys matching a glob pattern ({@code *} and {@code ?}), hidden ones included.
     * Diagnostics only: the result is not a consistent snapshot across keys.
     */
    Map<String, CacheRecord> scan(String pattern);

    void ping();

    /**
     * Retries {@link #ping()} until it succeeds.
     *
     * @return {@code true} once the store answered, {@code false} after {@code attempts} failures
     */
    default boolean awaitOnline(int attempts, Duration interval) {
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                ping();
                return true;
            } catch (TransientStoreException e) {
                if (attempt == attempts) return false;
                try {
                    Thread.sleep(interval.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return false;
    }

    @Override
    void close();
}
