package com.iksanov.coherentcache.population;

import com.iksanov.coherentcache.common.codec.ValueCodec;
import com.iksanov.coherentcache.common.exception.CacheException;
import com.iksanov.coherentcache.common.model.LogicalTimestamp;
import com.iksanov.coherentcache.core.protocol.CoherenceProtocol;
import com.iksanov.coherentcache.population.jdbc.QueryExecutor;
import com.iksanov.coherentcache.population.jdbc.RowMapper;
import com.iksanov.coherentcache.population.jdbc.SqlStatement;
import com.iksanov.coherentcache.population.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;

/**
 * Read-through and write-invalidate glue between a relational source and the coherence protocol.
 * <p>
 * Fills are stamped with a timestamp taken <em>before</em> the source query runs, and
 * invalidations with a timestamp taken <em>after</em> the mutation commits. A fill that read
 * pre-update data is therefore always older than the update's invalidation and gets rejected,
 * whichever reaches the store first.
 * <p>
 * Cache failures on read paths fall back to the source. Failed fills are logged and dropped.
 * Failed invalidations are rethrown: the data was changed but stale entries may remain.
 */
public class PopulationPipeline<T> {

    private static final Logger log = LoggerFactory.getLogger(PopulationPipeline.class);
    private final CoherenceProtocol protocol;
    private final QueryExecutor executor;
    private final RowMapper<T> mapper;
    private final ValueCodec<T> codec;
    private final KeyDerivation<T> keys;
    private final Clock clock;
    private final PipelineMetrics metrics;

    public PopulationPipeline(CoherenceProtocol protocol,
                              QueryExecutor executor,
                              RowMapper<T> mapper,
                              ValueCodec<T> codec,
                              KeyDerivation<T> keys,
                              Clock clock,
                              PipelineMetrics metrics) {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Runs the query and caches every returned row under one pre-query timestamp.
     */
    public List<T> loadAndPopulate(SqlStatement query) {
        LogicalTimestamp ts = LogicalTimestamp.now(clock);
        List<T> rows = readSource(query);
        Map<String, T> byKey = new LinkedHashMap<>();
        for (T row : rows) byKey.put(keys.keyFor(row), row);
        populate(byKey, ts);
        return rows;
    }

    /**
     * Cached value for {@code key}, or the matching row from {@code query}, which is then cached.
     */
    public Optional<T> readThrough(String key, SqlStatement query) {
        Optional<T> cached = tryCache(key);
        if (cached.isPresent()) return cached;
        LogicalTimestamp ts = LogicalTimestamp.now(clock);
        Optional<T> row = findRow(key, readSource(query));
        row.ifPresent(value -> populate(Map.of(key, value), ts));
        return row;
    }

    /**
     * Like {@link #readThrough} but never fills the cache.
     */
    public Optional<T> lookup(String key, SqlStatement query) {
        Optional<T> cached = tryCache(key);
        if (cached.isPresent()) return cached;
        return findRow(key, readSource(query));
    }

    /**
     * Values for {@code requestedKeys} in order. Misses are resolved with one run of
     * {@code query}; keys found neither in the cache nor in the result are omitted.
     */
    public List<T> readThroughAll(List<String> requestedKeys, SqlStatement query) {
        Map<String, T> found = new HashMap<>();
        List<String> missing = new ArrayList<>();
        for (String key : requestedKeys) {
            Optional<T> cached = tryCache(key);
            if (cached.isPresent()) found.put(key, cached.get());
            else missing.add(key);
        }

        if (!missing.isEmpty()) {
            LogicalTimestamp ts = LogicalTimestamp.now(clock);
            Map<String, T> rowsByKey = new HashMap<>();
            for (T row : readSource(query)) rowsByKey.putIfAbsent(keys.keyFor(row), row);
            Map<String, T> fills = new LinkedHashMap<>();
            for (String key : missing) {
                T row = rowsByKey.get(key);
                if (row != null) fills.put(key, row);
            }
            found.putAll(fills);
            populate(fills, ts);
        }

        List<T> result = new ArrayList<>(requestedKeys.size());
        for (String key : requestedKeys) {
            T value = found.get(key);
            if (value != null) result.add(value);
        }
        return result;
    }

    /**
     * Applies the mutation, then invalidates {@code affectedKeys} as of the commit.
     *
     * @return rows affected by the mutation
     * @throws CacheException if any invalidation failed, after all keys were attempted
     */
    public int updateAndInvalidate(SqlStatement mutation, Collection<String> affectedKeys) {
        int updated = executor.update(mutation);
        invalidateKeys(affectedKeys);
        return updated;
    }

    /**
     * Invalidates every key as of now. All keys are attempted; the first failure is rethrown
     * with the others suppressed.
     */
    public void invalidateKeys(Collection<String> affectedKeys) {
        LogicalTimestamp ts = LogicalTimestamp.now(clock);
        CacheException first = null;
        for (String key : affectedKeys) {
            try {
                protocol.invalidate(key, ts);
            } catch (CacheException e) {
                metrics.recordInvalidationFailure();
                log.error("Failed to invalidate '{}' at {}, cached value may be stale", key, ts, e);
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }

    private Optional<T> tryCache(String key) {
        try {
            return protocol.get(key).value().map(codec::decode);
        } catch (CacheException e) {
            metrics.recordDegradedRead();
            log.warn("Cache read for '{}' failed, falling back to source: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private List<T> readSource(SqlStatement query) {
        metrics.recordSourceRead();
        return executor.query(query, mapper);
    }

    private Optional<T> findRow(String key, List<T> rows) {
        for (T row : rows) {
            if (key.equals(keys.keyFor(row))) return Optional.of(row);
        }
        return Optional.empty();
    }

    private void populate(Map<String, T> rowsByKey, LogicalTimestamp ts) {
        if (rowsByKey.isEmpty()) return;
        try {
            List<Map.Entry<String, byte[]>> pairs = new ArrayList<>(rowsByKey.size());
            rowsByKey.forEach((key, row) -> pairs.add(new AbstractMap.SimpleImmutableEntry<>(key, codec.encode(row))));
            protocol.setAll(pairs, ts);
        } catch (CacheException e) {
            metrics.recordPopulateFailure();
            log.warn("Failed to populate {} keys at {}: {}", rowsByKey.size(), ts, e.getMessage());
        }
    }
}
