package com.iksanov.coherentcache.core.config;

import com.iksanov.coherentcache.common.exception.ConfigurationException;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

public record CoherenceConfig(
        StoreType store,
        String redisAddress,
        int redisTimeoutMillis,
        int tombstoneRetentionSeconds,
        int maxRetries,
        int retryBackoffMillis,
        int maxKeyLength,
        int metricsPort
) {
    public enum StoreType {
        MEMORY,
        REDIS
    }

    public static final int DEFAULT_TOMBSTONE_RETENTION_SECONDS = 120;

    public CoherenceConfig {
        if (store == null) throw new ConfigurationException("Store type must be set");
        if (store == StoreType.REDIS && (redisAddress == null || redisAddress.isBlank()))
            throw new ConfigurationException("Redis address is required for the REDIS store");
        if (redisTimeoutMillis <= 0) throw new ConfigurationException("Redis timeout must be > 0");
        if (tombstoneRetentionSeconds <= 0) throw new ConfigurationException("Tombstone retention must be > 0");
        if (maxRetries < 0) throw new ConfigurationException("Max retries must be >= 0");
        if (retryBackoffMillis < 0) throw new ConfigurationException("Retry backoff must be >= 0");
        if (maxKeyLength <= 0) throw new ConfigurationException("Max key length must be > 0");
        if (metricsPort < 0 || metricsPort > 65535) throw new ConfigurationException("Invalid metrics port: " + metricsPort);
    }

    public static CoherenceConfig defaults() {
        return new CoherenceConfig(StoreType.MEMORY, "redis://127.0.0.1:6379", 3000,
                DEFAULT_TOMBSTONE_RETENTION_SECONDS, 3, 100, 1000, 8081);
    }

    public static CoherenceConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static CoherenceConfig fromEnv(Map<String, String> env) {
        CoherenceConfig d = defaults();
        return new CoherenceConfig(
                getEnvStore(env, d.store()),
                getEnv(env, "COHERENCE_REDIS_ADDRESS", d.redisAddress()),
                getEnvInt(env, "COHERENCE_REDIS_TIMEOUT_MILLIS", d.redisTimeoutMillis()),
                getEnvInt(env, "COHERENCE_TOMBSTONE_RETENTION_SECONDS", d.tombstoneRetentionSeconds()),
                getEnvInt(env, "COHERENCE_MAX_RETRIES", d.maxRetries()),
                getEnvInt(env, "COHERENCE_RETRY_BACKOFF_MILLIS", d.retryBackoffMillis()),
                getEnvInt(env, "COHERENCE_MAX_KEY_LENGTH", d.maxKeyLength()),
                getEnvInt(env, "COHERENCE_METRICS_PORT", d.metricsPort())
        );
    }

    public Duration tombstoneRetention() {
        return Duration.ofSeconds(tombstoneRetentionSeconds);
    }

    public Duration redisTimeout() {
        return Duration.ofMillis(redisTimeoutMillis);
    }

    @Override
    public String toString() {
        return String.format("CoherenceConfig[store=%s, redis=%s, timeout=%dms, retention=%ds, retries=%d/%dms, maxKeyLength=%d, metricsPort=%d]",
                store, redisAddress, redisTimeoutMillis, tombstoneRetentionSeconds, maxRetries, retryBackoffMillis, maxKeyLength, metricsPort);
    }

    private static StoreType getEnvStore(Map<String, String> env, StoreType def) {
        String v = env.get("COHERENCE_STORE");
        if (v == null || v.isBlank()) return def;
        try {
            return StoreType.valueOf(v.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown COHERENCE_STORE: " + v, e);
        }
    }

    private static String getEnv(Map<String, String> env, String key, String def) {
        String v = env.get(key);
        return v == null || v.isBlank() ? def : v;
    }

    private static int getEnvInt(Map<String, String> env, String key, int def) {
        String v = env.get(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + key + ": " + v, e);
        }
    }
}
