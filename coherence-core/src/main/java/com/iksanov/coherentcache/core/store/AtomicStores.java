package com.iksanov.coherentcache.core.store;

import com.iksanov.coherentcache.core.config.CoherenceConfig;
import com.iksanov.coherentcache.core.metrics.CoherenceMetrics;
import com.iksanov.coherentcache.core.store.redis.RedisAtomicStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

public final class AtomicStores {

    private static final Logger log = LoggerFactory.getLogger(AtomicStores.class);

    private AtomicStores() {}

    public static AtomicStore create(CoherenceConfig config, CoherenceMetrics metrics) {
        log.info("Creating store from {}", config);
        return switch (config.store()) {
            case MEMORY -> new InMemoryAtomicStore(config.tombstoneRetention(), Clock.systemUTC(), metrics);
            case REDIS -> RedisAtomicStore.connect(config.redisAddress(), config.redisTimeout(), config.tombstoneRetention());
        };
    }
}
