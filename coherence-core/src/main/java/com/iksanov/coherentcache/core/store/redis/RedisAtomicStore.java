package com.iksanov.coherentcache.core.store.redis;

import com.iksanov.coherentcache.common.codec.RecordLayout;
import com.iksanov.coherentcache.common.exception.CacheException;
import com.iksanov.coherentcache.common.exception.StoreCorruptionException;
import com.iksanov.coherentcache.common.exception.TransientStoreException;
import com.iksanov.coherentcache.common.model.CacheRecord;
import com.iksanov.coherentcache.core.store.AtomicStore;
import com.iksanov.coherentcache.core.store.InspectOperation;
import com.iksanov.coherentcache.core.store.OperationKind;
import com.iksanov.coherentcache.core.store.RecordOperation;
import org.redisson.Redisson;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisConnectionException;
import org.redisson.client.RedisException;
import org.redisson.client.RedisTimeoutException;
import org.redisson.client.WriteRedisConnectionException;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@link AtomicStore} backed by Redis hashes. Each operation is a single Lua script, so Redis'
 * single-threaded script execution provides the per-key atomicity.
 */
public class RedisAtomicStore implements AtomicStore {

    private static final Logger log = LoggerFactory.getLogger(RedisAtomicStore.class);
    private final RedissonClient client;
    private final boolean ownsClient;
    private final byte[] retentionSeconds;
    private final ScriptRegistry scripts;

    /**
     * Wraps an existing client. The caller keeps ownership and shuts it down.
     */
    public RedisAtomicStore(RedissonClient client, Duration tombstoneRetention) {
        this(client, tombstoneRetention, false);
    }

    private RedisAtomicStore(RedissonClient client, Duration tombstoneRetention, boolean ownsClient) {
        this.client = Objects.requireNonNull(client, "client");
        Objects.requireNonNull(tombstoneRetention, "tombstoneRetention");
        if (tombstoneRetention.getSeconds() <= 0) {
            throw new IllegalArgumentException("tombstoneRetention must be at least one second");
        }
        this.ownsClient = ownsClient;
        this.retentionSeconds = RecordLayout.encodeNumber(tombstoneRetention.getSeconds());
        this.scripts = new ScriptRegistry(client);
    }

    /**
     * Connects to a single Redis server and loads the scripts.
     *
     * @throws TransientStoreException if the server cannot be reached
     */
    public static RedisAtomicStore connect(String address, Duration timeout, Duration tombstoneRetention) {
        Config config = new Config();
        config.useSingleServer()
                .setAddress(address)
                .setTimeout((int) timeout.toMillis())
                .setConnectTimeout((int) timeout.toMillis());
        RedissonClient client;
        try {
            client = Redisson.create(config);
        } catch (RedisException e) {
            throw translate("connect", address, e);
        }
        RedisAtomicStore store = new RedisAtomicStore(client, tombstoneRetention, true);
        try {
            store.loadScripts();
        } catch (CacheException e) {
            client.shutdown();
            throw e;
        }
        log.info("RedisAtomicStore connected to {} (retention={}s)", address, tombstoneRetention.getSeconds());
        return store;
    }

    /**
     * Loads every script up front. Without this, scripts load lazily on first use.
     */
    public void loadScripts() {
        try {
            scripts.loadAll();
        } catch (RedisException e) {
            throw translate("load scripts", "*", e);
        }
    }

    @Override
    public <R> R executeAtomic(String key, RecordOperation<R> operation) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(operation, "operation");
        OperationKind kind = operation.kind();
        Object reply;
        try {
            reply = scripts.evalSha(kind, Collections.singletonList(key), arguments(operation));
        } catch (RedisException e) {
            throw translate(kind.name(), key, e);
        }
        return operation.decodeReply(reply);
    }

    @Override
    public Map<String, CacheRecord> scan(String pattern) {
        Map<String, CacheRecord> result = new TreeMap<>();
        try {
            for (String key : client.getKeys().getKeysByPattern(pattern)) {
                CacheRecord record = executeAtomic(key, new InspectOperation(key));
                if (!record.equals(CacheRecord.ABSENT)) result.put(key, record);
            }
        } catch (RedisException e) {
            throw translate("SCAN", pattern, e);
        }
        return result;
    }

    @Override
    public void ping() {
        try {
            client.getScript(StringCodec.INSTANCE).eval(RScript.Mode.READ_ONLY, CoherenceScripts.PING, RScript.ReturnType.STATUS);
        } catch (RedisException e) {
            throw new TransientStoreException("Redis did not answer PING: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (ownsClient && !client.isShutdown()) {
            client.shutdown();
            log.info("RedisAtomicStore closed");
        }
    }

    private Object[] arguments(RecordOperation<?> operation) {
        List<Object> args = new ArrayList<>(operation.scriptArguments());
        if (operation.kind() == OperationKind.INVALIDATE) args.add(retentionSeconds);
        return args.toArray();
    }

    static CacheException translate(String operation, String key, RedisException e) {
        if (e instanceof RedisConnectionException
                || e instanceof RedisTimeoutException
                || e instanceof WriteRedisConnectionException) {
            return new TransientStoreException(operation + " on '" + key + "' failed: " + e.getMessage(), e);
        }
        String message = String.valueOf(e.getMessage());
        if (message.contains("CORRUPT") || message.contains("WRONGTYPE")) {
            return new StoreCorruptionException("Corrupt record '" + key + "': " + message, e);
        }
        return new CacheException(operation + " on '" + key + "' failed: " + message, e);
    }
}
