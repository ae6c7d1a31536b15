package com.iksanov.coherentcache.core.store.redis;

import com.iksanov.coherentcache.core.store.OperationKind;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caches script SHAs and reloads a script when the server answers {@code NOSCRIPT}
 * (after a restart or {@code SCRIPT FLUSH}).
 */
final class ScriptRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScriptRegistry.class);
    private static final String NOSCRIPT_ERROR_PREFIX = "NOSCRIPT";
    private final RedissonClient client;
    private final Map<OperationKind, AtomicReference<String>> shas = new EnumMap<>(OperationKind.class);

    ScriptRegistry(RedissonClient client) {
        this.client = client;
        for (OperationKind kind : OperationKind.values()) {
            shas.put(kind, new AtomicReference<>());
        }
    }

    void loadAll() {
        for (OperationKind kind : OperationKind.values()) {
            shas.get(kind).set(load(kind));
        }
        log.info("Loaded {} coherence scripts", shas.size());
    }

    Object evalSha(OperationKind kind, List<Object> keys, Object[] args) {
        RScript script = client.getScript(ByteArrayCodec.INSTANCE);
        String sha = shas.get(kind).updateAndGet(current -> current != null ? current : load(kind));
        try {
            return script.evalSha(CoherenceScripts.mode(kind), sha, CoherenceScripts.returnType(kind), keys, args);
        } catch (RedisException e) {
            if (!isNoscriptError(e)) throw e;
            log.warn("Script for {} missing on server, reloading", kind);
            String reloaded = load(kind);
            shas.get(kind).set(reloaded);
            return script.evalSha(CoherenceScripts.mode(kind), reloaded, CoherenceScripts.returnType(kind), keys, args);
        }
    }

    private String load(OperationKind kind) {
        String sha = client.getScript(StringCodec.INSTANCE).scriptLoad(CoherenceScripts.source(kind));
        log.debug("Script for {} loaded: {}", kind, sha);
        return sha;
    }

    private static boolean isNoscriptError(Throwable e) {
        String message = e.getMessage();
        if (message != null && message.contains(NOSCRIPT_ERROR_PREFIX)) return true;
        Throwable cause = e.getCause();
        return cause != null && cause != e && isNoscriptError(cause);
    }
}
