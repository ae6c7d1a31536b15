package com.iksanov.coherentcache.core.store.redis;

import com.iksanov.coherentcache.core.store.OperationKind;
import org.redisson.api.RScript;

/**
 * Server-side scripts, one per {@link OperationKind}, operating on a Redis hash in the
 * {@link com.iksanov.coherentcache.common.codec.RecordLayout} field layout.
 * <p>
 * Every script parses the timestamps it reads and fails with a {@code CORRUPT} error when a
 * field is malformed or missing its pair.
 */
final class CoherenceScripts {

    private CoherenceScripts() {}

    private static final String PRELUDE = """
            local function parse_ts(key, sec, nsec)
              if not sec and not nsec then
                return 0, 0
              end
              local s = tonumber(sec)
              local n = tonumber(nsec)
              if s == nil or n == nil then
                error('CORRUPT record ' .. key .. ' has a malformed or unpaired timestamp')
              end
              return s, n
            end

            local function older(sec, nsec, than_sec, than_nsec)
              return sec < than_sec or (sec == than_sec and nsec < than_nsec)
            end
            """;

    /**
     * KEYS[1] = key, ARGV = value, ts_sec, ts_nsec. Returns 1 when stored, 0 when rejected.
     */
    static final String SET = PRELUDE + """
            local key = KEYS[1]
            local in_sec = tonumber(ARGV[2])
            local in_nsec = tonumber(ARGV[3])
            local f = redis.call('HMGET', key, 'ts_sec', 'ts_nsec', 'inv_sec', 'inv_nsec')
            local ts_sec, ts_nsec = parse_ts(key, f[1], f[2])
            local inv_sec, inv_nsec = parse_ts(key, f[3], f[4])
            if older(in_sec, in_nsec, inv_sec, inv_nsec) or older(in_sec, in_nsec, ts_sec, ts_nsec) then
              return 0
            end
            redis.call('HSET', key, 'ts_sec', ARGV[2], 'ts_nsec', ARGV[3], 'v', ARGV[1])
            redis.call('PERSIST', key)
            return 1
            """;

    /**
     * KEYS[1] = key, ARGV = inv_sec, inv_nsec, retention seconds. Returns 1 when recorded,
     * 0 when a later invalidation already exists. Records without a value expire after the
     * retention window.
     */
    static final String INVALIDATE = PRELUDE + """
            local key = KEYS[1]
            local in_sec = tonumber(ARGV[1])
            local in_nsec = tonumber(ARGV[2])
            local f = redis.call('HMGET', key, 'inv_sec', 'inv_nsec', 'v')
            local inv_sec, inv_nsec = parse_ts(key, f[1], f[2])
            if older(in_sec, in_nsec, inv_sec, inv_nsec) then
              return 0
            end
            redis.call('HSET', key, 'inv_sec', ARGV[1], 'inv_nsec', ARGV[2])
            if not f[3] then
              redis.call('EXPIRE', key, tonumber(ARGV[3]))
            end
            return 1
            """;

    /**
     * KEYS[1] = key. Returns the value, or nil when absent, never written or invalidated.
     */
    static final String GET = PRELUDE + """
            local key = KEYS[1]
            local f = redis.call('HMGET', key, 'ts_sec', 'ts_nsec', 'inv_sec', 'inv_nsec', 'v')
            local ts_sec, ts_nsec = parse_ts(key, f[1], f[2])
            local inv_sec, inv_nsec = parse_ts(key, f[3], f[4])
            if not f[5] then
              return false
            end
            if older(ts_sec, ts_nsec, inv_sec, inv_nsec) then
              return false
            end
            return f[5]
            """;

    static final String INSPECT = """
            return redis.call('HGETALL', KEYS[1])
            """;

    static final String PING = "return redis.call('PING')";

    static String source(OperationKind kind) {
        return switch (kind) {
            case SET -> SET;
            case INVALIDATE -> INVALIDATE;
            case GET -> GET;
            case INSPECT -> INSPECT;
        };
    }

    static RScript.ReturnType returnType(OperationKind kind) {
        return switch (kind) {
            case SET, INVALIDATE -> RScript.ReturnType.INTEGER;
            case GET -> RScript.ReturnType.VALUE;
            case INSPECT -> RScript.ReturnType.MULTI;
        };
    }

    static RScript.Mode mode(OperationKind kind) {
        return kind.isReadOnly() ? RScript.Mode.READ_ONLY : RScript.Mode.READ_WRITE;
    }
}
