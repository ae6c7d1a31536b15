package com.iksanov.coherentcache.core.protocol;

import com.iksanov.coherentcache.common.codec.ValueCodec;
import com.iksanov.coherentcache.common.model.LogicalTimestamp;
import com.iksanov.coherentcache.common.model.WriteOutcome;

import java.time.Clock;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed view of a {@link CoherenceProtocol}. Values go through a {@link ValueCodec}; calls
 * without an explicit timestamp take one from the clock.
 */
public class TypedCoherentCache<V> {

    private final CoherenceProtocol protocol;
    private final ValueCodec<V> codec;
    private final Clock clock;

    public TypedCoherentCache(CoherenceProtocol protocol, ValueCodec<V> codec) {
        this(protocol, codec, Clock.systemUTC());
    }

    public TypedCoherentCache(CoherenceProtocol protocol, ValueCodec<V> codec, Clock clock) {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Optional<V> get(String key) {
        return protocol.get(key).value().map(codec::decode);
    }

    public WriteOutcome put(String key, V value) {
        return put(key, value, now());
    }

    public WriteOutcome put(String key, V value, LogicalTimestamp ts) {
        return protocol.set(key, codec.encode(value), ts);
    }

    /**
     * Writes all entries with one timestamp, in the map's iteration order.
     */
    public List<WriteOutcome> putAll(Map<String, V> values, LogicalTimestamp ts) {
        List<Map.Entry<String, byte[]>> pairs = new ArrayList<>(values.size());
        values.forEach((key, value) -> pairs.add(new AbstractMap.SimpleImmutableEntry<>(key, codec.encode(value))));
        return protocol.setAll(pairs, ts);
    }

    public WriteOutcome invalidate(String key) {
        return invalidate(key, now());
    }

    public WriteOutcome invalidate(String key, LogicalTimestamp ts) {
        return protocol.invalidate(key, ts);
    }

    public LogicalTimestamp now() {
        return LogicalTimestamp.now(clock);
    }
}
