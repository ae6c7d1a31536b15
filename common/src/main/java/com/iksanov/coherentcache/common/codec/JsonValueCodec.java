package com.iksanov.coherentcache.common.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iksanov.coherentcache.common.exception.SerializationException;

import java.io.IOException;
import java.util.Objects;

/**
 * Jackson-backed {@link ValueCodec} storing values as UTF-8 JSON.
 */
public final class JsonValueCodec<V> implements ValueCodec<V> {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper();
    private final ObjectMapper mapper;
    private final JavaType type;

    private JsonValueCodec(ObjectMapper mapper, JavaType type) {
        this.mapper = mapper;
        this.type = type;
    }

    public static <V> JsonValueCodec<V> forClass(Class<V> type) {
        return forClass(DEFAULT_MAPPER, type);
    }

    public static <V> JsonValueCodec<V> forClass(ObjectMapper mapper, Class<V> type) {
        Objects.requireNonNull(mapper, "mapper");
        return new JsonValueCodec<>(mapper, mapper.constructType(Objects.requireNonNull(type, "type")));
    }

    public static <V> JsonValueCodec<V> forType(TypeReference<V> type) {
        return new JsonValueCodec<>(DEFAULT_MAPPER, DEFAULT_MAPPER.getTypeFactory().constructType(type));
    }

    @Override
    public byte[] encode(V value) {
        if (value == null) throw new SerializationException("Cannot encode null value of type " + type);
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new SerializationException("Failed to encode value of type " + type, e);
        }
    }

    @Override
    public V decode(byte[] payload) {
        if (payload == null) throw new SerializationException("Cannot decode null payload as " + type);
        try {
            return mapper.readValue(payload, type);
        } catch (IOException e) {
            throw new SerializationException("Failed to decode payload as " + type, e);
        }
    }
}
