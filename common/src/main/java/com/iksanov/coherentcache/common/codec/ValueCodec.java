package com.iksanov.coherentcache.common.codec;

/**
 * Converts typed values to the opaque payload bytes stored in a record.
 * Implementations throw {@link com.iksanov.coherentcache.common.exception.SerializationException}.
 */
public interface ValueCodec<V> {
    byte[] encode(V value);
    V decode(byte[] payload);
}
