package com.iksanov.coherentcache.common.codec;

import com.iksanov.coherentcache.common.exception.StoreCorruptionException;
import com.iksanov.coherentcache.common.model.CacheRecord;
import com.iksanov.coherentcache.common.model.LogicalTimestamp;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Store-visible field layout of a {@link CacheRecord}.
 * <p>
 * Field names are shared with the server-side scripts and must not change:
 * <pre>
 *   ts_sec, ts_nsec   - write timestamp of the stored value
 *   inv_sec, inv_nsec - latest invalidation timestamp
 *   v                 - payload, absent when no value was ever written
 * </pre>
 * Timestamps are decimal strings. A missing pair reads as zero, anything else that does not
 * parse is corruption.
 */
public final class RecordLayout {

    public static final String WRITE_SECONDS = "ts_sec";
    public static final String WRITE_NANOS = "ts_nsec";
    public static final String INVALIDATE_SECONDS = "inv_sec";
    public static final String INVALIDATE_NANOS = "inv_nsec";
    public static final String VALUE = "v";

    private RecordLayout() {}

    public static Map<String, byte[]> toFields(CacheRecord record) {
        Map<String, byte[]> fields = new LinkedHashMap<>();
        if (record.hasValue()) {
            fields.put(WRITE_SECONDS, encodeNumber(record.writeTs().seconds()));
            fields.put(WRITE_NANOS, encodeNumber(record.writeTs().nanoseconds()));
            fields.put(VALUE, record.value());
        }
        if (!record.invalidateTs().equals(LogicalTimestamp.ZERO)) {
            fields.put(INVALIDATE_SECONDS, encodeNumber(record.invalidateTs().seconds()));
            fields.put(INVALIDATE_NANOS, encodeNumber(record.invalidateTs().nanoseconds()));
        }
        return fields;
    }

    /**
     * Parses a stored field map. An empty map is an absent record.
     *
     * @throws StoreCorruptionException if a timestamp field is malformed or unpaired
     */
    public static CacheRecord fromFields(String key, Map<String, byte[]> fields) {
        if (fields == null || fields.isEmpty()) return CacheRecord.ABSENT;
        LogicalTimestamp writeTs = readTimestamp(key, fields, WRITE_SECONDS, WRITE_NANOS);
        LogicalTimestamp invalidateTs = readTimestamp(key, fields, INVALIDATE_SECONDS, INVALIDATE_NANOS);
        return new CacheRecord(fields.get(VALUE), writeTs, invalidateTs);
    }

    private static LogicalTimestamp readTimestamp(String key, Map<String, byte[]> fields, String secondsField, String nanosField) {
        byte[] rawSeconds = fields.get(secondsField);
        byte[] rawNanos = fields.get(nanosField);
        if (rawSeconds == null && rawNanos == null) return LogicalTimestamp.ZERO;
        if (rawSeconds == null || rawNanos == null) {
            throw new StoreCorruptionException("Record '" + key + "' has " + secondsField + "/" + nanosField + " only partially set");
        }
        try {
            long seconds = Long.parseLong(new String(rawSeconds, StandardCharsets.US_ASCII));
            int nanos = Integer.parseInt(new String(rawNanos, StandardCharsets.US_ASCII));
            return LogicalTimestamp.of(seconds, nanos);
        } catch (IllegalArgumentException e) {
            throw new StoreCorruptionException("Record '" + key + "' has malformed " + secondsField + "/" + nanosField, e);
        }
    }

    public static byte[] encodeNumber(long number) {
        return Long.toString(number).getBytes(StandardCharsets.US_ASCII);
    }
}
