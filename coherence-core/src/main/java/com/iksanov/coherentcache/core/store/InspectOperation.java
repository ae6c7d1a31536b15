package com.iksanov.coherentcache.core.store;

import com.iksanov.coherentcache.common.codec.RecordLayout;
import com.iksanov.coherentcache.common.model.CacheRecord;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Returns the raw record, visible or not. Used by diagnostics.
 */
public final class InspectOperation implements RecordOperation<CacheRecord> {

    private final String key;

    public InspectOperation(String key) {
        this.key = key;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.INSPECT;
    }

    @Override
    public Transition<CacheRecord> apply(CacheRecord current) {
        return Transition.unchanged(current);
    }

    @Override
    public List<byte[]> scriptArguments() {
        return List.of();
    }

    /** The reply is a flat field/value list as returned by HGETALL. */
    @Override
    public CacheRecord decodeReply(Object reply) {
        if (reply == null) return CacheRecord.ABSENT;
        if (!(reply instanceof List<?> flat)) {
            throw new IllegalStateException("Unexpected INSPECT reply type: " + reply.getClass().getName());
        }
        Map<String, byte[]> fields = new LinkedHashMap<>();
        for (int i = 0; i + 1 < flat.size(); i += 2) {
            fields.put(asString(flat.get(i)), asBytes(flat.get(i + 1)));
        }
        return RecordLayout.fromFields(key, fields);
    }

    private static String asString(Object element) {
        return element instanceof byte[] bytes ? new String(bytes, StandardCharsets.UTF_8) : String.valueOf(element);
    }

    private static byte[] asBytes(Object element) {
        return element instanceof byte[] bytes ? bytes : String.valueOf(element).getBytes(StandardCharsets.UTF_8);
    }
}
