package com.iksanov.coherentcache.core.protocol;

import com.iksanov.coherentcache.common.codec.RecordLayout;
import com.iksanov.coherentcache.common.model.CacheRecord;
import com.iksanov.coherentcache.common.model.LogicalTimestamp;
import com.iksanov.coherentcache.common.model.WriteOutcome;
import com.iksanov.coherentcache.core.store.OperationKind;
import com.iksanov.coherentcache.core.store.RecordOperation;
import com.iksanov.coherentcache.core.store.Transition;

import java.util.List;

/**
 * Conditional write. Rejected when {@code ts} is older than the record's invalidation or older
 * than the value already stored; an accepted write clears any pending expiry.
 */
final class SetOperation implements RecordOperation<WriteOutcome> {

    private final byte[] value;
    private final LogicalTimestamp ts;

    SetOperation(byte[] value, LogicalTimestamp ts) {
        this.value = value;
        this.ts = ts;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.SET;
    }

    @Override
    public Transition<WriteOutcome> apply(CacheRecord current) {
        if (ts.isBefore(current.invalidateTs()) || ts.isBefore(current.writeTs())) {
            return Transition.unchanged(WriteOutcome.REJECTED);
        }
        return Transition.write(current.withValue(value, ts), Transition.Retention.CLEAR, WriteOutcome.ACCEPTED);
    }

    @Override
    public List<byte[]> scriptArguments() {
        return List.of(value, RecordLayout.encodeNumber(ts.seconds()), RecordLayout.encodeNumber(ts.nanoseconds()));
    }

    @Override
    public WriteOutcome decodeReply(Object reply) {
        return WriteOutcome.of(ScriptReplies.isOne(reply));
    }
}
