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
 * Raises the record's invalidation timestamp. Records without a value get a fresh retention
 * window; records holding a value keep whatever expiry they have.
 */
final class InvalidateOperation implements RecordOperation<WriteOutcome> {

    private final LogicalTimestamp ts;

    InvalidateOperation(LogicalTimestamp ts) {
        this.ts = ts;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.INVALIDATE;
    }

    @Override
    public Transition<WriteOutcome> apply(CacheRecord current) {
        if (ts.isBefore(current.invalidateTs())) {
            return Transition.unchanged(WriteOutcome.REJECTED);
        }
        CacheRecord next = current.withInvalidation(ts);
        Transition.Retention retention = next.hasValue() ? Transition.Retention.KEEP : Transition.Retention.REFRESH;
        return Transition.write(next, retention, WriteOutcome.ACCEPTED);
    }

    @Override
    public List<byte[]> scriptArguments() {
        return List.of(RecordLayout.encodeNumber(ts.seconds()), RecordLayout.encodeNumber(ts.nanoseconds()));
    }

    @Override
    public WriteOutcome decodeReply(Object reply) {
        return WriteOutcome.of(ScriptReplies.isOne(reply));
    }
}
