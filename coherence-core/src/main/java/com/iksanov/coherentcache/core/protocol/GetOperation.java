package com.iksanov.coherentcache.core.protocol;

import com.iksanov.coherentcache.common.model.CacheRecord;
import com.iksanov.coherentcache.common.model.ReadResult;
import com.iksanov.coherentcache.core.store.OperationKind;
import com.iksanov.coherentcache.core.store.RecordOperation;
import com.iksanov.coherentcache.core.store.Transition;

import java.util.List;

final class GetOperation implements RecordOperation<ReadResult> {

    static final GetOperation INSTANCE = new GetOperation();

    private GetOperation() {}

    @Override
    public OperationKind kind() {
        return OperationKind.GET;
    }

    @Override
    public Transition<ReadResult> apply(CacheRecord current) {
        return Transition.unchanged(current.isVisible() ? ReadResult.value(current.value()) : ReadResult.miss());
    }

    @Override
    public List<byte[]> scriptArguments() {
        return List.of();
    }

    @Override
    public ReadResult decodeReply(Object reply) {
        if (reply == null) return ReadResult.miss();
        if (reply instanceof byte[] bytes) return ReadResult.value(bytes);
        throw new IllegalStateException("Unexpected GET reply type: " + reply.getClass().getName());
    }
}
