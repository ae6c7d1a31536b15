package com.iksanov.coherentcache.core.store;

import com.iksanov.coherentcache.common.model.CacheRecord;

import java.util.List;

/**
 * A read-modify-write step on one key, executed by an {@link AtomicStore} as a single
 * indivisible unit.
 * <p>
 * In-process stores call {@link #apply(CacheRecord)} under the key's lock. Remote stores run the
 * script registered for {@link #kind()} with {@link #scriptArguments()} and hand the raw reply to
 * {@link #decodeReply(Object)}. Both paths must produce the same result for the same record.
 */
public interface RecordOperation<R> {

    OperationKind kind();

    /**
     * Pure transition from the current record. {@code current} is {@link CacheRecord#ABSENT}
     * when the key does not exist or has expired.
     */
    Transition<R> apply(CacheRecord current);

    /** Script ARGV in the order the script for {@link #kind()} expects. */
    List<byte[]> scriptArguments();

    R decodeReply(Object reply);
}
