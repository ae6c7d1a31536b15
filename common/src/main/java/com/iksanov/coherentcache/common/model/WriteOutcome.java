package com.iksanov.coherentcache.common.model;

/**
 * Result of a conditional write or an invalidation.
 * {@code REJECTED} means the request was older than the key's latest invalidation.
 */
public enum WriteOutcome {
    ACCEPTED,
    REJECTED;

    public static WriteOutcome of(boolean accepted) {
        return accepted ? ACCEPTED : REJECTED;
    }

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
