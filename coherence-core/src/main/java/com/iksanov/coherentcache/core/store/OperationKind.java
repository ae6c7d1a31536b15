package com.iksanov.coherentcache.core.store;

/**
 * The record operations a store must be able to execute atomically.
 * Remote stores map each kind to one server-side script.
 */
public enum OperationKind {
    SET(false),
    INVALIDATE(false),
    GET(true),
    INSPECT(true);

    private final boolean readOnly;

    OperationKind(boolean readOnly) {
        this.readOnly = readOnly;
    }

    public boolean isReadOnly() {
        return readOnly;
    }
}
