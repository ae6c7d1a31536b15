package com.iksanov.coherentcache.common.exception;

/**
 * Connection or timeout failure talking to the shared store.
 * <p>
 * Safe to retry with the same arguments. The operation may or may not have been applied
 * server-side, so a caller that gives up should re-read the key instead of assuming rejection.
 */
public class TransientStoreException extends CacheException {
    public TransientStoreException(String message) {
        super(message);
    }
    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
