package com.iksanov.coherentcache.common.exception;

/**
 * A persisted record could not be parsed. Not retried automatically.
 */
public class StoreCorruptionException extends CacheException {
    public StoreCorruptionException(String message) {
        super(message);
    }
    public StoreCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
