package com.iksanov.coherentcache.common.exception;

/**
 * The relational source of truth could not be read or written.
 */
public class StorageAccessException extends CacheException {
    public StorageAccessException(String message) {
        super(message);
    }
    public StorageAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
