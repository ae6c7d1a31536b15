package com.iksanov.coherentcache.common.exception;

/**
 * Root of the unchecked exception hierarchy.
 * A cache miss or a rejected write is a normal outcome and is never reported through it.
 */
public class CacheException extends RuntimeException {
    public CacheException(String message) {
        super(message);
    }
    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
