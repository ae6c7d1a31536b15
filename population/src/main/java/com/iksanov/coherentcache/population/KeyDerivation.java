package com.iksanov.coherentcache.population;

/**
 * Derives the cache key a source row is stored under.
 */
@FunctionalInterface
public interface KeyDerivation<T> {

    String keyFor(T row);
}
