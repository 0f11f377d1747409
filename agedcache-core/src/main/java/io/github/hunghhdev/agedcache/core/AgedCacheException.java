package io.github.hunghhdev.agedcache.core;

/**
 * Custom exception for agedcache errors.
 */
public class AgedCacheException extends RuntimeException {
    public AgedCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
