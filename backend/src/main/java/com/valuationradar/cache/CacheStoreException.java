package com.valuationradar.cache;

/**
 * Cache store read/write failure. Absorbed by the orchestrator.
 */
public class CacheStoreException extends RuntimeException {

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
