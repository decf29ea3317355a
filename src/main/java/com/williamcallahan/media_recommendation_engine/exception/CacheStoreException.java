package com.williamcallahan.media_recommendation_engine.exception;

/**
 * Wraps cache store failures. Callers treat it as a miss (reads) or a no-op (writes).
 */
public class CacheStoreException extends RuntimeException {

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
