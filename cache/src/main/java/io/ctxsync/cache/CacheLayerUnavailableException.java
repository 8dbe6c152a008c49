package io.ctxsync.cache;

/**
 * A cache tier could not serve a request (network error, bad response, I/O).
 * TierCache catches it and treats the tier as a miss; it never reaches callers.
 */
public class CacheLayerUnavailableException extends RuntimeException {
    public CacheLayerUnavailableException(String message) {
        super(message);
    }

    public CacheLayerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
