package io.ctxsync.sync;

/**
 * A producer system could not be reached or answered with garbage.
 * SyncEngine records it as a partial sync; it never reaches callers.
 */
public class ExternalSystemUnavailableException extends RuntimeException {
    public ExternalSystemUnavailableException(String message) {
        super(message);
    }

    public ExternalSystemUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
