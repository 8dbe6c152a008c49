package io.ctxsync.core;

/**
 * A sync pass could not restore its pre-pass state.
 * <p>
 * Surfaced to operators through logs and metrics only; the next scheduled
 * pass retries from scratch.
 */
public class SyncFatalException extends ContextException {
    public SyncFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}
