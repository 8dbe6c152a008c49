package io.ctxsync.core;

/**
 * Root of the engine's error taxonomy.
 * <p>
 * Unchecked, like the rest of the codebase's failure signalling: callers of
 * get/store see either a result or one of the subclasses.
 */
public class ContextException extends RuntimeException {
    public ContextException(String message) {
        super(message);
    }

    public ContextException(String message, Throwable cause) {
        super(message, cause);
    }
}
