package io.ctxsync.core;

/** Bad input, rejected before any state is mutated (oversize or non-object payload, blank id). */
public class ValidationException extends ContextException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
