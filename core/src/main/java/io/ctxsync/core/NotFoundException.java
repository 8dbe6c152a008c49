package io.ctxsync.core;

/** Unknown context id, or a version that was never committed or has been pruned. */
public class NotFoundException extends ContextException {
    private final String contextId;

    public NotFoundException(String contextId, String message) {
        super(message);
        this.contextId = contextId;
    }

    public static NotFoundException context(String contextId) {
        return new NotFoundException(contextId, "unknown context: " + contextId);
    }

    public static NotFoundException version(String contextId, long versionNumber) {
        return new NotFoundException(contextId,
                "unknown or pruned version " + versionNumber + " of context " + contextId);
    }

    public String contextId() {
        return contextId;
    }
}
