package io.ctxsync.core;

/**
 * Compare-and-swap commit lost a race: the context's current version no
 * longer matches the version the writer based its payload on.
 */
public class ConflictCommitException extends ContextException {
    private final String contextId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConflictCommitException(String contextId, long expectedVersion, long actualVersion) {
        super("version race on " + contextId + ": expected " + expectedVersion + " but found " + actualVersion);
        this.contextId = contextId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String contextId() {
        return contextId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    /** Current version at the time of the failed commit, 0 when the context did not exist. */
    public long actualVersion() {
        return actualVersion;
    }
}
