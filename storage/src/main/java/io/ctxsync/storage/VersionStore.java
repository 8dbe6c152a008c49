package io.ctxsync.storage;

import io.ctxsync.core.Context;
import io.ctxsync.core.ContextVersion;
import io.ctxsync.core.Payload;
import io.ctxsync.core.SourceSystem;

import java.util.Collection;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Durable, append-only ledger of context versions.
 * <p>
 * Responsibilities:
 *  - Assign version numbers linearizably per context (never reusing one).
 *  - Enforce the payload size cap before any mutation.
 *  - Apply the retention cap, oldest first, never dropping the current version.
 *  - Provide snapshot/restore as the compensating action for failed sync passes.
 * <p>
 * Errors: ValidationException, NotFoundException, ConflictCommitException from
 * io.ctxsync.core; durability failures surface as UncheckedIOException.
 */
public interface VersionStore extends AutoCloseable {

    /** Create-or-update; returns the new version number. */
    default long commit(String contextId, Payload payload, SourceSystem source) {
        return commit(CommitRequest.upsert(contextId, payload, source));
    }

    long commit(CommitRequest request);

    Context getCurrent(String contextId);

    /** Current version, or empty when the context does not exist. Never throws NotFound. */
    OptionalLong currentVersion(String contextId);

    ContextVersion getVersion(String contextId, long versionNumber);

    /**
     * Page through retained versions newest first.
     *
     * @param beforeVersion only versions strictly older than this; empty for the newest page
     */
    VersionPage listVersions(String contextId, int limit, OptionalLong beforeVersion);

    default VersionPage listVersions(String contextId, int limit) {
        return listVersions(contextId, limit, OptionalLong.empty());
    }

    /** Capture pre-pass state. Reserved for SyncEngine. */
    SyncSnapshot createSnapshot(Collection<String> contextIds);

    /** Undo the owning pass's commits. Reserved for SyncEngine. */
    void restoreSnapshot(SyncSnapshot snapshot);

    CommitLease acquireCommitLease(Collection<String> contextIds);

    Set<String> contextIds();

    VersionStoreStats stats();

    @Override
    void close();
}
