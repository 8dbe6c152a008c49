package io.ctxsync.sync;

import io.ctxsync.core.Context;
import io.ctxsync.core.ContextVersion;
import io.ctxsync.storage.CommitLease;
import io.ctxsync.storage.CommitRequest;
import io.ctxsync.storage.SyncSnapshot;
import io.ctxsync.storage.VersionPage;
import io.ctxsync.storage.VersionStore;
import io.ctxsync.storage.VersionStoreStats;

import java.util.Collection;
import java.util.OptionalLong;
import java.util.Set;

/** Delegates everything; tests override the calls they want to break. */
class ForwardingVersionStore implements VersionStore {
    protected final VersionStore delegate;

    ForwardingVersionStore(VersionStore delegate) {
        this.delegate = delegate;
    }

    @Override public long commit(CommitRequest request) { return delegate.commit(request); }
    @Override public Context getCurrent(String contextId) { return delegate.getCurrent(contextId); }
    @Override public OptionalLong currentVersion(String contextId) { return delegate.currentVersion(contextId); }
    @Override public ContextVersion getVersion(String contextId, long v) { return delegate.getVersion(contextId, v); }
    @Override public VersionPage listVersions(String contextId, int limit, OptionalLong before) {
        return delegate.listVersions(contextId, limit, before);
    }
    @Override public SyncSnapshot createSnapshot(Collection<String> ids) { return delegate.createSnapshot(ids); }
    @Override public void restoreSnapshot(SyncSnapshot snapshot) { delegate.restoreSnapshot(snapshot); }
    @Override public CommitLease acquireCommitLease(Collection<String> ids) { return delegate.acquireCommitLease(ids); }
    @Override public Set<String> contextIds() { return delegate.contextIds(); }
    @Override public VersionStoreStats stats() { return delegate.stats(); }
    @Override public void close() { delegate.close(); }
}
