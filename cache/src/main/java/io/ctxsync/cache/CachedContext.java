package io.ctxsync.cache;

import io.ctxsync.core.Context;
import io.ctxsync.core.Payload;
import io.ctxsync.core.SourceSystem;

import java.time.Instant;
import java.util.Objects;

/**
 * Cached view of one committed context version.
 * <p>
 * Only built from committed state (a VersionStore read or a successful sync
 * commit), never from in-flight merge output.
 */
public record CachedContext(String id, long version, Payload payload, SourceSystem source, Instant updatedAt) {
    public CachedContext {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public static CachedContext of(Context c) {
        return new CachedContext(c.id(), c.currentVersion(), c.payload(), c.sourceSystem(), c.updatedAt());
    }

    public Context toContext() {
        return new Context(id, version, payload, source, updatedAt);
    }
}
