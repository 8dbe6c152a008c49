package io.ctxsync.sync;

import io.ctxsync.core.Payload;
import io.ctxsync.core.merge.SourceView;

import java.time.Instant;
import java.util.Objects;

/**
 * A producer system's answer to fetchCurrent.
 *
 * @param sourceVersion the system's own counter, informational
 * @param updatedAt     when the system last changed the context
 */
public record SourceSnapshot(Payload payload, long sourceVersion, Instant updatedAt) {
    public SourceSnapshot {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public SourceView toView() {
        return new SourceView(payload, updatedAt, sourceVersion);
    }
}
