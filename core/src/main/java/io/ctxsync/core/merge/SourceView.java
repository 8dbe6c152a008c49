package io.ctxsync.core.merge;

import io.ctxsync.core.Payload;

import java.time.Instant;
import java.util.Objects;

/**
 * One producer system's current view of a context, as fetched for a merge.
 *
 * @param payload       the system's payload
 * @param updatedAt     when that system last changed it; drives most-recent-wins
 * @param sourceVersion the system's own version counter, informational only
 */
public record SourceView(Payload payload, Instant updatedAt, long sourceVersion) {
    public SourceView {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }
}
