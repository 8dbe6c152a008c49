package io.ctxsync.core.merge;

import io.ctxsync.core.Payload;

import java.util.Objects;

/** Output of {@link ConflictResolver#merge}. */
public record MergeResult(Payload payload, ConflictReport report) {
    public MergeResult {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(report, "report");
    }
}
