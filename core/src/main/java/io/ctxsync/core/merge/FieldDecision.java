package io.ctxsync.core.merge;

import io.ctxsync.core.SourceSystem;

import java.util.Objects;

/** One conflict report entry: a field both systems changed, and who won it. */
public record FieldDecision(String field, SourceSystem winner, DecisionReason reason) {
    public FieldDecision {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(winner, "winner");
        Objects.requireNonNull(reason, "reason");
    }
}
