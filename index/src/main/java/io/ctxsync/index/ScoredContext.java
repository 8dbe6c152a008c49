package io.ctxsync.index;

import java.util.Comparator;
import java.util.Objects;

/** One similarity hit. */
public record ScoredContext(String contextId, double score) {

    /** Highest score first, then id for a stable order. */
    public static final Comparator<ScoredContext> BY_SCORE_DESC =
            Comparator.comparingDouble(ScoredContext::score).reversed().thenComparing(ScoredContext::contextId);

    public ScoredContext {
        Objects.requireNonNull(contextId, "contextId");
    }
}
