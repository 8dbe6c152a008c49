package io.ctxsync.core.merge;

import io.ctxsync.core.Payload;

/**
 * Policy for merging two producer systems' views of a context into one payload.
 * <p>
 * Implementations must be pure: no I/O, no clock reads, no shared mutable state.
 * Identical inputs must yield equal payloads and equal reports.
 */
public interface ConflictResolver {

    /**
     * @param base  last committed payload before the pass (may be null for a new context)
     * @param viewA System A's view, or null when A was unavailable
     * @param viewB System B's view, or null when B was unavailable
     * @throws IllegalArgumentException if both views are null
     */
    MergeResult merge(Payload base, SourceView viewA, SourceView viewB);
}
