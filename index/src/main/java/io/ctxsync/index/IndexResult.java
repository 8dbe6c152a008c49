package io.ctxsync.index;

import java.util.List;

/**
 * Outcome of one flush.
 *
 * @param indexed ids upserted into the vector store
 * @param failed  ids whose batch failed; they stay pending
 */
public record IndexResult(List<String> indexed, List<String> failed) {
    public IndexResult {
        indexed = List.copyOf(indexed);
        failed = List.copyOf(failed);
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }
}
