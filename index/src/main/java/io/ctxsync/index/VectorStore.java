package io.ctxsync.index;

import java.util.List;
import java.util.Map;

/**
 * Sink for context embeddings.
 * <p>
 * Unavailability only costs search freshness: the indexer keeps failed
 * documents pending and retries them.
 */
public interface VectorStore {

    /** Insert or replace the vector for a context. */
    void upsert(String contextId, float[] embedding, Map<String, String> metadata);

    /**
     * Nearest neighbours by cosine similarity.
     *
     * @param threshold minimum score to include, in [-1, 1]
     * @return at most {@code limit} hits, highest score first
     */
    List<ScoredContext> query(float[] embedding, int limit, double threshold);

    void delete(String contextId);

    int size();
}
