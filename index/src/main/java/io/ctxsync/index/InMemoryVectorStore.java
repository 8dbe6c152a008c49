package io.ctxsync.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Brute-force cosine similarity over a map. Fine up to a few hundred thousand contexts.
 */
public final class InMemoryVectorStore implements VectorStore {

    private record Stored(float[] vector, double norm, Map<String, String> metadata) {}

    private final Map<String, Stored> vectors = new ConcurrentHashMap<>();

    @Override
    public void upsert(String contextId, float[] embedding, Map<String, String> metadata) {
        float[] copy = Arrays.copyOf(embedding, embedding.length);
        vectors.put(contextId, new Stored(copy, norm(copy), Map.copyOf(metadata)));
    }

    @Override
    public List<ScoredContext> query(float[] embedding, int limit, double threshold) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
        double qNorm = norm(embedding);
        List<ScoredContext> hits = new ArrayList<>();
        if (qNorm == 0) return hits;
        vectors.forEach((id, s) -> {
            if (s.vector.length != embedding.length || s.norm == 0) return;
            double dot = 0;
            for (int i = 0; i < embedding.length; i++) dot += embedding[i] * s.vector[i];
            double score = dot / (qNorm * s.norm);
            if (score >= threshold) hits.add(new ScoredContext(id, score));
        });
        hits.sort(ScoredContext.BY_SCORE_DESC);
        return hits.size() > limit ? new ArrayList<>(hits.subList(0, limit)) : hits;
    }

    @Override
    public void delete(String contextId) {
        vectors.remove(contextId);
    }

    @Override
    public int size() {
        return vectors.size();
    }

    /** Metadata stored with a context's vector, or null. */
    public Map<String, String> metadata(String contextId) {
        Stored s = vectors.get(contextId);
        return s == null ? null : s.metadata;
    }

    private static double norm(float[] v) {
        double sum = 0;
        for (float x : v) sum += x * x;
        return Math.sqrt(sum);
    }
}
