package io.ctxsync.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic feature-hashing embedder.
 * <p>
 * Each lowercase alphanumeric token is hashed to a bucket and a sign; the
 * bucket counts are L2-normalized. Texts sharing tokens land close together
 * under cosine similarity, which is enough for a runner without a model.
 */
public final class HashingEmbeddingProvider implements EmbeddingProvider {
    public static final int DEFAULT_DIMENSIONS = 256;

    private final int dimensions;

    public HashingEmbeddingProvider() {
        this(DEFAULT_DIMENSIONS);
    }

    public HashingEmbeddingProvider(int dimensions) {
        if (dimensions < 8) throw new IllegalArgumentException("dimensions must be >= 8");
        this.dimensions = dimensions;
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (String t : texts) out.add(embed(t));
        return out;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String modelId() {
        return "feature-hash-" + dimensions;
    }

    private float[] embed(String text) {
        float[] v = new float[dimensions];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.isEmpty()) continue;
            int h = mix(token.hashCode());
            int bucket = Math.floorMod(h, dimensions);
            v[bucket] += (h & 0x8000_0000) == 0 ? 1f : -1f;
        }
        double norm = 0;
        for (float x : v) norm += x * x;
        if (norm == 0) return v;
        float inv = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < v.length; i++) v[i] *= inv;
        return v;
    }

    /** murmur3 fmix32, spreads String.hashCode over all bits. */
    private static int mix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
