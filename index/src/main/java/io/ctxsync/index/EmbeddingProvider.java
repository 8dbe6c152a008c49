package io.ctxsync.index;

import java.util.List;

/**
 * Turns text into fixed-size vectors. The model behind it is deployment-supplied.
 * <p>
 * Batched on purpose: remote providers charge per request, so the indexer
 * hands over whole batches.
 */
public interface EmbeddingProvider {

    /** One vector per input, in input order, each of length {@link #dimensions()}. */
    List<float[]> embedAll(List<String> texts);

    int dimensions();

    String modelId();
}
