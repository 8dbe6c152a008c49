package io.ctxsync.index;

import io.ctxsync.core.Payload;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class VectorIndexerTest {

    /** Delegates to the hashing provider but can fail on demand and counts calls. */
    private static final class FlakyProvider implements EmbeddingProvider {
        final HashingEmbeddingProvider delegate = new HashingEmbeddingProvider(64);
        final List<Integer> batchSizes = new ArrayList<>();
        final AtomicInteger failuresLeft = new AtomicInteger();

        @Override
        public List<float[]> embedAll(List<String> texts) {
            batchSizes.add(texts.size());
            if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new IllegalStateException("provider unavailable");
            }
            return delegate.embedAll(texts);
        }

        @Override public int dimensions() { return delegate.dimensions(); }
        @Override public String modelId() { return "flaky"; }
    }

    @Test
    void flush_embeds_in_batches_and_clears_pending() {
        var provider = new FlakyProvider();
        var store = new InMemoryVectorStore();
        var indexer = new VectorIndexer(provider, store, 4);

        for (int i = 0; i < 10; i++) indexer.enqueue("c" + i, 1, Payload.parse("{\"n\":" + i + "}"));
        IndexResult r = indexer.flush();

        assertTrue(r.isComplete());
        assertEquals(10, r.indexed().size());
        assertEquals(List.of(4, 4, 2), provider.batchSizes);
        assertEquals(0, indexer.pendingCount());
        assertEquals(10, store.size());
    }

    @Test
    void failed_batch_stays_pending_and_is_retried() {
        var provider = new FlakyProvider();
        var store = new InMemoryVectorStore();
        var indexer = new VectorIndexer(provider, store, 32);
        provider.failuresLeft.set(1);

        IndexResult first = indexer.update(List.of(IndexDocument.of("a", 1, Payload.parse("{\"x\":1}"))));
        assertEquals(List.of("a"), first.failed());
        assertTrue(indexer.isPending("a"));
        assertEquals(0, store.size());

        IndexResult second = indexer.flush();
        assertEquals(List.of("a"), second.indexed());
        assertFalse(indexer.isPending("a"));
        assertEquals(1, indexer.metrics().failures());
    }

    @Test
    void newest_version_wins_in_the_queue() {
        var store = new InMemoryVectorStore();
        var indexer = new VectorIndexer(new HashingEmbeddingProvider(), store);

        indexer.enqueue("a", 3, Payload.parse("{\"v\":3}"));
        indexer.enqueue("a", 2, Payload.parse("{\"v\":2}"));
        indexer.flush();

        assertEquals("3", store.metadata("a").get("version"));
    }

    @Test
    void search_ranks_by_similarity_then_id() {
        var indexer = new VectorIndexer(new HashingEmbeddingProvider(), new InMemoryVectorStore());
        indexer.enqueue("billing", 1, Payload.parse("{\"topic\":\"invoice payment overdue\"}"));
        indexer.enqueue("billing-copy", 1, Payload.parse("{\"topic\":\"invoice payment overdue\"}"));
        indexer.enqueue("weather", 1, Payload.parse("{\"forecast\":\"rain tomorrow\"}"));
        indexer.flush();

        List<ScoredContext> hits = indexer.search("overdue invoice payment", 2, 0.1);

        assertEquals(2, hits.size());
        assertEquals("billing", hits.get(0).contextId());
        assertEquals("billing-copy", hits.get(1).contextId());
        assertEquals(hits.get(0).score(), hits.get(1).score(), 1e-9);
    }

    @Test
    void threshold_filters_weak_matches() {
        var indexer = new VectorIndexer(new HashingEmbeddingProvider(), new InMemoryVectorStore());
        indexer.enqueue("weather", 1, Payload.parse("{\"forecast\":\"rain tomorrow\"}"));
        indexer.flush();

        assertTrue(indexer.search("quarterly revenue", 5, 0.5).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> indexer.search("x", 0, 0.5));
    }

    @Test
    void hashing_embeddings_are_deterministic_and_normalized() {
        var p = new HashingEmbeddingProvider(32);
        float[] a = p.embedAll(List.of("Hello, world")).get(0);
        float[] b = p.embedAll(List.of("hello world")).get(0);

        assertArrayEquals(a, b);
        double norm = 0;
        for (float x : a) norm += x * x;
        assertEquals(1.0, norm, 1e-5);
    }
}
