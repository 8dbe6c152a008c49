package io.ctxsync.index;

import io.ctxsync.core.Payload;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Batches committed payloads into embedding requests and writes the vectors
 * to a {@link VectorStore}.
 * <p>
 * Responsibilities:
 *  - enqueue(): remember the newest committed version per context.
 *  - flush():   embed pending documents in batches of {@code batchSize} and upsert them.
 *               A batch that fails stays pending for the next flush; a document
 *               replaced by a newer version while in flight is kept as the newer one.
 *  - search():  embed the query and ask the vector store for neighbours.
 * <p>
 * Search results are only as fresh as the last successful flush.
 */
public final class VectorIndexer {
    private static final Logger LOG = Logger.getLogger(VectorIndexer.class.getName());

    public static final int DEFAULT_BATCH_SIZE = 32;

    private final EmbeddingProvider embeddings;
    private final VectorStore store;
    private final int batchSize;

    private final Map<String, IndexDocument> pending = new ConcurrentHashMap<>();
    private final AtomicLong indexed = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong batches = new AtomicLong();

    public VectorIndexer(EmbeddingProvider embeddings, VectorStore store) {
        this(embeddings, store, DEFAULT_BATCH_SIZE);
    }

    public VectorIndexer(EmbeddingProvider embeddings, VectorStore store, int batchSize) {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings");
        this.store = Objects.requireNonNull(store, "store");
        this.batchSize = batchSize;
    }

    public void enqueue(String contextId, long version, Payload payload) {
        enqueue(IndexDocument.of(contextId, version, payload));
    }

    /** Keep the newest version per context; an older document never replaces a newer one. */
    public void enqueue(IndexDocument doc) {
        pending.merge(doc.contextId(), doc, (old, nu) -> nu.version() >= old.version() ? nu : old);
    }

    /** Enqueue and flush. */
    public IndexResult update(Collection<IndexDocument> docs) {
        docs.forEach(this::enqueue);
        return flush();
    }

    /**
     * Embed and upsert everything pending, in id order.
     * Serialized so a document is never embedded twice concurrently.
     */
    public synchronized IndexResult flush() {
        List<IndexDocument> work = new ArrayList<>(new TreeMap<>(pending).values());
        List<String> ok = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (int from = 0; from < work.size(); from += batchSize) {
            List<IndexDocument> batch = work.subList(from, Math.min(work.size(), from + batchSize));
            batches.incrementAndGet();
            try {
                List<String> texts = new ArrayList<>(batch.size());
                for (IndexDocument d : batch) texts.add(d.text());
                List<float[]> vectors = embeddings.embedAll(texts);
                if (vectors.size() != batch.size()) {
                    throw new IllegalStateException("embedding provider returned " + vectors.size()
                            + " vectors for " + batch.size() + " texts");
                }
                for (int i = 0; i < batch.size(); i++) {
                    IndexDocument d = batch.get(i);
                    store.upsert(d.contextId(), vectors.get(i), d.metadata());
                    pending.remove(d.contextId(), d);
                    ok.add(d.contextId());
                    indexed.incrementAndGet();
                }
            } catch (RuntimeException e) {
                int before = failed.size();
                for (IndexDocument d : batch) {
                    if (!ok.contains(d.contextId())) failed.add(d.contextId());
                }
                int lost = failed.size() - before;
                failures.addAndGet(lost);
                LOG.log(Level.WARNING, "Indexing failed for " + lost + " of " + batch.size()
                        + " documents, will retry: " + e.getMessage());
                LOG.log(Level.FINE, "Indexing failure detail", e);
            }
        }
        return new IndexResult(ok, failed);
    }

    public List<ScoredContext> search(String query, int limit, double threshold) {
        Objects.requireNonNull(query, "query");
        float[] q = embeddings.embedAll(List.of(query)).get(0);
        return search(q, limit, threshold);
    }

    public List<ScoredContext> search(float[] embedding, int limit, double threshold) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
        if (threshold < -1.0 || threshold > 1.0) throw new IllegalArgumentException("threshold must be in [-1, 1]");
        return store.query(embedding, limit, threshold);
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isPending(String contextId) {
        return pending.containsKey(contextId);
    }

    public IndexerMetrics metrics() {
        return new IndexerMetrics(indexed.get(), failures.get(), batches.get(), pending.size());
    }
}
