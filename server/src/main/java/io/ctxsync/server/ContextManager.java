package io.ctxsync.server;

import io.ctxsync.cache.CachedContext;
import io.ctxsync.cache.Tier;
import io.ctxsync.cache.TierCache;
import io.ctxsync.core.ConflictCommitException;
import io.ctxsync.core.Context;
import io.ctxsync.core.ContextVersion;
import io.ctxsync.core.NotFoundException;
import io.ctxsync.core.Payload;
import io.ctxsync.core.SourceSystem;
import io.ctxsync.core.merge.MergeStrategy;
import io.ctxsync.index.ScoredContext;
import io.ctxsync.index.VectorIndexer;
import io.ctxsync.storage.CommitRequest;
import io.ctxsync.storage.VersionPage;
import io.ctxsync.storage.VersionStore;
import io.ctxsync.sync.SyncEngine;
import io.ctxsync.sync.SyncOutcome;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Public façade over VersionStore, TierCache, VectorIndexer and SyncEngine.
 * <p>
 * Read path: TierCache (L1 -> L2 -> L3) and, on a full miss, the VersionStore.
 * The loaded context is written into the cache at the populate tier, then the
 * store's current version is checked again; if a commit raced the fill the key
 * is invalidated. A cache hit older than the newest version stored through this
 * façade is ignored, so a caller never reads a version older than its own last store.
 * <p>
 * Write path: VersionStore commit, cache invalidation, enqueue for indexing
 * (flushed by the next sync pass) and registration for periodic sync.
 * <p>
 * Owns the components it is given: {@link #close()} stops the worker pool and
 * closes the sync engine, the cache and the store in that order.
 */
public final class ContextManager implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ContextManager.class.getName());

    public static final String META_MERGE_STRATEGY = "merge.strategy";
    public static final String META_MERGE_PARENTS = "merge.parents";

    private final VersionStore store;
    private final TierCache cache;
    private final VectorIndexer indexer;
    private final SyncEngine sync;
    private final Tier populateTier;
    private final Clock clock;
    private final ExecutorService workers;
    // highest version committed through this façade, per context
    private final Map<String, Long> committedFloor = new ConcurrentHashMap<>();

    public ContextManager(
            VersionStore store,
            TierCache cache,
            VectorIndexer indexer,
            SyncEngine sync,
            Tier populateTier,
            int workerThreads,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.indexer = Objects.requireNonNull(indexer, "indexer");
        this.sync = Objects.requireNonNull(sync, "sync");
        this.populateTier = Objects.requireNonNull(populateTier, "populateTier");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (workerThreads <= 0) throw new IllegalArgumentException("workerThreads must be > 0");

        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "ctxsync-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ---------- writes ----------

    /**
     * Create or update a context.
     *
     * @return the committed version number
     */
    public long store(String contextId, Payload payload, SourceSystem source) {
        long version = store.commit(contextId, payload, source);
        afterCommit(contextId, version, payload);
        sync.track(contextId);
        return version;
    }

    /**
     * Merge existing contexts into a new one.
     * Unknown ids are skipped; the remaining ones are merged in the order given.
     *
     * @throws NotFoundException when none of the ids resolve
     */
    public Context mergeContexts(List<String> contextIds, MergeStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy");
        List<Context> inputs = new ArrayList<>();
        List<String> parents = new ArrayList<>();
        for (String id : new LinkedHashSet<>(contextIds)) {
            try {
                inputs.add(store.getCurrent(id));
                parents.add(id);
            } catch (NotFoundException e) {
                LOG.fine(() -> "Merge skips unknown context " + id);
            }
        }
        if (inputs.isEmpty()) {
            throw new NotFoundException(String.join(",", contextIds), "none of the contexts to merge exist");
        }

        Payload merged = strategy.apply(inputs);
        Map<String, String> meta = Map.of(
                META_MERGE_STRATEGY, strategy.name(),
                META_MERGE_PARENTS, String.join(",", parents));

        String id;
        long version;
        while (true) {
            id = newMergedId();
            if (store.currentVersion(id).isPresent()) continue;
            CommitRequest req = new CommitRequest(id, merged, SourceSystem.MERGED, 0, true, meta);
            try {
                version = store.commit(req);
                break;
            } catch (ConflictCommitException e) {
                LOG.fine("Generated merge id already taken, drawing another");
            }
        }
        afterCommit(id, version, merged);
        LOG.info("Merged " + parents + " with " + strategy + " into " + id);
        return store.getCurrent(id);
    }

    // ---------- reads ----------

    /** Latest committed view; never older than a store() that returned before this call. */
    public Context get(String contextId) {
        Objects.requireNonNull(contextId, "contextId");
        long floor = committedFloor.getOrDefault(contextId, 0L);
        Optional<CachedContext> hit = cache.get(contextId);
        if (hit.isPresent() && hit.get().version() >= floor) return hit.get().toContext();

        Context current = store.getCurrent(contextId);
        cache.set(contextId, CachedContext.of(current), populateTier);
        OptionalLong now = store.currentVersion(contextId);
        if (now.isEmpty() || now.getAsLong() != current.currentVersion()) {
            // a commit landed between the read and the fill
            cache.invalidate(contextId);
        }
        return current;
    }

    public ContextVersion getVersion(String contextId, long versionNumber) {
        return store.getVersion(contextId, versionNumber);
    }

    /** Retained versions newest first; pass the page's cursor back to continue. */
    public VersionPage history(String contextId, int limit, OptionalLong beforeVersion) {
        return store.listVersions(contextId, limit, beforeVersion);
    }

    public List<ScoredContext> searchSimilar(String query, int limit, double threshold) {
        return indexer.search(query, limit, threshold);
    }

    /** Cancelling the future abandons the call; nothing is changed server-side. */
    public CompletableFuture<Context> getAsync(String contextId) {
        return CompletableFuture.supplyAsync(() -> get(contextId), workers);
    }

    public CompletableFuture<List<ScoredContext>> searchSimilarAsync(String query, int limit, double threshold) {
        return CompletableFuture.supplyAsync(() -> searchSimilar(query, limit, threshold), workers);
    }

    // ---------- sync / cache maintenance ----------

    public SyncOutcome syncNow(Collection<String> contextIds) {
        return sync.syncNow(contextIds);
    }

    /** A pass over every context registered for periodic sync. */
    public SyncOutcome syncTracked() {
        return sync.runScheduledPass();
    }

    /** Load hot contexts into every cache tier ahead of demand. */
    public int warm(Collection<String> contextIds) {
        return cache.warm(contextIds, id -> store.currentVersion(id).isPresent()
                ? Optional.of(CachedContext.of(store.getCurrent(id)))
                : Optional.empty());
    }

    /** Drop expired cache entries; returns how many were removed. */
    public int purgeExpired() {
        return cache.purgeExpired();
    }

    public EngineMetrics metrics() {
        return new EngineMetrics(clock.instant(), store.stats(), cache.metrics(), sync.metrics(), indexer.metrics());
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) workers.shutdownNow();
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        sync.close();
        cache.close();
        store.close();
        LOG.info("Context manager closed");
    }

    // ---------- helpers ----------

    private void afterCommit(String contextId, long version, Payload payload) {
        committedFloor.merge(contextId, version, Math::max);
        cache.invalidate(contextId);
        indexer.enqueue(contextId, version, payload);
        LOG.log(Level.FINE, "Committed {0} v{1}", new Object[]{contextId, version});
    }

    private static String newMergedId() {
        return String.format("merged-%08x", ThreadLocalRandom.current().nextInt());
    }
}
