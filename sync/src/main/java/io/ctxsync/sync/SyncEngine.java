package io.ctxsync.sync;

import io.ctxsync.cache.CachedContext;
import io.ctxsync.cache.TierCache;
import io.ctxsync.core.ConflictCommitException;
import io.ctxsync.core.ContextVersion;
import io.ctxsync.core.Payload;
import io.ctxsync.core.SourceSystem;
import io.ctxsync.core.SyncFatalException;
import io.ctxsync.core.merge.ConflictReport;
import io.ctxsync.core.merge.ConflictResolver;
import io.ctxsync.core.merge.MergeResult;
import io.ctxsync.core.merge.SourceView;
import io.ctxsync.index.IndexDocument;
import io.ctxsync.index.IndexResult;
import io.ctxsync.index.VectorIndexer;
import io.ctxsync.storage.CommitLease;
import io.ctxsync.storage.CommitRequest;
import io.ctxsync.storage.SyncSnapshot;
import io.ctxsync.storage.VersionStore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reconciles the two producer systems into the VersionStore.
 * <p>
 * One pass over a set of contexts:
 *  1) SNAPSHOTTING  createSnapshot() for every context of the pass.
 *  2) FETCHING      pull A and B views concurrently under one shared deadline;
 *                   a side that times out or fails is missing (partial sync).
 *  3) MERGING       ConflictResolver against the pre-pass payload; unchanged results are dropped.
 *  4) COMMITTING    under a CommitLease, CAS-commit each merge against the version it was
 *                   derived from. A version race is retried once with a fresh read and re-merge.
 *                   Each commit invalidates the cache key; when all succeed, the new
 *                   contexts are written through to L1 before the lease is released.
 *  5) INDEXING      hand the committed payloads to the VectorIndexer; failures do not roll back.
 * <p>
 * Any failure in steps 3-4 runs ROLLING_BACK: restoreSnapshot() and invalidate
 * every key of the pass. If the restore itself fails the pass is Aborted.
 * <p>
 * Concurrency: passes touching the same context are serialized by pass locks taken
 * in sorted id order; disjoint passes run in parallel.
 */
public final class SyncEngine implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(SyncEngine.class.getName());

    public static final String META_PASS = "sync.pass";
    public static final String META_CONFLICTS = "sync.conflicts";
    public static final String META_WINNERS = "sync.winners";
    public static final String META_PARTIAL = "sync.partial";

    private final VersionStore store;
    private final TierCache cache;
    private final VectorIndexer indexer;
    private final ConflictResolver resolver;
    private final ExternalSystem systemA;
    private final ExternalSystem systemB;
    private final SyncOptions options;

    private final ExecutorService fetchPool;
    private final Map<String, ReentrantLock> passLocks = new ConcurrentHashMap<>();
    private final Set<String> tracked = new ConcurrentSkipListSet<>();
    private final AtomicLong passSeq = new AtomicLong();
    private final SyncMetrics metrics = new SyncMetrics();

    public SyncEngine(
            VersionStore store,
            TierCache cache,
            VectorIndexer indexer,
            ConflictResolver resolver,
            ExternalSystem systemA,
            ExternalSystem systemB,
            SyncOptions options
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.indexer = Objects.requireNonNull(indexer, "indexer");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.systemA = Objects.requireNonNull(systemA, "systemA");
        this.systemB = Objects.requireNonNull(systemB, "systemB");
        this.options = Objects.requireNonNull(options, "options");

        AtomicInteger threadSeq = new AtomicInteger();
        this.fetchPool = Executors.newFixedThreadPool(options.fetchThreads(), r -> {
            Thread t = new Thread(r, "sync-fetch-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void track(String contextId) {
        tracked.add(Objects.requireNonNull(contextId, "contextId"));
    }

    public void untrack(String contextId) {
        tracked.remove(contextId);
    }

    public Set<String> trackedContexts() {
        return Set.copyOf(tracked);
    }

    /** One pass over every tracked context; called by the SyncScheduler. */
    public SyncOutcome runScheduledPass() {
        return syncNow(new ArrayList<>(tracked));
    }

    /** Run a pass over {@code contextIds} on the calling thread. */
    public SyncOutcome syncNow(Collection<String> contextIds) {
        List<String> ids = new ArrayList<>(new TreeSet<>(contextIds));
        long passId = passSeq.incrementAndGet();
        if (ids.isEmpty()) {
            // keep draining documents that failed to index earlier
            IndexResult r = indexer.flush();
            SyncOutcome outcome = r.isComplete()
                    ? new SyncOutcome.Committed(SyncPassReport.empty(passId))
                    : new SyncOutcome.PartialIndexFailure(SyncPassReport.empty(passId), r.failed());
            metrics.recordOutcome(outcome);
            return outcome;
        }

        List<ReentrantLock> held = new ArrayList<>(ids.size());
        try {
            for (String id : ids) {
                ReentrantLock l = passLocks.computeIfAbsent(id, k -> new ReentrantLock());
                l.lock();
                held.add(l);
            }
            SyncOutcome outcome = runPass(new Pass(passId, ids));
            metrics.recordOutcome(outcome);
            logOutcome(outcome);
            return outcome;
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) held.get(i).unlock();
        }
    }

    public SyncMetrics metrics() {
        return metrics;
    }

    @Override
    public void close() {
        fetchPool.shutdownNow();
    }

    // ---------- pass ----------

    /** Mutable state of one pass. Confined to the thread running it. */
    private static final class Pass {
        final long id;
        final List<String> ids;
        final long startedNanos = System.nanoTime();
        final Map<String, Long> committed = new TreeMap<>();
        final Map<String, Payload> payloads = new TreeMap<>();
        final Map<String, ConflictReport> reports = new TreeMap<>();
        final Set<String> partial = new TreeSet<>();
        SyncPhase phase = SyncPhase.IDLE;

        Pass(long id, List<String> ids) {
            this.id = id;
            this.ids = ids;
        }

        void enter(SyncPhase next) {
            phase = next;
            LOG.fine(() -> "Sync pass " + id + " -> " + next);
        }

        SyncPassReport report() {
            return new SyncPassReport(id, ids, committed, reports, partial,
                    Duration.ofNanos(System.nanoTime() - startedNanos));
        }
    }

    private record Views(SourceView a, SourceView b) {
        boolean any() {
            return a != null || b != null;
        }
    }

    private record Planned(String contextId, long baseVersion, Views views, MergeResult merge) {}

    private SyncOutcome runPass(Pass pass) {
        pass.enter(SyncPhase.SNAPSHOTTING);
        SyncSnapshot snapshot = store.createSnapshot(pass.ids);

        pass.enter(SyncPhase.FETCHING);
        Map<String, Views> views = fetchAll(pass);

        List<Planned> plans = new ArrayList<>();
        try {
            pass.enter(SyncPhase.MERGING);
            for (String id : pass.ids) {
                Views v = views.get(id);
                if (!v.any()) continue;
                SyncSnapshot.ContextImage image = snapshot.image(id);
                Payload base = image.existed() ? headPayload(image.versions()) : null;
                MergeResult merged = resolver.merge(base, v.a(), v.b());
                pass.reports.put(id, merged.report());
                if (base != null && base.equals(merged.payload())) continue;
                plans.add(new Planned(id, image.currentVersion(), v, merged));
            }
        } catch (RuntimeException e) {
            return rollBack(pass, snapshot, e);
        }

        pass.enter(SyncPhase.COMMITTING);
        if (plans.isEmpty()) return index(pass);

        List<String> planIds = new ArrayList<>();
        for (Planned p : plans) planIds.add(p.contextId());
        try (CommitLease lease = store.acquireCommitLease(planIds)) {
            try {
                for (Planned p : plans) {
                    commitWithRetry(pass, snapshot, p);
                }
                // read everything first so a failure cannot leave a pass version in the cache
                List<CachedContext> fresh = new ArrayList<>();
                for (String id : pass.committed.keySet()) {
                    fresh.add(CachedContext.of(store.getCurrent(id)));
                }
                for (CachedContext c : fresh) cache.set(c.id(), c);
            } catch (RuntimeException e) {
                // restore while still holding the lease so no foreign commit interleaves
                return rollBack(pass, snapshot, e);
            }
        }
        return index(pass);
    }

    private void commitWithRetry(Pass pass, SyncSnapshot snapshot, Planned plan) {
        String id = plan.contextId();
        long expected = plan.baseVersion();
        MergeResult merged = plan.merge();
        try {
            commitOne(pass, snapshot, id, expected, plan.views(), merged);
            return;
        } catch (ConflictCommitException e) {
            metrics.recordCasRetry();
            LOG.info(() -> "Sync pass " + pass.id + ": " + id + " moved from v" + e.expectedVersion()
                    + " to v" + e.actualVersion() + " during the pass, re-merging");
        }

        Base fresh = readFresh(id);
        merged = resolver.merge(fresh.payload, plan.views().a(), plan.views().b());
        pass.reports.put(id, merged.report());
        if (fresh.payload != null && fresh.payload.equals(merged.payload())) return;
        // a second race propagates and rolls the pass back
        commitOne(pass, snapshot, id, fresh.version, plan.views(), merged);
    }

    private void commitOne(Pass pass, SyncSnapshot snapshot, String id, long expected, Views views, MergeResult merged) {
        ConflictReport report = merged.report();
        Map<String, String> meta = new LinkedHashMap<>();
        meta.put(META_PASS, Long.toString(pass.id));
        meta.put(META_CONFLICTS, Integer.toString(report.decisions().size()));
        if (report.hasConflicts()) meta.put(META_WINNERS, report.winnersSummary());
        meta.put(META_PARTIAL, Boolean.toString(report.isPartial()));

        CommitRequest req = new CommitRequest(id, merged.payload(), attribution(views), expected, true, meta);
        long version = store.commit(req);
        snapshot.recordCommitted(id, version);
        pass.committed.put(id, version);
        pass.payloads.put(id, merged.payload());
        metrics.recordCommit();
        cache.invalidate(id);
    }

    private record Base(long version, Payload payload) {}

    private Base readFresh(String id) {
        var current = store.currentVersion(id);
        if (current.isEmpty()) return new Base(0, null);
        return new Base(current.getAsLong(), store.getVersion(id, current.getAsLong()).payload());
    }

    private SyncOutcome index(Pass pass) {
        pass.enter(SyncPhase.INDEXING);
        List<IndexDocument> docs = new ArrayList<>(pass.committed.size());
        for (Map.Entry<String, Long> e : pass.committed.entrySet()) {
            docs.add(IndexDocument.of(e.getKey(), e.getValue(), pass.payloads.get(e.getKey())));
        }
        IndexResult r = indexer.update(docs);
        pass.enter(SyncPhase.IDLE);
        if (!r.isComplete()) {
            return new SyncOutcome.PartialIndexFailure(pass.report(), r.failed());
        }
        return new SyncOutcome.Committed(pass.report());
    }

    private SyncOutcome rollBack(Pass pass, SyncSnapshot snapshot, RuntimeException cause) {
        SyncPhase failedIn = pass.phase;
        pass.enter(SyncPhase.ROLLING_BACK);
        LOG.log(Level.WARNING, "Sync pass " + pass.id + " failed in " + failedIn + ", rolling back "
                + pass.committed.size() + " commit(s): " + cause.getMessage(), cause);
        try {
            store.restoreSnapshot(snapshot);
        } catch (RuntimeException e) {
            SyncFatalException fatal = new SyncFatalException(
                    "Rollback of sync pass " + pass.id + " failed; contexts " + pass.committed.keySet()
                            + " may hold versions from the pass", e);
            fatal.addSuppressed(cause);
            LOG.log(Level.SEVERE, fatal.getMessage(), fatal);
            invalidateAll(pass.ids);
            pass.enter(SyncPhase.IDLE);
            return new SyncOutcome.Aborted(pass.report(), fatal);
        }
        invalidateAll(pass.ids);
        pass.enter(SyncPhase.IDLE);
        return new SyncOutcome.RolledBack(pass.report(), failedIn, cause);
    }

    private void invalidateAll(List<String> ids) {
        for (String id : ids) cache.invalidate(id);
    }

    // ---------- fetching ----------

    private Map<String, Views> fetchAll(Pass pass) {
        Map<String, Future<Optional<SourceSnapshot>>> fa = new TreeMap<>();
        Map<String, Future<Optional<SourceSnapshot>>> fb = new TreeMap<>();
        for (String id : pass.ids) {
            fa.put(id, fetchPool.submit(() -> systemA.fetchCurrent(id)));
            fb.put(id, fetchPool.submit(() -> systemB.fetchCurrent(id)));
        }

        long deadline = System.nanoTime() + options.fetchTimeout().toNanos();
        Map<String, Views> out = new TreeMap<>();
        for (String id : pass.ids) {
            SourceView a = await(pass, systemA, id, fa.get(id), deadline);
            SourceView b = await(pass, systemB, id, fb.get(id), deadline);
            if (a == null || b == null) pass.partial.add(id);
            out.put(id, new Views(a, b));
        }
        return out;
    }

    /** @return the view, or null when the system had nothing, failed or missed the deadline */
    private SourceView await(Pass pass, ExternalSystem system, String id,
                             Future<Optional<SourceSnapshot>> f, long deadlineNanos) {
        try {
            long remaining = Math.max(0, deadlineNanos - System.nanoTime());
            Optional<SourceSnapshot> snap = f.get(remaining, TimeUnit.NANOSECONDS);
            return snap.map(SourceSnapshot::toView).orElse(null);
        } catch (TimeoutException e) {
            f.cancel(true);
            metrics.recordFetchFailure();
            LOG.warning(() -> "Sync pass " + pass.id + ": " + system.name() + " timed out for " + id
                    + " after " + options.fetchTimeout().toMillis() + " ms, continuing without it");
            return null;
        } catch (ExecutionException e) {
            metrics.recordFetchFailure();
            LOG.warning(() -> "Sync pass " + pass.id + ": " + system.name() + " failed for " + id
                    + ", continuing without it: " + e.getCause());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            metrics.recordFetchFailure();
            LOG.warning(() -> "Sync pass " + pass.id + " interrupted while fetching " + id);
            return null;
        }
    }

    // ---------- helpers ----------

    private static Payload headPayload(List<ContextVersion> versions) {
        return versions.get(versions.size() - 1).payload();
    }

    private static SourceSystem attribution(Views v) {
        if (v.a() == null) return SourceSystem.B;
        if (v.b() == null) return SourceSystem.A;
        return SourceSystem.MERGED;
    }

    private static void logOutcome(SyncOutcome outcome) {
        SyncPassReport r = outcome.report();
        if (outcome instanceof SyncOutcome.Committed) {
            LOG.fine(() -> "Sync pass " + r.passId() + " committed " + r.committed().size() + "/"
                    + r.contexts().size() + " context(s), conflicts=" + r.conflictCount()
                    + ", partial=" + r.partialContexts() + " in " + r.elapsed().toMillis() + " ms");
        } else if (outcome instanceof SyncOutcome.PartialIndexFailure p) {
            LOG.warning(() -> "Sync pass " + r.passId() + " committed but left " + p.unindexed()
                    + " unindexed; retrying next pass");
        }
    }
}
