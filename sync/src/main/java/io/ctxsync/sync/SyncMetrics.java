package io.ctxsync.sync;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory counters for sync passes. Thread-safe via AtomicLong; exported by
 * whatever reads {@link #toString()} or the accessors.
 */
public final class SyncMetrics {

    private final AtomicLong passes = new AtomicLong();
    private final AtomicLong committedPasses = new AtomicLong();
    private final AtomicLong rolledBackPasses = new AtomicLong();
    private final AtomicLong partialIndexPasses = new AtomicLong();
    private final AtomicLong abortedPasses = new AtomicLong();

    private final AtomicLong partialSyncs = new AtomicLong();
    private final AtomicLong fetchFailures = new AtomicLong();
    private final AtomicLong conflicts = new AtomicLong();
    private final AtomicLong commits = new AtomicLong();
    private final AtomicLong casRetries = new AtomicLong();

    private final AtomicLong lastPassMillis = new AtomicLong();
    private final AtomicLong maxPassMillis = new AtomicLong();
    private final AtomicLong totalPassMillis = new AtomicLong();

    void recordOutcome(SyncOutcome outcome) {
        passes.incrementAndGet();
        if (outcome instanceof SyncOutcome.Committed) {
            committedPasses.incrementAndGet();
        } else if (outcome instanceof SyncOutcome.RolledBack) {
            rolledBackPasses.incrementAndGet();
        } else if (outcome instanceof SyncOutcome.PartialIndexFailure) {
            partialIndexPasses.incrementAndGet();
        } else if (outcome instanceof SyncOutcome.Aborted) {
            abortedPasses.incrementAndGet();
        }
        SyncPassReport r = outcome.report();
        partialSyncs.addAndGet(r.partialContexts().size());
        conflicts.addAndGet(r.conflictCount());
        long ms = r.elapsed().toMillis();
        lastPassMillis.set(ms);
        maxPassMillis.accumulateAndGet(ms, Math::max);
        totalPassMillis.addAndGet(ms);
    }

    void recordFetchFailure() {
        fetchFailures.incrementAndGet();
    }

    void recordCommit() {
        commits.incrementAndGet();
    }

    void recordCasRetry() {
        casRetries.incrementAndGet();
    }

    public long passes()             { return passes.get(); }
    public long committedPasses()    { return committedPasses.get(); }
    public long rolledBackPasses()   { return rolledBackPasses.get(); }
    public long partialIndexPasses() { return partialIndexPasses.get(); }
    public long abortedPasses()      { return abortedPasses.get(); }
    public long partialSyncs()       { return partialSyncs.get(); }
    public long fetchFailures()      { return fetchFailures.get(); }
    public long conflicts()          { return conflicts.get(); }
    public long commits()            { return commits.get(); }
    public long casRetries()         { return casRetries.get(); }
    public long lastPassMillis()     { return lastPassMillis.get(); }
    public long maxPassMillis()      { return maxPassMillis.get(); }
    public long totalPassMillis()    { return totalPassMillis.get(); }

    @Override
    public String toString() {
        return "SyncMetrics{" +
                "passes=" + passes.get() +
                ", committed=" + committedPasses.get() +
                ", rolledBack=" + rolledBackPasses.get() +
                ", partialIndex=" + partialIndexPasses.get() +
                ", aborted=" + abortedPasses.get() +
                ", partialSyncs=" + partialSyncs.get() +
                ", fetchFailures=" + fetchFailures.get() +
                ", conflicts=" + conflicts.get() +
                ", commits=" + commits.get() +
                ", casRetries=" + casRetries.get() +
                ", lastPassMillis=" + lastPassMillis.get() +
                ", maxPassMillis=" + maxPassMillis.get() +
                '}';
    }
}
