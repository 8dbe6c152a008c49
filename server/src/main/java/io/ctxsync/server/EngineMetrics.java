package io.ctxsync.server;

import io.ctxsync.cache.CacheMetrics;
import io.ctxsync.cache.Tier;
import io.ctxsync.index.IndexerMetrics;
import io.ctxsync.storage.VersionStoreStats;
import io.ctxsync.sync.SyncMetrics;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Combined counters of every component behind a ContextManager.
 */
public record EngineMetrics(
        Instant capturedAt,
        VersionStoreStats store,
        CacheMetrics cache,
        SyncMetrics sync,
        IndexerMetrics index
) {

    /** Nested ordered maps, ready for JSON. */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("capturedAt", capturedAt.toString());

        Map<String, Object> s = new LinkedHashMap<>();
        s.put("contexts", store.contexts());
        s.put("versions", store.versions());
        s.put("commits", store.commits());
        s.put("restores", store.restores());
        s.put("pruned", store.pruned());
        s.put("lastLsn", store.lastLsn());
        s.put("snapshots", store.snapshots());
        out.put("store", s);

        Map<String, Object> c = new LinkedHashMap<>();
        Map<String, Object> hitRates = new LinkedHashMap<>();
        Map<String, Object> sizes = new LinkedHashMap<>();
        for (Tier t : Tier.values()) {
            hitRates.put(t.name(), cache.hitRate(t));
            sizes.put(t.name(), cache.sizes().getOrDefault(t, 0L));
        }
        c.put("requests", cache.requests());
        c.put("misses", cache.misses());
        c.put("overallHitRate", cache.overallHitRate());
        c.put("perTierHitRate", hitRates);
        c.put("sizes", sizes);
        c.put("errors", cache.errors());
        out.put("cache", c);

        Map<String, Object> y = new LinkedHashMap<>();
        y.put("passes", sync.passes());
        y.put("committed", sync.committedPasses());
        y.put("rolledBack", sync.rolledBackPasses());
        y.put("partialIndexFailures", sync.partialIndexPasses());
        y.put("aborted", sync.abortedPasses());
        y.put("partialSyncs", sync.partialSyncs());
        y.put("fetchFailures", sync.fetchFailures());
        y.put("conflicts", sync.conflicts());
        y.put("commits", sync.commits());
        y.put("casRetries", sync.casRetries());
        y.put("lastPassMillis", sync.lastPassMillis());
        y.put("maxPassMillis", sync.maxPassMillis());
        y.put("totalPassMillis", sync.totalPassMillis());
        out.put("sync", y);

        Map<String, Object> i = new LinkedHashMap<>();
        i.put("indexed", index.indexed());
        i.put("failures", index.failures());
        i.put("batches", index.batches());
        i.put("pending", index.pending());
        out.put("index", i);
        return out;
    }

    /** One-line summary for log sinks. */
    public String summary() {
        return String.format(
                "contexts=%d versions=%d commits=%d cacheHitRate=%.3f cacheErrors=%d syncPasses=%d rolledBack=%d aborted=%d conflicts=%d partialSyncs=%d lastPassMs=%d indexPending=%d",
                store.contexts(), store.versions(), store.commits(),
                cache.overallHitRate(), cache.errors(),
                sync.passes(), sync.rolledBackPasses(), sync.abortedPasses(),
                sync.conflicts(), sync.partialSyncs(), sync.lastPassMillis(),
                index.pending());
    }
}
