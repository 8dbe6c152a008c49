package io.ctxsync.sync;

import io.ctxsync.core.merge.ConflictReport;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * What one sync pass did.
 *
 * @param passId           engine-local pass sequence number
 * @param contexts         sorted ids the pass covered
 * @param committed        context id -> version committed by this pass (rolled back passes keep
 *                         the versions they had written before failing)
 * @param conflicts        context id -> merge report, for every context that was merged
 * @param partialContexts  contexts where at least one producer view was missing
 * @param elapsed          wall time of the pass
 */
public record SyncPassReport(
        long passId,
        List<String> contexts,
        Map<String, Long> committed,
        Map<String, ConflictReport> conflicts,
        Set<String> partialContexts,
        Duration elapsed
) {
    public SyncPassReport {
        contexts = List.copyOf(contexts);
        committed = Collections.unmodifiableMap(new TreeMap<>(committed));
        conflicts = Collections.unmodifiableMap(new TreeMap<>(conflicts));
        partialContexts = Collections.unmodifiableSet(new TreeSet<>(partialContexts));
    }

    public static SyncPassReport empty(long passId) {
        return new SyncPassReport(passId, List.of(), Map.of(), Map.of(), Set.of(), Duration.ZERO);
    }

    /** Contested fields across all contexts of the pass. */
    public int conflictCount() {
        int n = 0;
        for (ConflictReport r : conflicts.values()) n += r.decisions().size();
        return n;
    }

    public ConflictReport conflictReport(String contextId) {
        ConflictReport r = conflicts.get(contextId);
        return r == null ? ConflictReport.empty() : r;
    }
}
