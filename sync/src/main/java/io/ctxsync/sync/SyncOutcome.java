package io.ctxsync.sync;

import io.ctxsync.core.SyncFatalException;

import java.util.List;
import java.util.Objects;

/**
 * Result of one sync pass, modelled as the compensating-action outcomes it can end in.
 */
public sealed interface SyncOutcome
        permits SyncOutcome.Committed, SyncOutcome.RolledBack, SyncOutcome.PartialIndexFailure, SyncOutcome.Aborted {

    SyncPassReport report();

    /** Every merge was committed (or was a no-op) and indexed. */
    record Committed(SyncPassReport report) implements SyncOutcome {
        public Committed {
            Objects.requireNonNull(report, "report");
        }
    }

    /** A commit failed; the pass's versions were removed again. */
    record RolledBack(SyncPassReport report, SyncPhase failedIn, RuntimeException cause) implements SyncOutcome {
        public RolledBack {
            Objects.requireNonNull(report, "report");
            Objects.requireNonNull(failedIn, "failedIn");
            Objects.requireNonNull(cause, "cause");
        }
    }

    /** Commits stand, but these ids are not searchable yet; they are retried on the next pass. */
    record PartialIndexFailure(SyncPassReport report, List<String> unindexed) implements SyncOutcome {
        public PartialIndexFailure {
            Objects.requireNonNull(report, "report");
            unindexed = List.copyOf(unindexed);
        }
    }

    /** Rolling back itself failed; the store may hold versions from this pass. */
    record Aborted(SyncPassReport report, SyncFatalException cause) implements SyncOutcome {
        public Aborted {
            Objects.requireNonNull(report, "report");
            Objects.requireNonNull(cause, "cause");
        }
    }
}
