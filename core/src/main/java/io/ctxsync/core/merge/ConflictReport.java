package io.ctxsync.core.merge;

import io.ctxsync.core.SourceSystem;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structured record of a merge.
 * <p>
 *  - decisions:      contested fields in sorted field order, with the winner.
 *  - missingSources: systems whose view was unavailable (timeout, error, no data).
 */
public record ConflictReport(List<FieldDecision> decisions, Set<SourceSystem> missingSources) {

    public ConflictReport {
        decisions = List.copyOf(decisions);
        missingSources = missingSources.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(missingSources));
    }

    public static ConflictReport empty() {
        return new ConflictReport(List.of(), Set.of());
    }

    /** True when at least one system's view was missing. */
    public boolean isPartial() {
        return !missingSources.isEmpty();
    }

    public boolean hasConflicts() {
        return !decisions.isEmpty();
    }

    public List<String> fields() {
        return decisions.stream().map(FieldDecision::field).collect(Collectors.toList());
    }

    /** "field=WINNER" pairs joined by commas, stable for a given report. */
    public String winnersSummary() {
        return decisions.stream()
                .map(d -> d.field() + "=" + d.winner())
                .collect(Collectors.joining(","));
    }
}
