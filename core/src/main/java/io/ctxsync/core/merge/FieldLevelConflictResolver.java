package io.ctxsync.core.merge;

import com.fasterxml.jackson.databind.JsonNode;
import io.ctxsync.core.Payload;
import io.ctxsync.core.SourceSystem;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Three-way, per top-level field merge of System A and System B against the
 * last committed payload.
 * <p>
 * For each field name (visited in sorted order):
 *  1) present in only one available view     -> take it.
 *  2) present in both, equal                 -> take it.
 *  3) present in both, only one side moved   -> take the side that differs from base.
 *  4) both moved to different values         -> conflict:
 *        - configured owner wins            (AUTHORITY),
 *        - else later updatedAt wins        (MOST_RECENT),
 *        - else A                           (TIE_BREAK).
 *  5) present only in base                   -> keep the base value.
 * <p>
 * Only case 4 produces report entries.
 */
public final class FieldLevelConflictResolver implements ConflictResolver {
    private final FieldAuthority authority;

    public FieldLevelConflictResolver() {
        this(FieldAuthority.none());
    }

    public FieldLevelConflictResolver(FieldAuthority authority) {
        this.authority = Objects.requireNonNull(authority, "authority");
    }

    @Override
    public MergeResult merge(Payload base, SourceView viewA, SourceView viewB) {
        if (viewA == null && viewB == null) {
            throw new IllegalArgumentException("at least one source view is required");
        }
        Payload b0 = base == null ? Payload.empty() : base;
        Payload a = viewA == null ? null : viewA.payload();
        Payload b = viewB == null ? null : viewB.payload();

        SortedSet<String> names = new TreeSet<>(b0.fieldNames());
        if (a != null) names.addAll(a.fieldNames());
        if (b != null) names.addAll(b.fieldNames());

        Map<String, JsonNode> merged = new TreeMap<>();
        List<FieldDecision> decisions = new ArrayList<>();

        for (String field : names) {
            boolean inA = a != null && a.has(field);
            boolean inB = b != null && b.has(field);

            if (!inA && !inB) {
                merged.put(field, b0.get(field));
            } else if (inA && !inB) {
                merged.put(field, a.get(field));
            } else if (!inA) {
                merged.put(field, b.get(field));
            } else if (a.sameField(field, b)) {
                merged.put(field, a.get(field));
            } else if (b0.has(field) && b0.sameField(field, a)) {
                merged.put(field, b.get(field));
            } else if (b0.has(field) && b0.sameField(field, b)) {
                merged.put(field, a.get(field));
            } else {
                FieldDecision d = decide(field, viewA, viewB);
                decisions.add(d);
                merged.put(field, d.winner() == SourceSystem.A ? a.get(field) : b.get(field));
            }
        }

        Set<SourceSystem> missing = EnumSet.noneOf(SourceSystem.class);
        if (viewA == null) missing.add(SourceSystem.A);
        if (viewB == null) missing.add(SourceSystem.B);

        return new MergeResult(Payload.ofFields(merged), new ConflictReport(decisions, missing));
    }

    // ---------- helpers ----------

    private FieldDecision decide(String field, SourceView viewA, SourceView viewB) {
        var owner = authority.ownerOf(field);
        if (owner.isPresent()) {
            return new FieldDecision(field, owner.get(), DecisionReason.AUTHORITY);
        }
        int cmp = viewA.updatedAt().compareTo(viewB.updatedAt());
        if (cmp > 0) return new FieldDecision(field, SourceSystem.A, DecisionReason.MOST_RECENT);
        if (cmp < 0) return new FieldDecision(field, SourceSystem.B, DecisionReason.MOST_RECENT);
        return new FieldDecision(field, SourceSystem.A, DecisionReason.TIE_BREAK);
    }
}
