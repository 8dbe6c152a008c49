package io.ctxsync.core.merge;

import io.ctxsync.core.SourceSystem;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Deployment-supplied field ownership.
 * <p>
 * Rules map either an exact top-level field name or a prefix (written with a
 * trailing '*', e.g. "billing.*" or "crm_*") to the owning system. An exact rule
 * beats any prefix rule, and among prefix rules the longest match wins.
 * <p>
 * Fields that match nothing have no owner. Nothing is guessed: with no rules
 * every conflict is decided by recency.
 */
public final class FieldAuthority {
    private static final FieldAuthority NONE = new FieldAuthority(Map.of(), Map.of());

    private final Map<String, SourceSystem> exact;
    private final Map<String, SourceSystem> prefixes;

    private FieldAuthority(Map<String, SourceSystem> exact, Map<String, SourceSystem> prefixes) {
        this.exact = exact;
        this.prefixes = prefixes;
    }

    public static FieldAuthority none() {
        return NONE;
    }

    /**
     * Build from a config map such as {"title": "A", "crm_*": "B"}.
     *
     * @throws IllegalArgumentException for an empty pattern or an owner other than A/B
     */
    public static FieldAuthority of(Map<String, String> rules) {
        Objects.requireNonNull(rules, "rules");
        if (rules.isEmpty()) return NONE;
        Map<String, SourceSystem> exact = new TreeMap<>();
        Map<String, SourceSystem> prefixes = new TreeMap<>();
        for (Map.Entry<String, String> e : rules.entrySet()) {
            String pattern = e.getKey() == null ? "" : e.getKey().trim();
            SourceSystem owner = SourceSystem.parse(e.getValue());
            if (owner == SourceSystem.MERGED) {
                throw new IllegalArgumentException("field owner must be A or B: " + pattern);
            }
            if (pattern.endsWith("*")) {
                String prefix = pattern.substring(0, pattern.length() - 1);
                if (prefix.isEmpty()) throw new IllegalArgumentException("empty field prefix");
                prefixes.put(prefix, owner);
            } else {
                if (pattern.isEmpty()) throw new IllegalArgumentException("empty field name");
                exact.put(pattern, owner);
            }
        }
        return new FieldAuthority(Collections.unmodifiableMap(exact), Collections.unmodifiableMap(prefixes));
    }

    public Optional<SourceSystem> ownerOf(String field) {
        SourceSystem direct = exact.get(field);
        if (direct != null) return Optional.of(direct);

        String best = null;
        for (String prefix : prefixes.keySet()) {
            if (field.startsWith(prefix) && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        return best == null ? Optional.empty() : Optional.of(prefixes.get(best));
    }

    public boolean isEmpty() {
        return exact.isEmpty() && prefixes.isEmpty();
    }
}
