package io.ctxsync.core;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Top-level field diff between two payloads, recorded in version metadata.
 * <p>
 * A null "before" means the commit creates the context.
 */
public record PayloadDiff(boolean created, List<String> added, List<String> removed, List<String> changed) {

    public PayloadDiff {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        changed = List.copyOf(changed);
    }

    public static PayloadDiff between(Payload before, Payload after) {
        if (before == null) {
            return new PayloadDiff(true, List.copyOf(after.fieldNames()), List.of(), List.of());
        }
        SortedSet<String> added = new TreeSet<>(after.fieldNames());
        added.removeAll(before.fieldNames());

        SortedSet<String> removed = new TreeSet<>(before.fieldNames());
        removed.removeAll(after.fieldNames());

        SortedSet<String> changed = new TreeSet<>();
        for (String f : after.fieldNames()) {
            if (before.has(f) && !before.sameField(f, after)) changed.add(f);
        }
        return new PayloadDiff(false, List.copyOf(added), List.copyOf(removed), List.copyOf(changed));
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && changed.isEmpty();
    }

    public Map<String, String> toMetadata() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put(ContextVersion.CHANGE_TYPE, created ? "create" : "update");
        m.put("diff.added", String.join(",", added));
        m.put("diff.removed", String.join(",", removed));
        m.put("diff.changed", String.join(",", changed));
        return m;
    }
}
