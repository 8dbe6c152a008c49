package io.ctxsync.core.merge;

import com.fasterxml.jackson.databind.JsonNode;
import io.ctxsync.core.Context;
import io.ctxsync.core.Payload;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Strategies for an explicit, caller-triggered merge of several contexts into
 * a new one. Inputs are ordered as the caller listed them.
 */
public enum MergeStrategy {
    /** All fields of all inputs; later inputs override earlier ones. */
    UNION {
        @Override
        public Payload apply(List<Context> inputs) {
            requireInputs(inputs);
            Map<String, JsonNode> out = new TreeMap<>();
            for (Context c : inputs) {
                out.putAll(c.payload().fields());
            }
            return Payload.ofFields(out);
        }
    },
    /** Payload of the last input in the caller's order, regardless of update times. */
    LATEST {
        @Override
        public Payload apply(List<Context> inputs) {
            requireInputs(inputs);
            return inputs.get(inputs.size() - 1).payload();
        }
    },
    /** Fields present in every input, valued from the first input. */
    INTERSECTION {
        @Override
        public Payload apply(List<Context> inputs) {
            requireInputs(inputs);
            SortedMap<String, JsonNode> out = inputs.get(0).payload().fields();
            for (Context c : inputs.subList(1, inputs.size())) {
                out.keySet().retainAll(c.payload().fieldNames());
            }
            return Payload.ofFields(out);
        }
    };

    public abstract Payload apply(List<Context> inputs);

    public static MergeStrategy parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("merge strategy must not be blank");
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown merge strategy: " + raw, e);
        }
    }

    private static void requireInputs(List<Context> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("at least one context is required");
        }
    }
}
