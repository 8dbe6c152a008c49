// file: core/src/main/java/io/ctxsync/core/Payload.java
package io.ctxsync.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable structured context payload.
 * <p>
 * Representation:
 *  - A JSON object held as a Jackson tree in canonical form: object keys are
 *    sorted recursively, arrays keep their order.
 *  - The canonical UTF-8 serialization is computed once; equality, hashing and
 *    size accounting all use it, so two equal payloads are byte-identical.
 * <p>
 * Invariants:
 *  - Top-level value is always an object; anything else is a ValidationException.
 *  - The tree is never handed out directly. Accessors return deep copies.
 */
public final class Payload {
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Payload EMPTY = new Payload(MAPPER.createObjectNode());

    private final ObjectNode tree;
    private final byte[] canonical;

    private Payload(ObjectNode sorted) {
        try {
            byte[] bytes = MAPPER.writeValueAsBytes(sorted);
            // Re-read so that numeric node types depend only on the text (1 vs 1L).
            this.tree = (ObjectNode) MAPPER.readTree(bytes);
            this.canonical = bytes;
        } catch (IOException e) {
            throw new ValidationException("payload is not serializable", e);
        }
    }

    public static Payload empty() {
        return EMPTY;
    }

    /** Parse a JSON document; must be an object. */
    public static Payload parse(String json) {
        Objects.requireNonNull(json, "json");
        return parse(json.getBytes(StandardCharsets.UTF_8));
    }

    public static Payload parse(byte[] json) {
        Objects.requireNonNull(json, "json");
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new ValidationException("payload is not valid JSON: " + e.getMessage(), e);
        }
        return of(node);
    }

    /** Wrap an existing tree. The argument is copied, later changes to it are not observed. */
    public static Payload of(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ValidationException("payload must be a JSON object, got "
                    + (node == null ? "null" : node.getNodeType()));
        }
        return new Payload((ObjectNode) sortedCopy(node));
    }

    /** Build from top-level fields; values are copied. */
    public static Payload ofFields(Map<String, JsonNode> fields) {
        ObjectNode obj = MAPPER.createObjectNode();
        for (Map.Entry<String, JsonNode> e : new TreeMap<>(fields).entrySet()) {
            obj.set(e.getKey(), sortedCopy(Objects.requireNonNull(e.getValue(), e.getKey())));
        }
        return new Payload(obj);
    }

    /** Top-level field names in sorted order. */
    public SortedSet<String> fieldNames() {
        SortedSet<String> names = new TreeSet<>();
        tree.fieldNames().forEachRemaining(names::add);
        return Collections.unmodifiableSortedSet(names);
    }

    public boolean has(String field) {
        return tree.has(field);
    }

    /** Deep copy of one top-level value, or null when the field is absent. */
    public JsonNode get(String field) {
        JsonNode v = tree.get(field);
        return v == null ? null : v.deepCopy();
    }

    /** All top-level fields, sorted, values deep-copied. */
    public SortedMap<String, JsonNode> fields() {
        SortedMap<String, JsonNode> out = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = tree.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), e.getValue().deepCopy());
        }
        return out;
    }

    /** Compare one top-level field against another payload's value for it. */
    public boolean sameField(String field, Payload other) {
        JsonNode mine = tree.get(field);
        JsonNode theirs = other.tree.get(field);
        return Objects.equals(mine, theirs);
    }

    public ObjectNode toObjectNode() {
        return tree.deepCopy();
    }

    public byte[] toBytes() {
        return Arrays.copyOf(canonical, canonical.length);
    }

    public String toJson() {
        return new String(canonical, StandardCharsets.UTF_8);
    }

    /** Size of the canonical UTF-8 serialization, the unit the payload cap is expressed in. */
    public int sizeBytes() {
        return canonical.length;
    }

    public boolean isEmpty() {
        return tree.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Payload other)) return false;
        return Arrays.equals(canonical, other.canonical);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(canonical);
    }

    @Override
    public String toString() {
        return toJson();
    }

    // ---------- helpers ----------

    private static JsonNode sortedCopy(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode out = MAPPER.createObjectNode();
            for (String name : names) {
                out.set(name, sortedCopy(node.get(name)));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = MAPPER.createArrayNode();
            for (JsonNode child : node) {
                out.add(sortedCopy(child));
            }
            return out;
        }
        return node.deepCopy();
    }
}
