package io.ctxsync.index;

import io.ctxsync.core.Payload;

import java.util.Map;
import java.util.Objects;

/**
 * A committed context version waiting to be embedded.
 *
 * @param text the text handed to the embedding provider (canonical payload JSON)
 */
public record IndexDocument(String contextId, long version, String text, Map<String, String> metadata) {
    public IndexDocument {
        Objects.requireNonNull(contextId, "contextId");
        Objects.requireNonNull(text, "text");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static IndexDocument of(String contextId, long version, Payload payload) {
        return new IndexDocument(contextId, version, payload.toJson(),
                Map.of("version", Long.toString(version)));
    }
}
