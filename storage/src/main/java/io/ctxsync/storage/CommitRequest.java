package io.ctxsync.storage;

import io.ctxsync.core.Payload;
import io.ctxsync.core.SourceSystem;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Full form of a VersionStore commit.
 *
 * @param contextId       target context
 * @param payload         new payload
 * @param source          provenance
 * @param expectedVersion {@link #ANY}, 0 for "must not exist yet", or the exact
 *                        current version the payload was derived from
 * @param createIfAbsent  whether an unknown id may be created
 * @param metadata        extra metadata stored next to the diff summary
 */
public record CommitRequest(
        String contextId,
        Payload payload,
        SourceSystem source,
        long expectedVersion,
        boolean createIfAbsent,
        Map<String, String> metadata
) {
    public static final long ANY = -1L;

    public CommitRequest {
        Objects.requireNonNull(contextId, "contextId");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(source, "source");
        if (expectedVersion < ANY) throw new IllegalArgumentException("expectedVersion must be >= -1");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** Create-or-update without a version check. */
    public static CommitRequest upsert(String contextId, Payload payload, SourceSystem source) {
        return new CommitRequest(contextId, payload, source, ANY, true, Map.of());
    }

    public CommitRequest expecting(long version) {
        return new CommitRequest(contextId, payload, source, version, createIfAbsent, metadata);
    }

    public CommitRequest mustExist() {
        return new CommitRequest(contextId, payload, source, expectedVersion, false, metadata);
    }

    public CommitRequest withMetadata(Map<String, String> extra) {
        Map<String, String> m = new LinkedHashMap<>(metadata);
        m.putAll(extra);
        return new CommitRequest(contextId, payload, source, expectedVersion, createIfAbsent, m);
    }
}
