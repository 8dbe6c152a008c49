package io.ctxsync.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable historical record of one commit.
 * <p>
 * Metadata is free-form, but every commit carries at least the diff summary
 * keys written by {@link PayloadDiff#toMetadata()}.
 */
public record ContextVersion(
        String contextId,
        long versionNumber,
        Payload payload,
        SourceSystem sourceSystem,
        Instant createdAt,
        Map<String, String> metadata
) {
    public static final String CHANGE_TYPE = "change.type";

    public ContextVersion {
        Objects.requireNonNull(contextId, "contextId");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(sourceSystem, "sourceSystem");
        Objects.requireNonNull(createdAt, "createdAt");
        if (versionNumber < 1) throw new IllegalArgumentException("versionNumber must be >= 1");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
