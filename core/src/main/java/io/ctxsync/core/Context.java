package io.ctxsync.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Latest committed view of one context.
 *
 * @param id             caller-assigned or generated identifier
 * @param currentVersion version number of the latest commit, always >= 1
 * @param payload        payload of that commit
 * @param sourceSystem   provenance of that commit
 * @param updatedAt      commit time
 */
public record Context(String id, long currentVersion, Payload payload, SourceSystem sourceSystem, Instant updatedAt) {
    public Context {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(sourceSystem, "sourceSystem");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (currentVersion < 1) throw new IllegalArgumentException("currentVersion must be >= 1");
    }

    public static Context of(ContextVersion head) {
        return new Context(head.contextId(), head.versionNumber(), head.payload(),
                head.sourceSystem(), head.createdAt());
    }
}
