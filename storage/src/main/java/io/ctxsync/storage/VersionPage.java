package io.ctxsync.storage;

import io.ctxsync.core.ContextVersion;

import java.util.List;
import java.util.OptionalLong;

/**
 * One page of {@code listVersions}, newest first.
 *
 * @param nextCursor pass as {@code beforeVersion} to continue; empty on the last page
 */
public record VersionPage(List<ContextVersion> versions, OptionalLong nextCursor) {
    public VersionPage {
        versions = List.copyOf(versions);
    }
}
