package io.ctxsync.storage;

import io.ctxsync.core.ContextVersion;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Rollback point for one sync pass.
 * <p>
 * Captures, per touched context, the pre-pass current version and retained
 * version list. The owning pass registers every version it commits with
 * {@link #recordCommitted}; {@link VersionStore#restoreSnapshot} removes exactly
 * those and puts back any pre-pass version that was pruned in the meantime.
 * <p>
 * Lives only for one pass and is never persisted.
 */
public final class SyncSnapshot {

    /** Pre-pass state of one context; currentVersion 0 and no versions when it did not exist. */
    public record ContextImage(String contextId, long currentVersion, List<ContextVersion> versions) {
        public ContextImage {
            versions = List.copyOf(versions);
        }

        public boolean existed() {
            return currentVersion > 0;
        }
    }

    private final long id;
    private final Instant createdAt;
    private final Map<String, ContextImage> images;
    private final Map<String, Set<Long>> committed = new HashMap<>();

    public SyncSnapshot(long id, Instant createdAt, Map<String, ContextImage> images) {
        this.id = id;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.images = Collections.unmodifiableMap(new TreeMap<>(images));
    }

    public long id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** Sorted ids covered by this snapshot. */
    public Set<String> contextIds() {
        return images.keySet();
    }

    public ContextImage image(String contextId) {
        ContextImage img = images.get(contextId);
        if (img == null) throw new IllegalArgumentException("context not in snapshot: " + contextId);
        return img;
    }

    public synchronized void recordCommitted(String contextId, long versionNumber) {
        image(contextId);
        committed.computeIfAbsent(contextId, k -> new TreeSet<>()).add(versionNumber);
    }

    public synchronized Set<Long> committed(String contextId) {
        Set<Long> s = committed.get(contextId);
        return s == null ? Set.of() : Set.copyOf(s);
    }

    public synchronized List<String> touchedContexts() {
        return new ArrayList<>(new TreeSet<>(committed.keySet()));
    }
}
