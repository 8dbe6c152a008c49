package io.ctxsync.storage;

import io.ctxsync.core.ContextVersion;

import java.util.List;
import java.util.Map;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the store's state as of some log sequence number.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL records with a larger LSN.
 */
public interface Snapshotter {

    /**
     * Persist a full image of the store.
     *
     * @return snapshot identifier (e.g. file name)
     */
    String writeSnapshot(StoreImage image);

    /** Load the latest snapshot, or null when none was ever written. */
    LoadedSnapshot loadLatest();

    /**
     * Full store state.
     *
     * @param lastLsn  LSN of the last record reflected in the image
     * @param contexts per-context retained versions (ascending) and high-water mark
     */
    record StoreImage(long lastLsn, Map<String, ContextImage> contexts) {
        public StoreImage {
            contexts = Map.copyOf(contexts);
        }
    }

    /**
     * @param highWater largest version number ever assigned, kept even when
     *                  versions is empty so numbers are never reused
     */
    record ContextImage(long highWater, List<ContextVersion> versions) {
        public ContextImage {
            versions = List.copyOf(versions);
        }
    }

    /** Simple holder for snapshot id and its data. */
    record LoadedSnapshot(String id, StoreImage image) {}
}
