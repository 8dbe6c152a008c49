package io.ctxsync.storage;

/**
 * Tunables for {@link DurableVersionStore}.
 *
 * @param retention        versions kept per context, oldest pruned first
 * @param maxPayloadBytes  canonical payload size cap
 * @param snapshotEvery    mutations between full snapshots
 * @param walRotateBytes   WAL segment size threshold
 */
public record StoreOptions(int retention, int maxPayloadBytes, int snapshotEvery, long walRotateBytes) {
    public static final int DEFAULT_RETENTION = 100;
    public static final int DEFAULT_MAX_PAYLOAD_BYTES = 10 * 1024 * 1024;
    public static final int DEFAULT_SNAPSHOT_EVERY = 10_000;
    public static final long DEFAULT_WAL_ROTATE_BYTES = 64L * 1024 * 1024;

    public StoreOptions {
        if (retention < 1) throw new IllegalArgumentException("retention must be >= 1");
        if (maxPayloadBytes < 2) throw new IllegalArgumentException("maxPayloadBytes must be >= 2");
        if (snapshotEvery < 1) throw new IllegalArgumentException("snapshotEvery must be >= 1");
        if (walRotateBytes < 1) throw new IllegalArgumentException("walRotateBytes must be >= 1");
    }

    public static StoreOptions defaults() {
        return new StoreOptions(DEFAULT_RETENTION, DEFAULT_MAX_PAYLOAD_BYTES,
                DEFAULT_SNAPSHOT_EVERY, DEFAULT_WAL_ROTATE_BYTES);
    }

    public StoreOptions withRetention(int r) {
        return new StoreOptions(r, maxPayloadBytes, snapshotEvery, walRotateBytes);
    }

    public StoreOptions withMaxPayloadBytes(int max) {
        return new StoreOptions(retention, max, snapshotEvery, walRotateBytes);
    }

    public StoreOptions withSnapshotEvery(int every) {
        return new StoreOptions(retention, maxPayloadBytes, every, walRotateBytes);
    }
}
