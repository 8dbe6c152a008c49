package io.ctxsync.sync;

/**
 * Stages of one sync pass.
 * <p>
 * Happy path: IDLE, SNAPSHOTTING, FETCHING, MERGING, COMMITTING, INDEXING, IDLE.
 * Any failure after SNAPSHOTTING and before INDEXING goes through ROLLING_BACK.
 */
public enum SyncPhase {
    IDLE,
    SNAPSHOTTING,
    FETCHING,
    MERGING,
    COMMITTING,
    INDEXING,
    ROLLING_BACK
}
