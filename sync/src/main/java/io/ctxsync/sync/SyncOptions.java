package io.ctxsync.sync;

import java.time.Duration;

/**
 * Tuning knobs for SyncEngine.
 *
 * @param fetchTimeout deadline shared by every fetch of one pass
 * @param fetchThreads size of the fetch pool
 */
public record SyncOptions(Duration fetchTimeout, int fetchThreads) {
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(2);
    public static final int DEFAULT_FETCH_THREADS = 8;

    public SyncOptions {
        if (fetchTimeout == null || fetchTimeout.isNegative() || fetchTimeout.isZero()) {
            throw new IllegalArgumentException("fetchTimeout must be > 0");
        }
        if (fetchThreads < 2) throw new IllegalArgumentException("fetchThreads must be >= 2");
    }

    public static SyncOptions defaults() {
        return new SyncOptions(DEFAULT_FETCH_TIMEOUT, DEFAULT_FETCH_THREADS);
    }

    public SyncOptions withFetchTimeout(Duration timeout) {
        return new SyncOptions(timeout, fetchThreads);
    }
}
