package io.ctxsync.storage;

/**
 * Point-in-time VersionStore counters.
 *
 * @param contexts      live contexts (at least one retained version)
 * @param versions      retained versions across all contexts
 * @param commits       successful commits since start
 * @param restores      compensating restores applied since start
 * @param pruned        versions dropped by retention since start
 * @param lastLsn       last log sequence number written
 * @param snapshots     snapshots written since start
 */
public record VersionStoreStats(
        int contexts,
        long versions,
        long commits,
        long restores,
        long pruned,
        long lastLsn,
        long snapshots
) {}
