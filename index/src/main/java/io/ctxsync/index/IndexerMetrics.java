package io.ctxsync.index;

/**
 * @param indexed   documents upserted since start
 * @param failures  documents whose batch failed (counted per attempt)
 * @param batches   embedding batches attempted
 * @param pending   documents currently waiting
 */
public record IndexerMetrics(long indexed, long failures, long batches, int pending) {}
