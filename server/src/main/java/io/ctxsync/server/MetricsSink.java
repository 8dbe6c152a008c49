package io.ctxsync.server;

/**
 * Push-based observability sink. Fire-and-forget: implementations must not
 * block for long and their failures are logged by the caller, never rethrown.
 */
@FunctionalInterface
public interface MetricsSink {
    void publish(EngineMetrics metrics);
}
