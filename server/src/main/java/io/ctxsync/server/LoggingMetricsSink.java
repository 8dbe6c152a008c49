package io.ctxsync.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/** Publishes the metric summary as one log line. */
public final class LoggingMetricsSink implements MetricsSink {
    private static final Logger log = Logger.getLogger("io.ctxsync.metrics");

    private final Level level;

    public LoggingMetricsSink() {
        this(Level.INFO);
    }

    public LoggingMetricsSink(Level level) {
        this.level = level;
    }

    @Override
    public void publish(EngineMetrics metrics) {
        if (log.isLoggable(level)) {
            log.log(level, "metrics " + metrics.summary());
        }
    }
}
