package io.ctxsync.server;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically pushes EngineMetrics to a sink and runs cache housekeeping.
 *
 * Each tick:
 *  - purge expired cache entries (maintenance hook),
 *  - publish a metrics snapshot.
 *
 * A failing sink or hook is logged and skipped; the next tick runs normally.
 */
public final class MetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(MetricsReporter.class.getName());

    private final Supplier<EngineMetrics> source;
    private final Runnable maintenance;
    private final MetricsSink sink;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public MetricsReporter(Supplier<EngineMetrics> source, Runnable maintenance, MetricsSink sink, Duration interval) {
        this.source = Objects.requireNonNull(source, "source");
        this.maintenance = Objects.requireNonNull(maintenance, "maintenance");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metrics-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(this::tick, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** One round, also used directly by tests and on shutdown. */
    public void tick() {
        try {
            maintenance.run();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Maintenance tick failed: " + e.getMessage(), e);
        }
        try {
            sink.publish(source.get());
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Publishing metrics failed: " + e.getMessage(), e);
        }
    }

    /** Lets a running tick finish (bounded) before the cache underneath is closed. */
    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (scheduler.awaitTermination(5, TimeUnit.SECONDS)) return;
            LOG.warning("Metrics tick still running at shutdown, interrupting it");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler.shutdownNow();
    }
}
