package io.ctxsync.sync;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background driver for periodic sync passes.
 * <p>
 * One daemon thread, fixed delay between the end of one pass and the start of
 * the next, so at most one scheduled pass runs at a time. On-demand passes
 * through {@link SyncEngine#syncNow} run on their callers' threads.
 * <p>
 * Stopping lets an in-flight pass finish (up to a grace period) so the store
 * is never closed under a pass that is committing or rolling back.
 */
public final class SyncScheduler implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(SyncScheduler.class.getName());

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_STOP_GRACE = Duration.ofSeconds(30);

    private final SyncEngine engine;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    private volatile boolean started;

    public SyncScheduler(SyncEngine engine, Duration interval) {
        this.engine = Objects.requireNonNull(engine, "engine");
        if (interval.isNegative() || interval.isZero()) throw new IllegalArgumentException("interval must be > 0");
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sync-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (started) return;
        started = true;
        scheduler.scheduleWithFixedDelay(this::tickSafe, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info(() -> "Sync scheduler started, interval " + interval.toMillis() + " ms");
    }

    public void stop() {
        stop(DEFAULT_STOP_GRACE);
    }

    /**
     * No further ticks start; waits up to {@code grace} for a running pass,
     * then interrupts it.
     */
    public void stop(Duration grace) {
        scheduler.shutdown();
        try {
            if (scheduler.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) return;
            LOG.warning(() -> "Sync pass still running after " + grace.toMillis() + " ms, interrupting it");
        } catch (InterruptedException e) {
            LOG.warning("Interrupted while waiting for the running sync pass, interrupting it");
            Thread.currentThread().interrupt();
        }
        scheduler.shutdownNow();
    }

    @Override
    public void close() {
        stop();
    }

    // ---------- internals ----------

    private void tickSafe() {
        try {
            engine.runScheduledPass();
        } catch (RuntimeException e) {
            // the next tick retries from scratch
            LOG.log(Level.WARNING, "Scheduled sync pass failed: " + e.getMessage(), e);
        }
    }
}
