// file: bench/src/main/java/io/ctxsync/bench/CacheHitRateBench.java
package io.ctxsync.bench;

import com.fasterxml.jackson.databind.node.BooleanNode;
import com.github.benmanes.caffeine.cache.Ticker;
import io.ctxsync.cache.FileCacheLayer;
import io.ctxsync.cache.LocalCacheLayer;
import io.ctxsync.cache.Tier;
import io.ctxsync.cache.TierCache;
import io.ctxsync.core.Context;
import io.ctxsync.core.Payload;
import io.ctxsync.core.SourceSystem;
import io.ctxsync.core.merge.FieldLevelConflictResolver;
import io.ctxsync.index.HashingEmbeddingProvider;
import io.ctxsync.index.InMemoryVectorStore;
import io.ctxsync.index.VectorIndexer;
import io.ctxsync.server.ContextManager;
import io.ctxsync.server.EngineMetrics;
import io.ctxsync.storage.DurableVersionStore;
import io.ctxsync.storage.StoreOptions;
import io.ctxsync.sync.ExternalSystem;
import io.ctxsync.sync.SourceSnapshot;
import io.ctxsync.sync.SyncEngine;
import io.ctxsync.sync.SyncOptions;
import io.ctxsync.sync.SyncOutcome;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SplittableRandom;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * In-process workload driver for the read path and the sync pass.
 *
 * Usage:
 *   java -cp bench.jar io.ctxsync.bench.CacheHitRateBench \
 *     --threads 8 \
 *     --duration-seconds 20 \
 *     --contexts 10000 \
 *     --l1-size 1000 \
 *     --write-ratio 0.05 \
 *     --zipf-skew 0.99 \
 *     --sync-batch 50
 *
 * Output:
 *   - Summary lines to stderr: cache hit rate per tier, read latency
 *     percentiles, sync pass latency percentiles.
 *   - CSV to stdout with per-op latency samples:
 *       op,success,latency_ms
 */
public final class CacheHitRateBench {

    private record Sample(String op, boolean ok, double latencyMs) {}

    private CacheHitRateBench() {
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> cfg = parseArgs(args);

        int threads = Integer.parseInt(cfg.getOrDefault("threads", "4"));
        int durationSeconds = Integer.parseInt(cfg.getOrDefault("duration-seconds", "20"));
        int contexts = Integer.parseInt(cfg.getOrDefault("contexts", "10000"));
        long l1Size = Long.parseLong(cfg.getOrDefault("l1-size", "1000"));
        double writeRatio = Double.parseDouble(cfg.getOrDefault("write-ratio", "0.05"));
        double zipfSkew = Double.parseDouble(cfg.getOrDefault("zipf-skew", "0.99"));
        int syncBatch = Integer.parseInt(cfg.getOrDefault("sync-batch", "50"));

        Path dir = Files.createTempDirectory("ctxsync-bench");
        runBenchmark(dir, threads, durationSeconds, contexts, l1Size, writeRatio, zipfSkew, syncBatch);
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("--")) throw new IllegalArgumentException("unexpected arg: " + a);
            if (i + 1 >= args.length) throw new IllegalArgumentException("missing value for " + a);
            out.put(a.substring(2), args[++i]);
        }
        return out;
    }

    static void runBenchmark(
            Path dir,
            int threads,
            int durationSeconds,
            int contexts,
            long l1Size,
            double writeRatio,
            double zipfSkew,
            int syncBatch
    ) throws IOException, InterruptedException {
        Clock clock = Clock.systemUTC();
        var store = DurableVersionStore.open(dir.resolve("store"), StoreOptions.defaults().withRetention(10), clock);
        var cache = TierCache.builder()
                .clock(clock)
                .layer(Tier.L1, new LocalCacheLayer(l1Size, Tier.L1.defaultTtl(), Ticker.systemTicker()))
                .layer(Tier.L3, new FileCacheLayer(dir.resolve("cache")))
                .build();
        var indexer = new VectorIndexer(new HashingEmbeddingProvider(), new InMemoryVectorStore());
        var sync = new SyncEngine(store, cache, indexer, new FieldLevelConflictResolver(),
                new EchoSystem("A", store::getCurrent, "a_seen"),
                new EchoSystem("B", store::getCurrent, "b_seen"),
                SyncOptions.defaults());

        try (var manager = new ContextManager(store, cache, indexer, sync, Tier.L3, threads, clock)) {
            for (int i = 0; i < contexts; i++) {
                manager.store(id(i), payload(i, 0), SourceSystem.A);
            }
            System.err.printf("seeded %d contexts%n", contexts);

            ZipfianKeyGenerator zipf = new ZipfianKeyGenerator(contexts, zipfSkew);
            BlockingQueue<Sample> samples = new LinkedBlockingQueue<>();
            long endTime = System.nanoTime() + TimeUnit.SECONDS.toNanos(durationSeconds);
            ExecutorService exec = Executors.newFixedThreadPool(threads + 1);

            for (int t = 0; t < threads; t++) {
                SplittableRandom rnd = new SplittableRandom(42L + t);
                exec.submit(() -> {
                    while (System.nanoTime() < endTime) {
                        int k = zipf.next(rnd);
                        boolean write = rnd.nextDouble() < writeRatio;
                        long start = System.nanoTime();
                        boolean ok = true;
                        try {
                            if (write) {
                                manager.store(id(k), payload(k, rnd.nextInt()), SourceSystem.A);
                            } else {
                                manager.get(id(k));
                            }
                        } catch (RuntimeException e) {
                            ok = false;
                        }
                        samples.add(new Sample(write ? "STORE" : "GET", ok, millisSince(start)));
                    }
                });
            }

            // one thread drives sync passes over the hot head of the keyspace
            exec.submit(() -> {
                SplittableRandom rnd = new SplittableRandom(7L);
                while (System.nanoTime() < endTime) {
                    List<String> batch = new ArrayList<>(syncBatch);
                    for (int i = 0; i < syncBatch; i++) batch.add(id(zipf.next(rnd)));
                    long start = System.nanoTime();
                    SyncOutcome outcome = manager.syncNow(batch);
                    samples.add(new Sample("SYNC", outcome instanceof SyncOutcome.Committed, millisSince(start)));
                }
            });

            exec.shutdown();
            exec.awaitTermination(durationSeconds + 30L, TimeUnit.SECONDS);

            List<Sample> all = new ArrayList<>(samples.size());
            samples.drainTo(all);
            summarizeAndPrint(all, manager.metrics(), durationSeconds);
        }
    }

    private static String id(int k) {
        return "ctx-" + k;
    }

    private static Payload payload(int k, int revision) {
        return Payload.parse("{\"id\":" + k + ",\"revision\":" + revision
                + ",\"summary\":\"context number " + k + "\"}");
    }

    private static double millisSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static void summarizeAndPrint(List<Sample> all, EngineMetrics metrics, int durationSeconds) {
        if (all.isEmpty()) {
            System.err.println("no samples collected");
            return;
        }
        for (String op : List.of("GET", "STORE", "SYNC")) {
            List<Double> latencies = new ArrayList<>();
            long ok = 0;
            long err = 0;
            for (Sample s : all) {
                if (!s.op().equals(op)) continue;
                if (s.ok()) {
                    ok++;
                    latencies.add(s.latencyMs());
                } else {
                    err++;
                }
            }
            Collections.sort(latencies);
            System.err.printf("%-5s throughput=%.2f ops/s, ok=%d, err=%d, p50=%.3fms, p95=%.3fms, p99=%.3fms%n",
                    op, (ok + err) / (double) durationSeconds, ok, err,
                    percentile(latencies, 0.50), percentile(latencies, 0.95), percentile(latencies, 0.99));
        }
        var c = metrics.cache();
        System.err.printf("cache hitRate=%.4f L1=%.4f L2=%.4f L3=%.4f errors=%d%n",
                c.overallHitRate(), c.hitRate(Tier.L1), c.hitRate(Tier.L2), c.hitRate(Tier.L3), c.errors());
        System.err.println("engine " + metrics.summary());

        System.out.println("op,success,latency_ms");
        for (Sample s : all) {
            System.out.printf("%s,%s,%.3f%n", s.op(), s.ok() ? "1" : "0", s.latencyMs());
        }
    }

    static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }

    /** Producer that reports the stored payload with one field of its own added. */
    private static final class EchoSystem implements ExternalSystem {
        private final String name;
        private final Function<String, Context> source;
        private final String marker;

        EchoSystem(String name, Function<String, Context> source, String marker) {
            this.name = name;
            this.source = source;
            this.marker = marker;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Optional<SourceSnapshot> fetchCurrent(String contextId) {
            var current = source.apply(contextId);
            var fields = current.payload().fields();
            fields.put(marker, BooleanNode.TRUE);
            return Optional.of(new SourceSnapshot(Payload.ofFields(fields), current.currentVersion(), Instant.now()));
        }
    }
}
