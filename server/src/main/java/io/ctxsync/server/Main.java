// file: server/src/main/java/io/ctxsync/server/Main.java
package io.ctxsync.server;

import com.github.benmanes.caffeine.cache.Ticker;
import io.ctxsync.cache.FileCacheLayer;
import io.ctxsync.cache.LocalCacheLayer;
import io.ctxsync.cache.RedisRestCacheLayer;
import io.ctxsync.cache.Tier;
import io.ctxsync.cache.TierCache;
import io.ctxsync.core.merge.FieldAuthority;
import io.ctxsync.core.merge.FieldLevelConflictResolver;
import io.ctxsync.index.HashingEmbeddingProvider;
import io.ctxsync.index.InMemoryVectorStore;
import io.ctxsync.index.VectorIndexer;
import io.ctxsync.storage.DurableVersionStore;
import io.ctxsync.sync.ExternalSystem;
import io.ctxsync.sync.HttpExternalSystem;
import io.ctxsync.sync.SyncEngine;
import io.ctxsync.sync.SyncScheduler;

import java.net.URI;
import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Convenience runner for a single engine process.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and an optional JSON file).
 *  - Wire storage, the three cache tiers, the indexer and the sync engine.
 *  - Create the ContextManager façade and the admin listener.
 *  - Start the periodic sync scheduler and the metrics reporter.
 */
public final class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        if (EngineConfig.wantsHelp(args)) {
            System.out.println(EngineConfig.usage());
            return;
        }
        EngineConfig cfg;
        try {
            cfg = EngineConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(EngineConfig.usage());
            System.exit(2);
            return;
        }
        Clock clock = Clock.systemUTC();

        // ------ Storage ------
        var store = DurableVersionStore.open(cfg.dataDir(), cfg.store(), clock);

        // ------ Cache tiers ------
        var cacheBuilder = TierCache.builder()
                .clock(clock)
                .layer(Tier.L1, new LocalCacheLayer(cfg.l1MaxSize(), cfg.ttl(Tier.L1), Ticker.systemTicker()))
                .layer(Tier.L3, new FileCacheLayer(cfg.dataDir().resolve("cache")));
        if (cfg.l2Url() != null) {
            cacheBuilder.layer(Tier.L2, new RedisRestCacheLayer(cfg.l2Url(), cfg.l2Token(), cfg.l2Timeout()));
        }
        for (Tier t : Tier.values()) cacheBuilder.ttl(t, cfg.ttl(t));
        TierCache cache = cacheBuilder.build();

        // ------ Index ------
        var indexer = new VectorIndexer(
                new HashingEmbeddingProvider(cfg.embeddingDimensions()),
                new InMemoryVectorStore(),
                cfg.indexBatchSize());

        // ------ Sync ------
        var resolver = new FieldLevelConflictResolver(FieldAuthority.of(cfg.fieldAuthority()));
        var sync = new SyncEngine(store, cache, indexer, resolver,
                externalSystem("A", cfg.systemA(), cfg),
                externalSystem("B", cfg.systemB(), cfg),
                cfg.syncOptions());

        var manager = new ContextManager(store, cache, indexer, sync,
                cfg.populateTier(), cfg.workerThreads(), clock);

        var scheduler = new SyncScheduler(sync, cfg.syncInterval());
        var reporter = new MetricsReporter(manager::metrics, manager::purgeExpired,
                new LoggingMetricsSink(), cfg.metricsInterval());
        var admin = new AdminServer(cfg.adminPort(), manager);

        admin.start();
        scheduler.start();
        reporter.start();
        LOG.info("ctxsync started, data in " + cfg.dataDir().toAbsolutePath()
                + ", admin on http://localhost:" + admin.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                // no new on-demand passes, then drain the running ones before the store closes
                admin.stop();
                reporter.close();
                scheduler.close();
                manager.close();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Shutdown did not complete cleanly", e);
            }
        }, "ctxsync-shutdown"));
    }

    private static ExternalSystem externalSystem(String name, URI base, EngineConfig cfg) {
        if (base == null) {
            LOG.warning("No URL for system " + name + ", its side of every pass will be missing");
            return ExternalSystem.none(name);
        }
        return new HttpExternalSystem(name, base, cfg.fetchTimeout());
    }
}
