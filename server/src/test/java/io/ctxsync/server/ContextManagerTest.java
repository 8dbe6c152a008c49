package io.ctxsync.server;

import io.ctxsync.cache.LocalCacheLayer;
import io.ctxsync.cache.Tier;
import io.ctxsync.cache.TierCache;
import io.ctxsync.core.Context;
import io.ctxsync.core.ContextVersion;
import io.ctxsync.core.NotFoundException;
import io.ctxsync.core.Payload;
import io.ctxsync.core.SourceSystem;
import io.ctxsync.core.merge.FieldLevelConflictResolver;
import io.ctxsync.core.merge.MergeStrategy;
import io.ctxsync.index.HashingEmbeddingProvider;
import io.ctxsync.index.InMemoryVectorStore;
import io.ctxsync.index.ScoredContext;
import io.ctxsync.index.VectorIndexer;
import io.ctxsync.storage.DurableVersionStore;
import io.ctxsync.storage.StoreOptions;
import io.ctxsync.storage.VersionPage;
import io.ctxsync.sync.ExternalSystem;
import io.ctxsync.sync.SyncEngine;
import io.ctxsync.sync.SyncOptions;
import io.ctxsync.sync.SyncOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ContextManagerTest {

    @TempDir
    Path dir;

    private TestClock clock;
    private TierCache cache;
    private ContextManager manager;

    @BeforeEach
    void setUp() {
        clock = new TestClock(Instant.parse("2024-05-01T12:00:00Z"));
        var store = DurableVersionStore.open(dir, StoreOptions.defaults(), clock);
        cache = TierCache.builder().clock(clock).layer(Tier.L1, new LocalCacheLayer()).build();
        var indexer = new VectorIndexer(new HashingEmbeddingProvider(), new InMemoryVectorStore());
        var sync = new SyncEngine(store, cache, indexer, new FieldLevelConflictResolver(),
                ExternalSystem.none("A"), ExternalSystem.none("B"), SyncOptions.defaults());
        manager = new ContextManager(store, cache, indexer, sync, Tier.L3, 4, clock);
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Test
    void store_then_get_returns_latest_and_fills_the_cache() {
        assertEquals(1, manager.store("ctx", Payload.parse("{\"a\":1}"), SourceSystem.A));
        assertEquals(2, manager.store("ctx", Payload.parse("{\"a\":2}"), SourceSystem.B));

        Context first = manager.get("ctx");
        assertEquals(2, first.currentVersion());
        assertEquals(Payload.parse("{\"a\":2}"), first.payload());
        assertEquals(SourceSystem.B, first.sourceSystem());

        manager.get("ctx");
        var m = manager.metrics().cache();
        assertEquals(2, m.requests());
        assertEquals(1, m.hits().get(Tier.L1).longValue());
    }

    @Test
    void store_invalidates_a_cached_entry() {
        manager.store("ctx", Payload.parse("{\"a\":1}"), SourceSystem.A);
        manager.get("ctx");
        manager.store("ctx", Payload.parse("{\"a\":9}"), SourceSystem.A);

        assertEquals(Payload.parse("{\"a\":9}"), manager.get("ctx").payload());
    }

    @Test
    void get_of_unknown_context_throws_not_found() {
        assertThrows(NotFoundException.class, () -> manager.get("missing"));
    }

    @Test
    void readers_never_see_a_version_older_than_their_own_store() throws Exception {
        manager.store("shared", Payload.parse("{\"n\":0}"), SourceSystem.A);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < 4; w++) {
                int writer = w;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 50; i++) {
                        long mine = manager.store("shared",
                                Payload.parse("{\"w\":" + writer + ",\"i\":" + i + "}"), SourceSystem.A);
                        long seen = manager.get("shared").currentVersion();
                        assertTrue(seen >= mine, "read v" + seen + " after storing v" + mine);
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(201, manager.get("shared").currentVersion());
    }

    @Test
    void union_merge_lets_later_contexts_override_earlier_ones() {
        manager.store("x", Payload.parse("{\"a\":1,\"b\":1}"), SourceSystem.A);
        manager.store("y", Payload.parse("{\"b\":2,\"c\":2}"), SourceSystem.B);

        Context merged = manager.mergeContexts(List.of("x", "y"), MergeStrategy.UNION);

        assertTrue(merged.id().matches("merged-[0-9a-f]{8}"), merged.id());
        assertEquals(1, merged.currentVersion());
        assertEquals(SourceSystem.MERGED, merged.sourceSystem());
        assertEquals(Payload.parse("{\"a\":1,\"b\":2,\"c\":2}"), merged.payload());

        ContextVersion v = manager.getVersion(merged.id(), 1);
        assertEquals("UNION", v.metadata().get(ContextManager.META_MERGE_STRATEGY));
        assertEquals("x,y", v.metadata().get(ContextManager.META_MERGE_PARENTS));
    }

    @Test
    void latest_merge_takes_the_last_resolvable_context_in_caller_order() {
        manager.store("old", Payload.parse("{\"v\":\"old\"}"), SourceSystem.A);
        clock.advance(Duration.ofSeconds(5));
        manager.store("new", Payload.parse("{\"v\":\"new\"}"), SourceSystem.A);

        Context merged = manager.mergeContexts(List.of("new", "old", "missing"), MergeStrategy.LATEST);

        assertEquals(Payload.parse("{\"v\":\"old\"}"), merged.payload());
    }

    @Test
    void intersection_merge_keeps_common_fields_valued_from_the_first() {
        manager.store("x", Payload.parse("{\"a\":1,\"b\":1}"), SourceSystem.A);
        manager.store("y", Payload.parse("{\"b\":2,\"c\":2}"), SourceSystem.B);

        Context merged = manager.mergeContexts(List.of("x", "y"), MergeStrategy.INTERSECTION);

        assertEquals(Payload.parse("{\"b\":1}"), merged.payload());
    }

    @Test
    void merge_skips_unknown_ids_and_fails_when_none_resolve() {
        manager.store("x", Payload.parse("{\"a\":1}"), SourceSystem.A);

        Context merged = manager.mergeContexts(List.of("ghost", "x"), MergeStrategy.UNION);
        assertEquals(Payload.parse("{\"a\":1}"), merged.payload());
        assertEquals("x", manager.getVersion(merged.id(), 1).metadata().get(ContextManager.META_MERGE_PARENTS));

        assertThrows(NotFoundException.class,
                () -> manager.mergeContexts(List.of("ghost", "phantom"), MergeStrategy.UNION));
    }

    @Test
    void history_pages_newest_first() {
        for (int i = 1; i <= 5; i++) {
            manager.store("h", Payload.parse("{\"i\":" + i + "}"), SourceSystem.A);
        }

        VersionPage first = manager.history("h", 2, OptionalLong.empty());
        assertEquals(List.of(5L, 4L), first.versions().stream().map(ContextVersion::versionNumber).toList());
        assertTrue(first.nextCursor().isPresent());

        VersionPage second = manager.history("h", 2, first.nextCursor());
        assertEquals(List.of(3L, 2L), second.versions().stream().map(ContextVersion::versionNumber).toList());
    }

    @Test
    void stored_contexts_become_searchable_after_a_sync_pass() throws Exception {
        Payload p = Payload.parse("{\"topic\":\"billing\",\"owner\":\"finance\"}");
        manager.store("billing", p, SourceSystem.A);
        manager.store("other", Payload.parse("{\"topic\":\"weather\"}"), SourceSystem.A);
        assertTrue(manager.searchSimilar(p.toJson(), 5, 0.5).isEmpty());

        SyncOutcome outcome = manager.syncNow(List.of());
        assertInstanceOf(SyncOutcome.Committed.class, outcome);

        List<ScoredContext> hits = manager.searchSimilarAsync(p.toJson(), 1, 0.5).get(5, TimeUnit.SECONDS);
        assertEquals(1, hits.size());
        assertEquals("billing", hits.get(0).contextId());
        assertEquals(2, manager.metrics().index().indexed());
    }

    @Test
    void get_async_completes_with_the_current_context() throws Exception {
        manager.store("ctx", Payload.parse("{\"a\":1}"), SourceSystem.A);

        Context c = manager.getAsync("ctx").get(5, TimeUnit.SECONDS);

        assertEquals(1, c.currentVersion());
    }

    @Test
    void warm_loads_known_contexts_and_skips_unknown_ones() {
        manager.store("a", Payload.parse("{\"a\":1}"), SourceSystem.A);
        manager.store("b", Payload.parse("{\"b\":1}"), SourceSystem.A);

        assertEquals(2, manager.warm(List.of("a", "b", "ghost")));

        manager.get("a");
        assertEquals(1, manager.metrics().cache().hits().get(Tier.L1).longValue());
    }

    @Test
    void metrics_combine_every_component() {
        manager.store("a", Payload.parse("{\"a\":1}"), SourceSystem.A);
        manager.syncNow(List.of("a"));

        EngineMetrics m = manager.metrics();

        assertEquals(1, m.store().contexts());
        assertEquals(1, m.store().commits());
        assertEquals(1, m.sync().passes());
        assertEquals(0, m.index().pending());
        assertTrue(m.summary().contains("contexts=1"));
        assertTrue(m.toMap().containsKey("cache"));
    }
}
