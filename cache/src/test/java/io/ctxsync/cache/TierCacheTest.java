package io.ctxsync.cache;

import io.ctxsync.core.Payload;
import io.ctxsync.core.SourceSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TierCacheTest {

    private TestClock clock;
    private LocalCacheLayer l1;
    private InMemoryLayer l2;
    private InMemoryLayer l3;
    private TierCache cache;

    @BeforeEach
    void setUp() {
        clock = new TestClock(Instant.parse("2024-01-01T00:00:00Z"));
        l1 = new LocalCacheLayer(100, Tier.L1.defaultTtl(), clock::nanos);
        l2 = new InMemoryLayer();
        l3 = new InMemoryLayer();
        cache = TierCache.builder()
                .layer(Tier.L1, l1)
                .layer(Tier.L2, l2)
                .layer(Tier.L3, l3)
                .clock(clock)
                .build();
    }

    private CachedContext ctx(String id, long version, String json) {
        return new CachedContext(id, version, Payload.parse(json), SourceSystem.A, clock.instant());
    }

    @Test
    void full_miss_is_counted_once() {
        assertTrue(cache.get("nope").isEmpty());
        CacheMetrics m = cache.metrics();
        assertEquals(1, m.misses());
        assertEquals(1, m.requests());
        assertEquals(0.0, m.overallHitRate());
    }

    @Test
    void set_writes_requested_tier_and_all_faster_ones() {
        cache.set("a", ctx("a", 1, "{}"), Tier.L2);

        assertTrue(l1.get("a").isPresent());
        assertTrue(l2.entries.containsKey("a"));
        assertFalse(l3.entries.containsKey("a"));
        assertEquals(Tier.L2, l2.entries.get("a").tier());
        assertEquals(clock.instant().plus(Tier.L2.defaultTtl()), l2.entries.get("a").expiresAt());
    }

    @Test
    void expired_l1_entry_is_served_from_l2_and_promoted() {
        cache.set("a", ctx("a", 3, "{\"x\":1}"), Tier.L2);
        clock.advance(Duration.ofSeconds(301)); // past L1 TTL, inside L2 TTL

        Optional<CachedContext> got = cache.get("a");

        assertTrue(got.isPresent());
        assertEquals(3, got.get().version());
        CacheMetrics m = cache.metrics();
        assertEquals(1L, m.hits().get(Tier.L2));
        assertEquals(0L, m.hits().get(Tier.L1));
        assertEquals(0, m.misses());
        assertTrue(l1.get("a").isPresent(), "L1 repopulated");

        cache.get("a");
        assertEquals(1L, cache.metrics().hits().get(Tier.L1));
    }

    @Test
    void l3_hit_promotes_into_l2_and_l1() {
        Instant now = clock.instant();
        l3.entries.put("k", new CacheEntry("k", ctx("k", 1, "{}"), Tier.L3, now.plusSeconds(100)));

        assertTrue(cache.get("k").isPresent());

        assertEquals(1L, cache.metrics().hits().get(Tier.L3));
        assertTrue(l2.entries.containsKey("k"));
        assertTrue(l1.get("k").isPresent());
    }

    @Test
    void slow_tier_read_does_not_overwrite_a_newer_write_when_promoted() throws Exception {
        l2.entries.put("a", new CacheEntry("a", ctx("a", 1, "{\"v\":1}"), Tier.L2, clock.instant().plusSeconds(100)));
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch parked = l2.holdNextGet(release);

        ExecutorService reader = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<CachedContext>> slow = reader.submit(() -> cache.get("a"));
            assertTrue(parked.await(5, TimeUnit.SECONDS));

            cache.invalidate("a");
            cache.set("a", ctx("a", 2, "{\"v\":2}"));
            release.countDown();

            assertEquals(1, slow.get(5, TimeUnit.SECONDS).orElseThrow().version());
            assertEquals(2, cache.get("a").orElseThrow().version());
            assertEquals(2, l1.get("a").orElseThrow().value().version());
        } finally {
            reader.shutdownNow();
        }
    }

    @Test
    void invalidate_twice_equals_invalidate_once() {
        cache.set("a", ctx("a", 1, "{}"), Tier.L3);
        cache.set("b", ctx("b", 1, "{}"), Tier.L3);

        cache.invalidate("a");
        Map<String, CacheEntry> afterOnce = Map.copyOf(l3.entries);
        long l1SizeOnce = l1.size();
        cache.invalidate("a");

        assertEquals(afterOnce, Map.copyOf(l3.entries));
        assertEquals(l1SizeOnce, l1.size());
        assertFalse(l2.entries.containsKey("a"));
        assertTrue(l2.entries.containsKey("b"));
    }

    @Test
    void unreachable_l2_degrades_to_l3_without_errors_reaching_caller() {
        Instant now = clock.instant();
        l3.entries.put("k", new CacheEntry("k", ctx("k", 2, "{}"), Tier.L3, now.plusSeconds(100)));
        l2.down = true;

        Optional<CachedContext> got = cache.get("k");

        assertTrue(got.isPresent());
        assertEquals(1L, cache.metrics().hits().get(Tier.L3));
        assertTrue(cache.metrics().errors() >= 1);
        assertEquals(-1L, cache.metrics().sizes().get(Tier.L2));
    }

    @Test
    void failed_layer_is_skipped_during_backoff() {
        l2.down = true;
        cache.get("x");
        int callsAfterFailure = l2.calls.get();

        cache.get("y");
        cache.get("z");
        assertEquals(callsAfterFailure, l2.calls.get(), "no calls while backing off");

        clock.advance(TierCache.DEFAULT_FAILURE_BACKOFF.plusMillis(1));
        l2.down = false;
        cache.get("w");
        assertTrue(l2.calls.get() > callsAfterFailure);
    }

    @Test
    void missed_invalidation_hides_stale_entry_until_removed() {
        cache.set("a", ctx("a", 1, "{\"v\":\"old\"}"), Tier.L2);
        l2.down = true;
        cache.invalidate("a");
        l2.down = false;
        clock.advance(TierCache.DEFAULT_FAILURE_BACKOFF.plusMillis(1));

        assertTrue(l2.entries.containsKey("a"), "remote still holds the stale copy");
        assertTrue(cache.get("a").isEmpty(), "stale copy is not served");
        assertFalse(l2.entries.containsKey("a"), "removal retried on read");
    }

    @Test
    void warm_promotes_then_loads_without_touching_hit_counters() {
        Instant now = clock.instant();
        l3.entries.put("held", new CacheEntry("held", ctx("held", 1, "{}"), Tier.L3, now.plusSeconds(100)));

        int warmed = cache.warm(List.of("held", "loaded", "absent"),
                key -> key.equals("loaded") ? Optional.of(ctx(key, 4, "{}")) : Optional.empty());

        assertEquals(2, warmed);
        assertTrue(l1.get("held").isPresent());
        assertTrue(l3.entries.containsKey("loaded"));
        CacheMetrics m = cache.metrics();
        assertEquals(0, m.requests());
        assertEquals(0, m.misses());
    }

    @Test
    void close_flushes_and_closes_every_layer() {
        cache.close();
        assertTrue(l2.flushed && l2.closed);
        assertTrue(l3.flushed && l3.closed);
    }

    @Test
    void hit_rates_add_up_to_overall() {
        cache.set("a", ctx("a", 1, "{}"), Tier.L1);
        cache.get("a");
        cache.get("a");
        cache.get("b");
        cache.get("c");

        CacheMetrics m = cache.metrics();
        assertEquals(0.5, m.hitRate(Tier.L1), 1e-9);
        assertEquals(0.5, m.overallHitRate(), 1e-9);
        assertEquals(1L, m.sizes().get(Tier.L1));
    }
}
