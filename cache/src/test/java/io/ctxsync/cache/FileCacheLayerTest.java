package io.ctxsync.cache;

import io.ctxsync.core.Payload;
import io.ctxsync.core.SourceSystem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileCacheLayerTest {

    @TempDir Path dir;

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static CacheEntry entry(String key, Instant expiresAt) {
        var value = new CachedContext(key, 2, Payload.parse("{\"a\":[1,2],\"b\":{\"c\":null}}"),
                SourceSystem.MERGED, NOW.minusSeconds(5));
        return new CacheEntry(key, value, Tier.L3, expiresAt);
    }

    @Test
    void entries_survive_a_new_layer_instance() {
        new FileCacheLayer(dir).put(entry("ctx/with:odd chars", NOW.plusSeconds(60)), Duration.ofSeconds(60));

        var reopened = new FileCacheLayer(dir);
        CacheEntry got = reopened.get("ctx/with:odd chars").orElseThrow();

        assertEquals(entry("ctx/with:odd chars", NOW.plusSeconds(60)), got);
        assertEquals(1, reopened.size());
    }

    @Test
    void purge_removes_only_expired_files() {
        var layer = new FileCacheLayer(dir);
        layer.put(entry("old", NOW.minusSeconds(1)), Duration.ofSeconds(1));
        layer.put(entry("fresh", NOW.plusSeconds(60)), Duration.ofSeconds(60));

        assertEquals(1, layer.purgeExpired(NOW));

        assertTrue(layer.get("old").isEmpty());
        assertTrue(layer.get("fresh").isPresent());
    }

    @Test
    void unreadable_file_is_dropped_as_a_miss() throws Exception {
        var layer = new FileCacheLayer(dir);
        layer.put(entry("k", NOW.plusSeconds(60)), Duration.ofSeconds(60));
        Path file;
        try (Stream<Path> s = Files.list(dir)) {
            file = s.findFirst().orElseThrow();
        }
        Files.writeString(file, "{broken");

        assertTrue(layer.get("k").isEmpty());
        assertEquals(0, layer.size());
    }

    @Test
    void concurrent_writes_to_one_key_all_land() throws Exception {
        var layer = new FileCacheLayer(dir);
        int threads = 8;
        int writesEach = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> writers = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                writers.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < writesEach; i++) {
                        layer.put(entry("shared", NOW.plusSeconds(60)), Duration.ofSeconds(60));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : writers) f.get(30, TimeUnit.SECONDS); // rethrows any failed put
        } finally {
            pool.shutdownNow();
        }

        assertEquals(entry("shared", NOW.plusSeconds(60)), layer.get("shared").orElseThrow());
        try (Stream<Path> s = Files.list(dir)) {
            assertEquals(1, s.count(), "no temp files left behind");
        }
    }
}
