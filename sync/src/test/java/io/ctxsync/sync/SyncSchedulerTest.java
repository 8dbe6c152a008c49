package io.ctxsync.sync;

import io.ctxsync.cache.LocalCacheLayer;
import io.ctxsync.cache.Tier;
import io.ctxsync.cache.TierCache;
import io.ctxsync.core.merge.FieldLevelConflictResolver;
import io.ctxsync.index.HashingEmbeddingProvider;
import io.ctxsync.index.InMemoryVectorStore;
import io.ctxsync.index.VectorIndexer;
import io.ctxsync.storage.CommitRequest;
import io.ctxsync.storage.DurableVersionStore;
import io.ctxsync.storage.StoreOptions;
import io.ctxsync.storage.VersionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class SyncSchedulerTest {

    @TempDir
    Path dir;

    private DurableVersionStore durable;
    private SyncEngine engine;

    @BeforeEach
    void setUp() {
        durable = DurableVersionStore.open(dir, StoreOptions.defaults(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        if (engine != null) engine.close();
        durable.close();
    }

    private SyncEngine engine(VersionStore store) {
        FakeExternalSystem a = new FakeExternalSystem("system-a");
        a.put("ctx", "{\"a\":1}", Instant.parse("2024-05-01T12:00:00Z"));
        engine = new SyncEngine(store,
                TierCache.builder().layer(Tier.L1, new LocalCacheLayer()).build(),
                new VectorIndexer(new HashingEmbeddingProvider(), new InMemoryVectorStore()),
                new FieldLevelConflictResolver(), a, new FakeExternalSystem("system-b"), SyncOptions.defaults());
        engine.track("ctx");
        return engine;
    }

    @Test
    void close_waits_for_the_running_pass_to_finish_its_commit() throws Exception {
        CountDownLatch committing = new CountDownLatch(1);
        AtomicBoolean finished = new AtomicBoolean();
        AtomicBoolean interrupted = new AtomicBoolean();
        VersionStore slow = new ForwardingVersionStore(durable) {
            @Override
            public long commit(CommitRequest request) {
                committing.countDown();
                try {
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    interrupted.set(true);
                }
                long v = super.commit(request);
                finished.set(true);
                return v;
            }
        };
        var scheduler = new SyncScheduler(engine(slow), Duration.ofMillis(10));
        scheduler.start();
        assertTrue(committing.await(5, TimeUnit.SECONDS));

        scheduler.close();

        assertTrue(finished.get(), "pass completed before close returned");
        assertFalse(interrupted.get());
        assertTrue(durable.currentVersion("ctx").isPresent());
    }

    @Test
    void pass_outliving_the_grace_period_is_interrupted() throws Exception {
        CountDownLatch committing = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        VersionStore stuck = new ForwardingVersionStore(durable) {
            @Override
            public long commit(CommitRequest request) {
                committing.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    // flag not restored so the store's file channel stays usable
                    interrupted.set(true);
                }
                try {
                    return super.commit(request);
                } finally {
                    done.countDown();
                }
            }
        };
        var scheduler = new SyncScheduler(engine(stuck), Duration.ofMillis(10));
        scheduler.start();
        assertTrue(committing.await(5, TimeUnit.SECONDS));

        long started = System.nanoTime();
        scheduler.stop(Duration.ofMillis(100));

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 5_000);
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertTrue(interrupted.get());
    }
}
