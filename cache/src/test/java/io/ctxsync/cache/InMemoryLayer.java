package io.ctxsync.cache;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed layer whose availability can be switched off. A {@link #holdNextGet}
 * call parks the next get() after it has read the entry, until released.
 */
final class InMemoryLayer implements CacheLayer {
    final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    final AtomicInteger calls = new AtomicInteger();
    volatile boolean down;
    volatile boolean flushed;
    volatile boolean closed;
    private volatile CountDownLatch held;
    private volatile CountDownLatch release;

    /** @return latch counted down once a get() has read its entry and parked */
    CountDownLatch holdNextGet(CountDownLatch release) {
        CountDownLatch parked = new CountDownLatch(1);
        this.held = parked;
        this.release = release;
        return parked;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        check();
        Optional<CacheEntry> found = Optional.ofNullable(entries.get(key));
        CountDownLatch gate = release;
        if (gate != null) {
            release = null;
            held.countDown();
            try {
                if (!gate.await(5, TimeUnit.SECONDS)) throw new IllegalStateException("never released");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        return found;
    }

    @Override
    public void put(CacheEntry entry, Duration ttl) {
        check();
        entries.put(entry.key(), entry);
    }

    @Override
    public void remove(String key) {
        check();
        entries.remove(key);
    }

    @Override
    public long size() {
        check();
        return entries.size();
    }

    @Override
    public void flush() {
        flushed = true;
    }

    @Override
    public void close() {
        closed = true;
    }

    private void check() {
        calls.incrementAndGet();
        if (down) throw new CacheLayerUnavailableException("layer is down");
    }
}
