package io.ctxsync.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * L1: bounded in-process cache on Caffeine.
 * <p>
 * Size-bounded (W-TinyLFU eviction) with expireAfterWrite set to the tier TTL.
 * The ticker is injectable so tests can move time.
 */
public final class LocalCacheLayer implements CacheLayer {
    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    private final Cache<String, CacheEntry> cache;

    public LocalCacheLayer() {
        this(DEFAULT_MAXIMUM_SIZE, Tier.L1.defaultTtl(), Ticker.systemTicker());
    }

    public LocalCacheLayer(long maximumSize, Duration ttl, Ticker ticker) {
        if (maximumSize <= 0) throw new IllegalArgumentException("maximumSize must be > 0");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(CacheEntry entry, Duration ttl) {
        cache.put(entry.key(), entry);
    }

    @Override
    public void remove(String key) {
        cache.invalidate(key);
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public void flush() {
        cache.cleanUp();
    }

    @Override
    public void close() {
        cache.invalidateAll();
        cache.cleanUp();
    }
}
