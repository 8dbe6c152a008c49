package io.ctxsync.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Storage backend for one cache tier.
 * <p>
 * Implementations may throw any RuntimeException (typically
 * {@link CacheLayerUnavailableException}); TierCache absorbs it.
 * Expiry is checked by TierCache, so a layer may return an expired entry.
 */
public interface CacheLayer extends AutoCloseable {

    Optional<CacheEntry> get(String key);

    /** Store the entry; {@code ttl} lets the backend evict on its own. */
    void put(CacheEntry entry, Duration ttl);

    void remove(String key);

    /** Approximate number of entries held. */
    long size();

    /** Push buffered writes to the backend. */
    void flush();

    /** Delete expired entries eagerly. Backends with native expiry have nothing to do. */
    default int purgeExpired(Instant now) {
        return 0;
    }

    @Override
    void close();
}
