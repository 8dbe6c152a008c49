package io.ctxsync.cache;

import java.time.Instant;
import java.util.Objects;

/**
 * One cached value as held by a tier.
 *
 * @param key       cache key (the context id)
 * @param value     cached committed context
 * @param tier      tier the entry was written to
 * @param expiresAt absolute expiry, enforced by TierCache on every read
 */
public record CacheEntry(String key, CachedContext value, Tier tier, Instant expiresAt) {
    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
