package io.ctxsync.cache;

import java.util.Optional;

/** Source of committed values for {@link TierCache#warm}. */
@FunctionalInterface
public interface CacheLoader {
    Optional<CachedContext> load(String key);
}
