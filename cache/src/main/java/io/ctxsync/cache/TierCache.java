package io.ctxsync.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Three-level read-through cache in front of the VersionStore.
 * <p>
 * Responsibilities:
 *  - get():        probe L1 -> L2 -> L3; a hit at a slower tier is promoted into
 *                  every faster tier and counted against the tier that served it.
 *  - set():        write to the requested tier and every faster one, each with its own TTL.
 *  - invalidate(): remove from all tiers.
 *  - warm():       promote or load a set of keys ahead of demand.
 * <p>
 * Failure handling:
 *  - Any exception from a layer is logged, counted and treated as a miss at
 *    that tier. The layer is then skipped for a short backoff window.
 *  - An invalidation that could not reach a layer leaves the key marked dirty
 *    for that layer; reads skip the layer for that key until a later removal
 *    succeeds, so a stale entry is never served.
 * <p>
 * Promotion vs. writers: set() and invalidate() bump a striped per-key epoch
 * while holding the stripe's monitor. A promotion only lands if the epoch it
 * saw before reading the slower tier is still current, checked under the same
 * monitor, so a value read before an invalidation never overwrites what came after.
 * <p>
 * Lifecycle: built once at process start, {@link #close()} flushes and closes
 * every layer. Missing L2/L3 layers are allowed and simply never probed.
 */
public final class TierCache implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(TierCache.class.getName());

    public static final Duration DEFAULT_FAILURE_BACKOFF = Duration.ofSeconds(5);
    private static final int KEY_STRIPES = 64;

    private final Map<Tier, CacheLayer> layers;
    private final Map<Tier, Duration> ttls;
    private final Clock clock;
    private final Duration failureBackoff;
    private final CacheLoader defaultLoader;

    private final Map<Tier, AtomicLong> hits = new EnumMap<>(Tier.class);
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final Map<Tier, AtomicLong> unavailableUntilMillis = new EnumMap<>(Tier.class);
    private final Map<Tier, Set<String>> dirty = new EnumMap<>(Tier.class);
    private final Object[] keyMonitors = new Object[KEY_STRIPES];
    private final AtomicLongArray epochs = new AtomicLongArray(KEY_STRIPES); // bumped under keyMonitors[i]

    private TierCache(Builder b) {
        if (b.layers.get(Tier.L1) == null) throw new IllegalArgumentException("an L1 layer is required");
        this.layers = new EnumMap<>(b.layers);
        this.ttls = new EnumMap<>(b.ttls);
        this.clock = b.clock;
        this.failureBackoff = b.failureBackoff;
        this.defaultLoader = b.loader;
        for (Tier t : Tier.values()) {
            hits.put(t, new AtomicLong());
            unavailableUntilMillis.put(t, new AtomicLong());
            dirty.put(t, ConcurrentHashMap.newKeySet());
        }
        for (int i = 0; i < KEY_STRIPES; i++) keyMonitors[i] = new Object();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the cached committed context, or empty on a full miss
     */
    public Optional<CachedContext> get(String key) {
        Objects.requireNonNull(key, "key");
        requests.incrementAndGet();
        Optional<Hit> hit = probe(key, Tier.L3);
        if (hit.isPresent()) {
            hits.get(hit.get().tier).incrementAndGet();
            return Optional.of(hit.get().value);
        }
        misses.incrementAndGet();
        return Optional.empty();
    }

    /** Write-through into L1 only. */
    public void set(String key, CachedContext value) {
        set(key, value, Tier.L1);
    }

    /** Write into {@code tier} and every faster tier. */
    public void set(String key, CachedContext value, Tier tier) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(tier, "tier");
        Instant now = clock.instant();
        int stripe = stripe(key);
        synchronized (keyMonitors[stripe]) {
            epochs.incrementAndGet(stripe);
            for (int i = tier.ordinal(); i >= 0; i--) {
                write(Tier.values()[i], key, value, now);
            }
        }
    }

    /** Remove from all tiers. Idempotent. */
    public void invalidate(String key) {
        Objects.requireNonNull(key, "key");
        Instant now = clock.instant();
        int stripe = stripe(key);
        synchronized (keyMonitors[stripe]) {
            epochs.incrementAndGet(stripe);
            for (Tier t : Tier.values()) {
                CacheLayer layer = layers.get(t);
                if (layer == null) continue;
                if (inBackoff(t, now)) {
                    dirty.get(t).add(key);
                    continue;
                }
                try {
                    layer.remove(key);
                    dirty.get(t).remove(key);
                } catch (RuntimeException e) {
                    dirty.get(t).add(key);
                    markFailed(t, "invalidate", key, e, now);
                }
            }
        }
    }

    /** Warm using the loader given at build time (if any). */
    public int warm(Collection<String> keys) {
        return warm(keys, defaultLoader);
    }

    /**
     * Bring keys into the cache ahead of demand: entries already held by a
     * slower tier are promoted, the rest are fetched through {@code loader}
     * (may be null) and written to every tier. Does not touch hit/miss counters.
     *
     * @return number of keys that ended up in L1
     */
    public int warm(Collection<String> keys, CacheLoader loader) {
        int warmed = 0;
        for (String key : keys) {
            if (probe(key, Tier.L3).isPresent()) {
                warmed++;
                continue;
            }
            if (loader == null) continue;
            Optional<CachedContext> loaded;
            try {
                loaded = loader.load(key);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Cache warm load failed for " + key, e);
                continue;
            }
            if (loaded.isPresent()) {
                set(key, loaded.get(), Tier.L3);
                warmed++;
            }
        }
        return warmed;
    }

    /** Ask every layer to drop expired entries; returns how many were removed. */
    public int purgeExpired() {
        Instant now = clock.instant();
        int purged = 0;
        for (Map.Entry<Tier, CacheLayer> e : layers.entrySet()) {
            if (inBackoff(e.getKey(), now)) continue;
            try {
                purged += e.getValue().purgeExpired(now);
            } catch (RuntimeException ex) {
                markFailed(e.getKey(), "purge", "*", ex, now);
            }
        }
        return purged;
    }

    public CacheMetrics metrics() {
        Map<Tier, Long> hitCounts = new EnumMap<>(Tier.class);
        Map<Tier, Long> sizes = new EnumMap<>(Tier.class);
        for (Tier t : Tier.values()) {
            hitCounts.put(t, hits.get(t).get());
            CacheLayer layer = layers.get(t);
            if (layer == null) {
                sizes.put(t, 0L);
                continue;
            }
            try {
                sizes.put(t, layer.size());
            } catch (RuntimeException e) {
                markFailed(t, "size", "*", e, clock.instant());
                sizes.put(t, -1L);
            }
        }
        return new CacheMetrics(hitCounts, misses.get(), requests.get(), sizes, errors.get());
    }

    public Duration ttl(Tier tier) {
        return ttls.get(tier);
    }

    /** Flush and close every layer. Failures are logged; all layers are attempted. */
    @Override
    public void close() {
        for (Map.Entry<Tier, CacheLayer> e : layers.entrySet()) {
            try {
                e.getValue().flush();
                e.getValue().close();
            } catch (RuntimeException ex) {
                errors.incrementAndGet();
                LOG.log(Level.WARNING, "Closing cache tier " + e.getKey() + " failed", ex);
            }
        }
    }

    // ---------- helpers ----------

    private record Hit(Tier tier, CachedContext value) {}

    /** Probe tiers up to {@code slowest}, promoting on a hit below L1. */
    private Optional<Hit> probe(String key, Tier slowest) {
        Instant now = clock.instant();
        int stripe = stripe(key);
        long seen = epochs.get(stripe);
        for (Tier t : Tier.values()) {
            if (t.ordinal() > slowest.ordinal()) break;
            CacheLayer layer = layers.get(t);
            if (layer == null || inBackoff(t, now)) continue;
            if (!clearIfDirty(t, layer, key, now)) continue;

            Optional<CacheEntry> found;
            try {
                found = layer.get(key);
            } catch (RuntimeException e) {
                markFailed(t, "get", key, e, now);
                continue;
            }
            if (found.isEmpty()) continue;

            CacheEntry entry = found.get();
            if (entry.isExpired(now)) {
                dropExpired(t, layer, key, now);
                continue;
            }
            if (t != Tier.L1) promote(key, entry.value(), t, stripe, seen, now);
            return Optional.of(new Hit(t, entry.value()));
        }
        return Optional.empty();
    }

    private void promote(String key, CachedContext value, Tier servedBy, int stripe, long seen, Instant now) {
        synchronized (keyMonitors[stripe]) {
            if (epochs.get(stripe) != seen) {
                LOG.fine(() -> "Skipping promotion of " + key + " from " + servedBy + ": written or invalidated meanwhile");
                return;
            }
            for (int i = servedBy.ordinal() - 1; i >= 0; i--) {
                write(Tier.values()[i], key, value, now);
            }
        }
    }

    private static int stripe(String key) {
        return Math.floorMod(key.hashCode(), KEY_STRIPES);
    }

    /** @return true when the tier may be read for this key */
    private boolean clearIfDirty(Tier t, CacheLayer layer, String key, Instant now) {
        Set<String> pending = dirty.get(t);
        if (!pending.contains(key)) return true;
        try {
            layer.remove(key);
            pending.remove(key);
        } catch (RuntimeException e) {
            markFailed(t, "invalidate", key, e, now);
        }
        // a just-cleared tier holds nothing for this key
        return false;
    }

    private void dropExpired(Tier t, CacheLayer layer, String key, Instant now) {
        try {
            layer.remove(key);
        } catch (RuntimeException e) {
            markFailed(t, "expire", key, e, now);
        }
    }

    private void write(Tier t, String key, CachedContext value, Instant now) {
        CacheLayer layer = layers.get(t);
        if (layer == null || inBackoff(t, now)) return;
        Duration ttl = ttls.get(t);
        try {
            layer.put(new CacheEntry(key, value, t, now.plus(ttl)), ttl);
            dirty.get(t).remove(key);
        } catch (RuntimeException e) {
            markFailed(t, "put", key, e, now);
        }
    }

    private boolean inBackoff(Tier t, Instant now) {
        return now.toEpochMilli() < unavailableUntilMillis.get(t).get();
    }

    private void markFailed(Tier t, String op, String key, RuntimeException e, Instant now) {
        errors.incrementAndGet();
        unavailableUntilMillis.get(t).set(now.plus(failureBackoff).toEpochMilli());
        LOG.log(Level.WARNING, "Cache tier " + t + " " + op + "(" + key + ") failed, skipping tier for "
                + failureBackoff.toMillis() + " ms: " + e.getMessage());
        LOG.log(Level.FINE, "Cache tier failure detail", e);
    }

    public static final class Builder {
        private final Map<Tier, CacheLayer> layers = new EnumMap<>(Tier.class);
        private final Map<Tier, Duration> ttls = new EnumMap<>(Tier.class);
        private Clock clock = Clock.systemUTC();
        private Duration failureBackoff = DEFAULT_FAILURE_BACKOFF;
        private CacheLoader loader;

        private Builder() {
            for (Tier t : Tier.values()) ttls.put(t, t.defaultTtl());
        }

        public Builder layer(Tier tier, CacheLayer layer) {
            layers.put(Objects.requireNonNull(tier, "tier"), Objects.requireNonNull(layer, "layer"));
            return this;
        }

        public Builder ttl(Tier tier, Duration ttl) {
            if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl must be > 0");
            ttls.put(tier, ttl);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder failureBackoff(Duration backoff) {
            if (backoff.isNegative()) throw new IllegalArgumentException("backoff must be >= 0");
            this.failureBackoff = backoff;
            return this;
        }

        public Builder loader(CacheLoader loader) {
            this.loader = loader;
            return this;
        }

        public TierCache build() {
            return new TierCache(this);
        }
    }
}
