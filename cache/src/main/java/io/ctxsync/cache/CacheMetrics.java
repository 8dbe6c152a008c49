package io.ctxsync.cache;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time TierCache counters.
 * <p>
 * Per-tier hit rate is hits at that tier over all get() requests, so the
 * per-tier rates add up to the overall hit rate. A size of -1 means the tier
 * could not report one.
 */
public record CacheMetrics(
        Map<Tier, Long> hits,
        long misses,
        long requests,
        Map<Tier, Long> sizes,
        long errors
) {
    public CacheMetrics {
        hits = Collections.unmodifiableMap(new EnumMap<>(hits));
        sizes = Collections.unmodifiableMap(new EnumMap<>(sizes));
    }

    public double hitRate(Tier tier) {
        return requests == 0 ? 0.0 : (double) hits.getOrDefault(tier, 0L) / requests;
    }

    public Map<Tier, Double> perTierHitRate() {
        Map<Tier, Double> out = new EnumMap<>(Tier.class);
        for (Tier t : Tier.values()) out.put(t, hitRate(t));
        return out;
    }

    public double overallHitRate() {
        if (requests == 0) return 0.0;
        long total = 0;
        for (long h : hits.values()) total += h;
        return (double) total / requests;
    }

    @Override
    public String toString() {
        return "CacheMetrics{" +
                "hits=" + hits +
                ", misses=" + misses +
                ", requests=" + requests +
                ", overallHitRate=" + String.format("%.3f", overallHitRate()) +
                ", sizes=" + sizes +
                ", errors=" + errors +
                '}';
    }
}
