package io.ctxsync.cache;

import java.time.Duration;

/**
 * Cache levels, fastest first.
 * <p>
 *  - L1: process-local, smallest.
 *  - L2: shared across processes, network-attached.
 *  - L3: durable-backed, largest.
 */
public enum Tier {
    L1(Duration.ofSeconds(300)),
    L2(Duration.ofSeconds(3600)),
    L3(Duration.ofSeconds(86400));

    private final Duration defaultTtl;

    Tier(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    /** True when this tier is probed before {@code other}. */
    public boolean fasterThan(Tier other) {
        return ordinal() < other.ordinal();
    }
}
