package io.ctxsync.storage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot policy that asks for a full snapshot after every N mutations.
 * <p>
 * The store calls {@link #recordMutation()} after each durable commit or
 * restore, and {@link #reset()} once a snapshot was actually written. If the
 * store could not take one (a commit lease was in flight), the counter stays
 * above the threshold and the next mutation asks again.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /** @return true when a snapshot is due */
    public boolean recordMutation() {
        return sinceLast.incrementAndGet() >= everyOps;
    }

    public void reset() {
        sinceLast.set(0);
    }
}
