// file: storage/src/main/java/io/ctxsync/storage/DurableVersionStore.java
package io.ctxsync.storage;

import io.ctxsync.core.ConflictCommitException;
import io.ctxsync.core.Context;
import io.ctxsync.core.ContextVersion;
import io.ctxsync.core.NotFoundException;
import io.ctxsync.core.PayloadDiff;
import io.ctxsync.core.ValidationException;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongFunction;
import java.util.logging.Logger;

/**
 * WAL + snapshot backed VersionStore.
 * <p>
 * Responsibilities:
 *  - Maintain in memory: contextId -> (retained versions ascending, high-water mark).
 *  - On commit:
 *      1) Validate size, existence and expected version under the context lock.
 *      2) Assign highWater + 1 and build the ContextVersion with its diff summary.
 *      3) Take the next LSN and append+fsync a COMMIT record.
 *      4) Only then publish the new version list (pruned to retention).
 *      5) Possibly snapshot + compact the WAL (SnapshotPolicy).
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay WAL records with an LSN past the snapshot's.
 * <p>
 * Locking:
 *  - Per-context ReentrantLock serializes version assignment, pruning and restore.
 *  - Commits and restores hold the read side of a gate; a checkpoint only
 *    tryLocks the write side, so it never waits behind a commit lease.
 *  - Reads take the per-context lock just long enough to grab the immutable
 *    published list, so they wait while a commit lease is open on that context.
 *  - Snapshots read the volatile lists without locking.
 */
public class DurableVersionStore implements VersionStore {
    private static final Logger LOG = Logger.getLogger(DurableVersionStore.class.getName());

    private final Map<String, ContextState> states = new ConcurrentHashMap<>();
    private final Wal wal;
    private final Snapshotter snaps;
    private final StoreOptions options;
    private final SnapshotPolicy snapPolicy;
    private final Clock clock;

    private final ReentrantReadWriteLock gate = new ReentrantReadWriteLock();
    private final Object logMonitor = new Object();
    private long lsn; // guarded by logMonitor

    private final AtomicLong commits = new AtomicLong();
    private final AtomicLong restores = new AtomicLong();
    private final AtomicLong pruned = new AtomicLong();
    private final AtomicLong snapshots = new AtomicLong();
    private final AtomicLong snapshotSeq = new AtomicLong();

    public DurableVersionStore(Wal wal, Snapshotter snaps, StoreOptions options, Clock clock) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.snapPolicy = new SnapshotPolicy(options.snapshotEvery());
        recover();
    }

    /** Store under {@code dataDir/wal} and {@code dataDir/snap}. */
    public static DurableVersionStore open(Path dataDir, StoreOptions options, Clock clock) {
        return new DurableVersionStore(
                new FileWal(dataDir.resolve("wal"), options.walRotateBytes()),
                new FileSnapshotter(dataDir.resolve("snap")),
                options,
                clock);
    }

    @Override
    public long commit(CommitRequest req) {
        String id = req.contextId();
        if (id.isBlank()) throw new ValidationException("context id must not be blank");
        int size = req.payload().sizeBytes();
        if (size > options.maxPayloadBytes()) {
            throw new ValidationException("payload of " + size + " bytes exceeds cap of "
                    + options.maxPayloadBytes() + " bytes for context " + id);
        }

        long assigned;
        gate.readLock().lock();
        try {
            ContextState st = states.computeIfAbsent(id, k -> new ContextState());
            st.lock.lock();
            try {
                List<ContextVersion> cur = st.versions;
                ContextVersion head = cur.isEmpty() ? null : cur.get(cur.size() - 1);
                long currentVersion = head == null ? 0 : head.versionNumber();

                if (head == null && !req.createIfAbsent()) {
                    throw NotFoundException.context(id);
                }
                if (req.expectedVersion() != CommitRequest.ANY && req.expectedVersion() != currentVersion) {
                    throw new ConflictCommitException(id, req.expectedVersion(), currentVersion);
                }

                assigned = st.highWater + 1;
                Map<String, String> meta = new LinkedHashMap<>(req.metadata());
                meta.putAll(PayloadDiff.between(head == null ? null : head.payload(), req.payload()).toMetadata());
                ContextVersion v = new ContextVersion(id, assigned, req.payload(), req.source(), clock.instant(), meta);

                appendDurably(seq -> RecordCodec.encodeCommit(seq, v));
                pruned.addAndGet(applyCommit(st, v));
                commits.incrementAndGet();
            } finally {
                st.lock.unlock();
            }
        } finally {
            gate.readLock().unlock();
        }
        afterMutation();
        return assigned;
    }

    @Override
    public Context getCurrent(String contextId) {
        return Context.of(head(contextId));
    }

    @Override
    public OptionalLong currentVersion(String contextId) {
        List<ContextVersion> cur = settledVersions(contextId);
        return cur.isEmpty() ? OptionalLong.empty() : OptionalLong.of(cur.get(cur.size() - 1).versionNumber());
    }

    @Override
    public ContextVersion getVersion(String contextId, long versionNumber) {
        for (ContextVersion v : retained(contextId)) {
            if (v.versionNumber() == versionNumber) return v;
        }
        throw NotFoundException.version(contextId, versionNumber);
    }

    @Override
    public VersionPage listVersions(String contextId, int limit, OptionalLong beforeVersion) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
        List<ContextVersion> cur = retained(contextId);
        long before = beforeVersion.orElse(Long.MAX_VALUE);

        List<ContextVersion> page = new ArrayList<>(Math.min(limit, cur.size()));
        boolean more = false;
        for (int i = cur.size() - 1; i >= 0; i--) {
            ContextVersion v = cur.get(i);
            if (v.versionNumber() >= before) continue;
            if (page.size() == limit) {
                more = true;
                break;
            }
            page.add(v);
        }
        OptionalLong next = more ? OptionalLong.of(page.get(page.size() - 1).versionNumber()) : OptionalLong.empty();
        return new VersionPage(page, next);
    }

    @Override
    public SyncSnapshot createSnapshot(Collection<String> contextIds) {
        Map<String, SyncSnapshot.ContextImage> images = new TreeMap<>();
        for (String id : new TreeSet<>(contextIds)) {
            ContextState st = states.get(id);
            List<ContextVersion> cur = st == null ? List.of() : st.versions;
            long current = cur.isEmpty() ? 0 : cur.get(cur.size() - 1).versionNumber();
            images.put(id, new SyncSnapshot.ContextImage(id, current, cur));
        }
        return new SyncSnapshot(snapshotSeq.incrementAndGet(), clock.instant(), images);
    }

    @Override
    public void restoreSnapshot(SyncSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        boolean mutated = false;
        gate.readLock().lock();
        try {
            for (String id : snapshot.contextIds()) {
                ContextState st = states.get(id);
                Set<Long> committed = snapshot.committed(id);
                if (st == null || committed.isEmpty()) continue;

                st.lock.lock();
                try {
                    List<ContextVersion> cur = st.versions;
                    Set<Long> present = new HashSet<>();
                    List<Long> removed = new ArrayList<>();
                    for (ContextVersion v : cur) {
                        present.add(v.versionNumber());
                        if (committed.contains(v.versionNumber())) removed.add(v.versionNumber());
                    }
                    List<ContextVersion> reinstated = new ArrayList<>();
                    for (ContextVersion v : snapshot.image(id).versions()) {
                        if (!present.contains(v.versionNumber())) reinstated.add(v);
                    }
                    if (removed.isEmpty() && reinstated.isEmpty()) continue;

                    appendDurably(seq -> RecordCodec.encodeRestore(seq, id, removed, reinstated));
                    pruned.addAndGet(applyRestore(st, removed, reinstated));
                    restores.incrementAndGet();
                    mutated = true;
                    LOG.fine(() -> "Restored " + id + ": removed " + removed + ", reinstated "
                            + reinstated.size() + " version(s)");
                } finally {
                    st.lock.unlock();
                }
            }
        } finally {
            gate.readLock().unlock();
        }
        if (mutated) afterMutation();
    }

    @Override
    public CommitLease acquireCommitLease(Collection<String> contextIds) {
        List<String> ids = List.copyOf(new TreeSet<>(contextIds));
        List<ReentrantLock> held = new ArrayList<>(ids.size());
        try {
            for (String id : ids) {
                ReentrantLock lock = states.computeIfAbsent(id, k -> new ContextState()).lock;
                lock.lock();
                held.add(lock);
            }
        } catch (RuntimeException e) {
            releaseReversed(held);
            throw e;
        }
        return new CommitLease() {
            private boolean closed;

            @Override
            public List<String> contextIds() {
                return ids;
            }

            @Override
            public void close() {
                if (closed) return;
                closed = true;
                releaseReversed(held);
            }
        };
    }

    @Override
    public Set<String> contextIds() {
        Set<String> out = new TreeSet<>();
        states.forEach((id, st) -> {
            if (!st.versions.isEmpty()) out.add(id);
        });
        return out;
    }

    @Override
    public VersionStoreStats stats() {
        int live = 0;
        long versions = 0;
        for (ContextState st : states.values()) {
            int n = st.versions.size();
            if (n > 0) live++;
            versions += n;
        }
        long lastLsn;
        synchronized (logMonitor) {
            lastLsn = lsn;
        }
        return new VersionStoreStats(live, versions, commits.get(), restores.get(), pruned.get(),
                lastLsn, snapshots.get());
    }

    /**
     * Write a snapshot and compact the WAL now, waiting for in-flight commits.
     * Must not be called while holding a commit lease.
     */
    public void checkpoint() {
        gate.writeLock().lock();
        try {
            writeCheckpoint();
        } finally {
            gate.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        wal.close();
    }

    // ---------- helpers ----------

    private ContextVersion head(String contextId) {
        List<ContextVersion> cur = retained(contextId);
        return cur.get(cur.size() - 1);
    }

    private List<ContextVersion> retained(String contextId) {
        List<ContextVersion> cur = settledVersions(contextId);
        if (cur.isEmpty()) throw NotFoundException.context(contextId);
        return cur;
    }

    /**
     * Published version list, read under the context's lock so a reader on
     * another thread waits out an open lease instead of seeing versions a
     * pass may still roll back. Unknown ids read as empty without creating state.
     */
    private List<ContextVersion> settledVersions(String contextId) {
        ContextState st = states.get(Objects.requireNonNull(contextId, "contextId"));
        if (st == null) return List.of();
        st.lock.lock();
        try {
            return st.versions;
        } finally {
            st.lock.unlock();
        }
    }

    /** LSN assignment and append happen together so the log is in LSN order. */
    private void appendDurably(LongFunction<byte[]> encoder) {
        synchronized (logMonitor) {
            long seq = lsn + 1;
            wal.append(encoder.apply(seq));
            lsn = seq;
            wal.rotateIfNeeded();
        }
    }

    /** @return number of versions pruned */
    private int applyCommit(ContextState st, ContextVersion v) {
        List<ContextVersion> next = new ArrayList<>(st.versions.size() + 1);
        next.addAll(st.versions);
        next.add(v);
        st.highWater = Math.max(st.highWater, v.versionNumber());
        return publish(st, next);
    }

    private int applyRestore(ContextState st, Collection<Long> removed, List<ContextVersion> reinstated) {
        Set<Long> drop = new HashSet<>(removed);
        List<ContextVersion> next = new ArrayList<>(st.versions.size() + reinstated.size());
        for (ContextVersion v : st.versions) {
            if (!drop.contains(v.versionNumber())) next.add(v);
        }
        next.addAll(reinstated);
        next.sort(Comparator.comparingLong(ContextVersion::versionNumber));
        return publish(st, next);
    }

    /** Trim to retention (oldest first; the newest always survives) and publish. */
    private int publish(ContextState st, List<ContextVersion> ascending) {
        int excess = Math.max(0, ascending.size() - options.retention());
        st.versions = List.copyOf(ascending.subList(excess, ascending.size()));
        return excess;
    }

    private void afterMutation() {
        if (!snapPolicy.recordMutation()) return;
        // Skip while any commit or lease-holding restore is running; the policy
        // stays due and the next mutation tries again.
        if (gate.isWriteLockedByCurrentThread() || gate.getReadHoldCount() > 0) return;
        if (!gate.writeLock().tryLock()) return;
        try {
            writeCheckpoint();
        } finally {
            gate.writeLock().unlock();
        }
    }

    private void writeCheckpoint() {
        Map<String, Snapshotter.ContextImage> image = new HashMap<>();
        states.forEach((id, st) -> {
            if (st.highWater > 0) image.put(id, new Snapshotter.ContextImage(st.highWater, st.versions));
        });
        long lastLsn;
        synchronized (logMonitor) {
            lastLsn = lsn;
            String name = snaps.writeSnapshot(new Snapshotter.StoreImage(lastLsn, image));
            wal.compact();
            LOG.info(() -> "Wrote snapshot " + name + " covering " + image.size() + " contexts");
        }
        snapPolicy.reset();
        snapshots.incrementAndGet();
    }

    /**
     * Recovery procedure called from constructor:
     *  1) Seed memory from the latest snapshot (if present).
     *  2) Replay WAL records past the snapshot's LSN in order.
     */
    private void recover() {
        long fromLsn = 0;
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null) {
            fromLsn = loaded.image().lastLsn();
            loaded.image().contexts().forEach((id, img) -> {
                ContextState st = new ContextState();
                st.highWater = img.highWater();
                st.versions = img.versions();
                states.put(id, st);
            });
        }
        lsn = fromLsn;

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                if (rec.lsn() <= fromLsn) continue;
                apply(rec);
                lsn = rec.lsn();
                replayed++;
            }
        }
        final int count = replayed;
        final long last = lsn;
        LOG.info(() -> "Recovered " + contextIds().size() + " contexts (snapshot="
                + (loaded == null ? "none" : loaded.id()) + ", replayed=" + count + ", lsn=" + last + ")");
    }

    private void apply(RecordCodec.LogRecord rec) {
        if (rec instanceof RecordCodec.Commit c) {
            ContextState st = states.computeIfAbsent(c.version().contextId(), k -> new ContextState());
            applyCommit(st, c.version());
        } else if (rec instanceof RecordCodec.Restore r) {
            ContextState st = states.computeIfAbsent(r.contextId(), k -> new ContextState());
            applyRestore(st, r.removed(), r.reinstated());
        } else {
            throw new IllegalStateException("Unknown record type: " + rec);
        }
    }

    private static void releaseReversed(List<ReentrantLock> held) {
        for (int i = held.size() - 1; i >= 0; i--) {
            held.get(i).unlock();
        }
    }

    private static final class ContextState {
        final ReentrantLock lock = new ReentrantLock();
        volatile List<ContextVersion> versions = List.of();
        volatile long highWater;
    }
}
