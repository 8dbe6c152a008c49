package io.ctxsync.storage;

import io.ctxsync.core.ContextVersion;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int64 lastLsn
 *   int32 contextCount
 *   repeated contextCount times:
 *     - contextId: int32 len + UTF-8 bytes
 *     - highWater: int64
 *     - count:     int32
 *     - versions:  RecordCodec version encoding, ascending
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<lsn>.bin.tmp" first,
 *   - then move to "snapshot-<lsn>.bin" using ATOMIC_MOVE,
 *   - then delete older snapshot files.
 * File names are zero-padded by LSN so name order is age order.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".bin";

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create snapshot directory " + dir, e);
        }
    }

    @Override
    public String writeSnapshot(StoreImage image) {
        String name = PREFIX + String.format("%019d", image.lastLsn()) + SUFFIX;
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)))) {
            out.writeLong(image.lastLsn());
            out.writeInt(image.contexts().size());
            for (Map.Entry<String, ContextImage> e : image.contexts().entrySet()) {
                RecordCodec.writeString(out, e.getKey());
                out.writeLong(e.getValue().highWater());
                out.writeInt(e.getValue().versions().size());
                for (ContextVersion v : e.getValue().versions()) {
                    RecordCodec.writeVersion(out, v);
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("snapshot write failed", ex);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
            for (Path old : snapshots()) {
                if (!old.equals(dst)) Files.deleteIfExists(old);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("snapshot publish failed", e);
        }
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> all = snapshots();
        if (all.isEmpty()) return null;
        Path snap = all.get(all.size() - 1);

        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(snap)))) {
            long lastLsn = in.readLong();
            int contextCount = in.readInt();
            Map<String, ContextImage> contexts = new HashMap<>(contextCount * 2);
            for (int i = 0; i < contextCount; i++) {
                String id = RecordCodec.readString(in);
                long highWater = in.readLong();
                int count = in.readInt();
                List<ContextVersion> versions = new ArrayList<>(count);
                for (int v = 0; v < count; v++) {
                    versions.add(RecordCodec.readVersion(in));
                }
                contexts.put(id, new ContextImage(highWater, versions));
            }
            return new LoadedSnapshot(snap.getFileName().toString(), new StoreImage(lastLsn, contexts));
        } catch (IOException e) {
            throw new UncheckedIOException("snapshot read failed: " + snap, e);
        }
    }

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list snapshot directory " + dir, e);
        }
    }
}
