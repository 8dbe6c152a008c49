package io.ctxsync.storage;

import io.ctxsync.core.ContextVersion;
import io.ctxsync.core.Payload;
import io.ctxsync.core.SourceSystem;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xC75C
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes)]
 *     - type: byte, 1 = COMMIT, 2 = RESTORE
 *     - lsn:  int64
 *     COMMIT:
 *       - version (see writeVersion)
 *     RESTORE:
 *       - contextId:  int32 len + UTF-8 bytes
 *       - removed:    int32 count, then int64 version numbers
 *       - reinstated: int32 count, then versions
 * <p>
 * A version is encoded as:
 *   contextId, versionNumber (int64), source (string), createdAt (int64 seconds +
 *   int32 nanos), payload (int32 len + canonical JSON bytes), metadata (int32 count
 *   + key/value strings).
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xC75C;
    static final byte VERSION = 1;

    private static final byte TYPE_COMMIT = 1;
    private static final byte TYPE_RESTORE = 2;

    /** Decoded WAL record. */
    sealed interface LogRecord permits Commit, Restore {
        long lsn();
    }

    record Commit(long lsn, ContextVersion version) implements LogRecord {}

    record Restore(long lsn, String contextId, List<Long> removed, List<ContextVersion> reinstated)
            implements LogRecord {
        Restore {
            removed = List.copyOf(removed);
            reinstated = List.copyOf(reinstated);
        }
    }

    private RecordCodec() {}

    static byte[] encodeCommit(long lsn, ContextVersion version) {
        return frame(write(out -> {
            out.writeByte(TYPE_COMMIT);
            out.writeLong(lsn);
            writeVersion(out, version);
        }));
    }

    static byte[] encodeRestore(long lsn, String contextId, List<Long> removed, List<ContextVersion> reinstated) {
        return frame(write(out -> {
            out.writeByte(TYPE_RESTORE);
            out.writeLong(lsn);
            writeString(out, contextId);
            out.writeInt(removed.size());
            for (long v : removed) out.writeLong(v);
            out.writeInt(reinstated.size());
            for (ContextVersion v : reinstated) writeVersion(out, v);
        }));
    }

    /** Decode a full payload (not including header). */
    static LogRecord decode(byte[] payload) {
        try (var in = new DataInputStream(new ByteArrayInputStream(payload))) {
            byte type = in.readByte();
            long lsn = in.readLong();
            switch (type) {
                case TYPE_COMMIT:
                    return new Commit(lsn, readVersion(in));
                case TYPE_RESTORE: {
                    String id = readString(in);
                    int removedCount = in.readInt();
                    List<Long> removed = new ArrayList<>(removedCount);
                    for (int i = 0; i < removedCount; i++) removed.add(in.readLong());
                    int reinstatedCount = in.readInt();
                    List<ContextVersion> reinstated = new ArrayList<>(reinstatedCount);
                    for (int i = 0; i < reinstatedCount; i++) reinstated.add(readVersion(in));
                    return new Restore(lsn, id, removed, reinstated);
                }
                default:
                    throw new IllegalStateException("unknown WAL record type " + type);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("malformed WAL record", e);
        }
    }

    // ----------------- helpers -----------------

    /** Also used by FileSnapshotter so both files share one version encoding. */
    static void writeVersion(DataOutput out, ContextVersion v) throws IOException {
        writeString(out, v.contextId());
        out.writeLong(v.versionNumber());
        writeString(out, v.sourceSystem().name());
        out.writeLong(v.createdAt().getEpochSecond());
        out.writeInt(v.createdAt().getNano());
        byte[] body = v.payload().toBytes();
        out.writeInt(body.length);
        out.write(body);
        out.writeInt(v.metadata().size());
        for (Map.Entry<String, String> e : v.metadata().entrySet()) {
            writeString(out, e.getKey());
            writeString(out, e.getValue());
        }
    }

    static ContextVersion readVersion(DataInput in) throws IOException {
        String id = readString(in);
        long number = in.readLong();
        SourceSystem source = SourceSystem.valueOf(readString(in));
        Instant createdAt = Instant.ofEpochSecond(in.readLong(), in.readInt());
        byte[] body = new byte[in.readInt()];
        in.readFully(body);
        int metaCount = in.readInt();
        Map<String, String> meta = new LinkedHashMap<>(metaCount * 2);
        for (int i = 0; i < metaCount; i++) {
            meta.put(readString(in), readString(in));
        }
        return new ContextVersion(id, number, Payload.parse(body), source, createdAt, meta);
    }

    static void writeString(DataOutput out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    static String readString(DataInput in) throws IOException {
        byte[] b = new byte[in.readInt()];
        in.readFully(b);
        return new String(b, StandardCharsets.UTF_8);
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    private static byte[] frame(byte[] payload) {
        ByteBuffer header = ByteBuffer.allocate(2 + 1 + 4 + 4).order(ByteOrder.LITTLE_ENDIAN);
        header.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));

        byte[] out = new byte[header.capacity() + payload.length];
        System.arraycopy(header.array(), 0, out, 0, header.capacity());
        System.arraycopy(payload, 0, out, header.capacity(), payload.length);
        return out;
    }

    private interface BodyWriter {
        void writeTo(DataOutputStream out) throws IOException;
    }

    private static byte[] write(BodyWriter writer) {
        var bytes = new ByteArrayOutputStream();
        try (var out = new DataOutputStream(bytes)) {
            writer.writeTo(out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }
}
