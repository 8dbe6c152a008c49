// file: storage/src/main/java/io/ctxsync/storage/FileWal.java
package io.ctxsync.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends framed records to numbered segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - opens the newest segment ("00000001.log", "00000002.log", ...),
 *      - truncates a torn tail left by a crash, so new records are not
 *        written behind bytes the reader would stop at.
 * <p>
 *  - append():
 *      - writes the bytes and calls force(true),
 *      - on failure truncates back to the previous end of the segment.
 * <p>
 *  - rotateIfNeeded() / compact():
 *      - rotation opens segment N+1 once N reached rotateBytes,
 *      - compaction opens segment N+1 and deletes 1..N.
 * <p>
 *  - Reader:
 *      - walks all segments in name order,
 *      - reads the 11-byte header, validates magic/version/length,
 *      - reads the payload and validates its CRC,
 *      - stops at the first truncated or corrupt record.
 */
public class FileWal implements Wal {
    private static final Logger LOG = Logger.getLogger(FileWal.class.getName());
    private static final int HEADER_BYTES = 11;

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        long before = writtenInSegment;
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            UncheckedIOException failure = new UncheckedIOException("WAL append failed", e);
            try {
                ch.truncate(before);
                ch.position(before);
            } catch (IOException te) {
                failure.addSuppressed(te);
            }
            throw failure;
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        openNextSegment();
    }

    @Override
    public synchronized void compact() {
        Path keep = openNextSegment();
        for (Path seg : segments()) {
            if (seg.equals(keep)) continue;
            try {
                Files.deleteIfExists(seg);
            } catch (IOException e) {
                throw new UncheckedIOException("cannot delete WAL segment " + seg, e);
            }
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments());
    }

    @Override
    public synchronized void close() {
        if (ch == null) return;
        try {
            ch.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Segment currently appended to. */
    synchronized Path currentSegment() {
        return current;
    }

    // ---------- helpers ----------

    private void openNewestOrCreate() {
        List<Path> segs = segments();
        Path seg = segs.isEmpty() ? dir.resolve(segmentName(1)) : segs.get(segs.size() - 1);
        try {
            current = seg;
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validLength(ch);
            long size = ch.size();
            if (valid < size) {
                LOG.warning("Truncating torn WAL tail in " + current.getFileName()
                        + " from " + size + " to " + valid + " bytes");
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot open WAL segment " + seg, e);
        }
    }

    private Path openNextSegment() {
        try {
            ch.close();
            int index = Integer.parseInt(current.getFileName().toString().replace(".log", "")) + 1;
            current = dir.resolve(segmentName(index));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
            return current;
        } catch (IOException e) {
            throw new UncheckedIOException("cannot open next WAL segment", e);
        }
    }

    private List<Path> segments() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list WAL directory " + dir, e);
        }
    }

    private static String segmentName(int index) {
        return String.format("%08d.log", index);
    }

    /** Offset just past the last intact record in the channel. */
    private static long validLength(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            int len = readRecordLength(ch, pos);
            if (len < 0) return pos;
            pos += HEADER_BYTES + len;
        }
    }

    /**
     * Validate the record at {@code pos}.
     *
     * @return payload length, or -1 when the record is absent, torn or corrupt
     */
    private static int readRecordLength(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < HEADER_BYTES) return -1;
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return -1;
        if (pos + HEADER_BYTES + len > ch.size()) return -1;
        ByteBuffer payload = ByteBuffer.allocate(len);
        ch.read(payload, pos + HEADER_BYTES);
        if (payload.hasRemaining() || RecordCodec.crc32(payload.array()) != crc) return -1;
        return len;
    }

    /**
     * Sequential reader for WAL segments used during recovery.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segIndex = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped = false;

        Reader(List<Path> segments) {
            this.segments = List.copyOf(segments);
        }

        @Override
        public byte[] next() {
            try {
                while (!stopped) {
                    if (ch == null && !advance()) return null;
                    if (pos >= ch.size()) {
                        ch.close();
                        ch = null;
                        continue;
                    }
                    int len = readRecordLength(ch, pos);
                    if (len < 0) {
                        LOG.warning("WAL replay stopped at torn or corrupt record in "
                                + segments.get(segIndex).getFileName() + " offset " + pos);
                        stopped = true;
                        return null;
                    }
                    ByteBuffer payload = ByteBuffer.allocate(len);
                    ch.read(payload, pos + HEADER_BYTES);
                    pos += HEADER_BYTES + len;
                    return payload.array();
                }
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException("WAL read failed", e);
            }
        }

        private boolean advance() throws IOException {
            segIndex++;
            if (segIndex >= segments.size()) {
                stopped = true;
                return false;
            }
            ch = FileChannel.open(segments.get(segIndex), READ);
            pos = 0;
            return true;
        }

        @Override
        public void close() {
            if (ch == null) return;
            try {
                ch.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
