package io.ctxsync.storage;

/**
 * Write-ahead log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at record granularity: a partial write is treated as
 *    absent during recovery (the reader stops at the first corrupt/truncated record).
 *  - append() fsyncs before returning, so a record whose append returned is
 *    seen by recovery after a crash.
 *  - compact() is only called after a snapshot covering every record appended
 *    so far has been written.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append one framed record (header+payload from {@link RecordCodec}) and fsync it.
     *
     * @throws java.io.UncheckedIOException if the bytes could not be made durable
     */
    void append(byte[] serializedRecord);

    /** Start a new segment once the current one passed its size threshold. */
    void rotateIfNeeded();

    /** Start a fresh segment and drop every older one. */
    void compact();

    /** Sequential reader over all segments, oldest first. */
    WalReader openReader();

    @Override
    void close();

    /**
     * Reader abstraction used during recovery.
     */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (header stripped), or null at the end of
         *         the log or at the first torn/corrupt record.
         */
        byte[] next();

        @Override
        void close();
    }
}
