package io.deltaflow.storage;

import java.util.List;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see the record.
 *  - segments are append-only; a closed segment is never written again and may
 *    only be deleted as a whole once retention no longer needs it.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single serialized record and fsync it.
     *
     * @param serializedRecord header+payload bytes, typically from RecordCodec.encode(...)
     */
    void append(byte[] serializedRecord);

    /**
     * Rotate log segment if configured thresholds are hit.
     * Called by the log after each write.
     */
    void rotateIfNeeded();

    /**
     * Open a sequential reader over every segment, oldest first.
     * The reader stops at the first corrupt header, truncated payload or bad CRC.
     */
    WalReader openReader();

    /** Names of segments that are no longer written to, oldest first. */
    List<String> closedSegments();

    /** Open a reader over a single segment. */
    WalReader openSegment(String segment);

    /** Delete a closed segment. Deleting the active segment is an error. */
    void deleteSegment(String segment);

    @Override
    void close();

    /**
     * Reader abstraction used during recovery.
     */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null when:
         *   - at EOF, or
         *   - corruption/truncation is detected at the tail.
         */
        byte[] next();

        @Override
        void close();
    }
}
