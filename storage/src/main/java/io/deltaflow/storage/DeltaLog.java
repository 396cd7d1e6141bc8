package io.deltaflow.storage;

import io.deltaflow.core.Row;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable log of ingested delta batches.
 * <p>
 * Responsibilities:
 *  - On append:
 *      1) Assign the next sequence number.
 *      2) Serialize the record (RecordCodec).
 *      3) Append+fsync to the WAL; only then return, so the caller may admit
 *         the batch into the dataflow.
 *      4) Rotate the WAL segment if needed.
 * <p>
 *  - On open: scan the log once to learn the next sequence number and the
 *    epochs it covers ({@link Summary}).
 * <p>
 *  - On replay: hand every record to the consumer in log order, at most once per
 *    sequence number according to the supplied {@link SequenceDeduper}.
 * <p>
 *  - Retention: {@link #truncateThrough(long)} deletes closed segments whose
 *    records all belong to epochs that a snapshot already covers.
 */
public final class DeltaLog implements AutoCloseable {
    private static final Logger log = Logger.getLogger(DeltaLog.class.getName());

    /** What a scan of the existing log found. */
    public record Summary(long records, long lastSequence, long maxEpoch, long lastEndedEpoch) {
        public static final Summary EMPTY = new Summary(0, -1, -1, -1);
    }

    private final Wal wal;
    private final Summary summary;

    // guarded by this
    private long nextSequence;

    private DeltaLog(Wal wal, Summary summary, long nextSequence) {
        this.wal = wal;
        this.summary = summary;
        this.nextSequence = nextSequence;
    }

    /**
     * Open a log over an existing WAL.
     *
     * @param minNextSequence lower bound for the next sequence (from persisted
     *                        epoch metadata, in case retention removed the tail owner)
     */
    public static DeltaLog open(Wal wal, long minNextSequence) {
        long records = 0, lastSeq = -1, maxEpoch = -1, lastEnded = -1;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                WalRecord rec = RecordCodec.decode(payload);
                records++;
                lastSeq = Math.max(lastSeq, rec.sequence());
                maxEpoch = Math.max(maxEpoch, rec.epoch());
                if (rec instanceof WalRecord.EpochEnd) lastEnded = Math.max(lastEnded, rec.epoch());
            }
        }
        Summary s = new Summary(records, lastSeq, maxEpoch, lastEnded);
        return new DeltaLog(wal, s, Math.max(lastSeq + 1, minNextSequence));
    }

    public Summary summary() {
        return summary;
    }

    /**
     * Durably append an ingested batch.
     *
     * @return the sequence number assigned to the batch
     */
    public synchronized long appendBatch(long epoch, String sourceId, List<Row> rows) {
        long seq = nextSequence;
        wal.append(RecordCodec.encode(new WalRecord.Batch(seq, epoch, sourceId, rows)));
        nextSequence++;
        wal.rotateIfNeeded();
        return seq;
    }

    /** Durably record that ingestion for {@code epoch} ended. */
    public synchronized long appendEpochEnd(long epoch) {
        long seq = nextSequence;
        wal.append(RecordCodec.encode(new WalRecord.EpochEnd(seq, epoch)));
        nextSequence++;
        wal.rotateIfNeeded();
        return seq;
    }

    public synchronized long nextSequence() {
        return nextSequence;
    }

    /**
     * Replay the whole log in order.
     *
     * @return number of records handed to the consumer (duplicates excluded)
     */
    public long replay(SequenceDeduper dedupe, Consumer<WalRecord> consumer) {
        long applied = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                WalRecord rec = RecordCodec.decode(payload);
                if (dedupe.firstTime(rec.sequence())) {
                    consumer.accept(rec);
                    applied++;
                }
            }
        }
        return applied;
    }

    /** Every record in log order, duplicates included. */
    public List<WalRecord> readAll() {
        List<WalRecord> out = new ArrayList<>();
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                out.add(RecordCodec.decode(payload));
            }
        }
        return out;
    }

    /**
     * Delete closed segments holding only records with epoch &lt;= {@code epoch}.
     * Stops at the first segment that is still needed so the log stays contiguous.
     *
     * @return number of deleted segments
     */
    public int truncateThrough(long epoch) {
        int deleted = 0;
        for (String segment : wal.closedSegments()) {
            long segMax = -1;
            try (Wal.WalReader r = wal.openSegment(segment)) {
                for (byte[] payload; (payload = r.next()) != null; ) {
                    segMax = Math.max(segMax, RecordCodec.decode(payload).epoch());
                }
            }
            if (segMax > epoch) break;
            wal.deleteSegment(segment);
            deleted++;
        }
        if (deleted > 0) {
            log.log(Level.FINE, "WAL retention deleted {0} segment(s) through epoch {1}",
                    new Object[]{deleted, epoch});
        }
        return deleted;
    }

    @Override
    public void close() {
        wal.close();
    }
}
