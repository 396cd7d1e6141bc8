package io.deltaflow.storage;

import io.deltaflow.core.Row;

import java.util.List;
import java.util.Objects;

/**
 * Logical content of one WAL record.
 * <p>
 * Every record carries a sequence number from a single process-wide counter;
 * sequence numbers increase strictly in log order and are the deduplication
 * key during replay.
 */
public sealed interface WalRecord permits WalRecord.Batch, WalRecord.EpochEnd {

    long sequence();

    long epoch();

    /** An ingested delta batch of one source: (epoch, source id, sequence, [key, value, sign]*). */
    record Batch(long sequence, long epoch, String sourceId, List<Row> rows) implements WalRecord {
        public Batch {
            Objects.requireNonNull(sourceId, "sourceId");
            rows = List.copyOf(rows);
        }
    }

    /** Ingestion for {@code epoch} ended; no further batch of this epoch follows in the log. */
    record EpochEnd(long sequence, long epoch) implements WalRecord {}
}
