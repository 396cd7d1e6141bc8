package io.deltaflow.storage;

/**
 * Deduplicates WAL records by sequence number.
 * Rationale:
 *  - Recovery may see the same record more than once: a segment replayed twice,
 *    or a retried append that reached the disk before its failure was reported.
 *  - Each sequence number must change operator state exactly once.
 */
public interface SequenceDeduper {
    /** Returns true if this sequence was not applied before and is now recorded as applied. */
    boolean firstTime(long sequence);

    /** Highest sequence recorded as applied, or -1. */
    long highWater();
}
