package io.deltaflow.storage;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Persisted epoch bookkeeping.
 *
 * @param nextEpoch      first epoch not yet ended by ingestion when last flushed
 * @param committedEpoch highest epoch closed and acknowledged by every sink, or -1
 * @param nextSequence   next WAL sequence number to hand out
 * @param sinkAcks       sink id -> highest epoch that sink acknowledged
 */
public record EpochMetadata(long nextEpoch, long committedEpoch, long nextSequence, Map<String, Long> sinkAcks) {

    public static final EpochMetadata INITIAL = new EpochMetadata(0, -1, 0, Map.of());

    public EpochMetadata {
        if (nextEpoch < 0) throw new IllegalArgumentException("nextEpoch must be >= 0");
        if (nextSequence < 0) throw new IllegalArgumentException("nextSequence must be >= 0");
        sinkAcks = Map.copyOf(Objects.requireNonNull(sinkAcks, "sinkAcks"));
    }

    /** Highest epoch acknowledged by {@code sinkId}, or -1. */
    public long ackedBy(String sinkId) {
        return sinkAcks.getOrDefault(sinkId, -1L);
    }

    public EpochMetadata withNextEpoch(long epoch) {
        return new EpochMetadata(Math.max(nextEpoch, epoch), committedEpoch, nextSequence, sinkAcks);
    }

    public EpochMetadata withCommitted(long epoch) {
        return new EpochMetadata(nextEpoch, Math.max(committedEpoch, epoch), nextSequence, sinkAcks);
    }

    public EpochMetadata withNextSequence(long seq) {
        return new EpochMetadata(nextEpoch, committedEpoch, Math.max(nextSequence, seq), sinkAcks);
    }

    public EpochMetadata withSinkAck(String sinkId, long epoch) {
        Map<String, Long> acks = new TreeMap<>(sinkAcks);
        acks.merge(sinkId, epoch, Math::max);
        return new EpochMetadata(nextEpoch, committedEpoch, nextSequence, acks);
    }
}
