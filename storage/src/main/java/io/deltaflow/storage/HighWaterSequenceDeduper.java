package io.deltaflow.storage;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Sequence deduper relying on log order.
 *
 * Semantics:
 *  - sequence numbers are assigned by one counter and appear in the WAL in
 *    strictly increasing order, so "applied" is exactly "&lt;= high-water mark";
 *  - firstTime(seq) returns true and raises the mark only for seq above it;
 *  - state is a single long, so it survives in snapshots and epoch metadata
 *    without growing with the log.
 */
public final class HighWaterSequenceDeduper implements SequenceDeduper {

    private final AtomicLong highWater;

    /** @param alreadyApplied highest sequence already reflected in state, or -1 */
    public HighWaterSequenceDeduper(long alreadyApplied) {
        if (alreadyApplied < -1) throw new IllegalArgumentException("alreadyApplied must be >= -1");
        this.highWater = new AtomicLong(alreadyApplied);
    }

    public HighWaterSequenceDeduper() {
        this(-1);
    }

    @Override
    public boolean firstTime(long sequence) {
        while (true) {
            long hw = highWater.get();
            if (sequence <= hw) return false;
            if (highWater.compareAndSet(hw, sequence)) return true;
        }
    }

    @Override
    public long highWater() {
        return highWater.get();
    }
}
