package io.deltaflow.storage;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Snapshot policy that triggers a snapshot every N closed epochs.
 * <p>
 * Simple but effective:
 *  - Bounds worst-case recovery time by limiting WAL replay length.
 *  - The decision is a pure function of the epoch, so every operator shard
 *    reaches the same answer at its own epoch boundary without coordination.
 *  - {@link #force(long)} adds one extra epoch, used for the final snapshot
 *    on graceful shutdown.
 */
public final class SnapshotPolicy {
    private final int everyEpochs;
    private final AtomicLong forced = new AtomicLong(-1);

    public SnapshotPolicy(int everyEpochs) {
        if (everyEpochs <= 0) throw new IllegalArgumentException("everyEpochs must be > 0");
        this.everyEpochs = everyEpochs;
    }

    /** True if state must be snapshotted once {@code epoch} is fully applied. */
    public boolean isSnapshotEpoch(long epoch) {
        return (epoch + 1) % everyEpochs == 0 || epoch == forced.get();
    }

    /** Snapshot {@code epoch} regardless of the interval. Must be called before any shard finishes it. */
    public void force(long epoch) {
        forced.set(epoch);
    }

    public int everyEpochs() {
        return everyEpochs;
    }
}
