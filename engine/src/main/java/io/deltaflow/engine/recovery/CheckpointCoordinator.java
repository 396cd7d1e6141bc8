package io.deltaflow.engine.recovery;

import io.deltaflow.core.time.EpochCounter;
import io.deltaflow.core.time.EpochListener;
import io.deltaflow.core.time.ProgressTracker;
import io.deltaflow.engine.operator.Operator;
import io.deltaflow.engine.scheduler.BoundaryHook;
import io.deltaflow.engine.scheduler.SinkAckListener;
import io.deltaflow.storage.DeltaLog;
import io.deltaflow.storage.EpochStore;
import io.deltaflow.storage.SnapshotManifest;
import io.deltaflow.storage.SnapshotPolicy;
import io.deltaflow.storage.Snapshotter;

import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ties operator state, the WAL and the epoch store together.
 * <p>
 * At an operator shard's epoch boundary (on the owning thread):
 *  - write the shard image if the epoch is a snapshot epoch;
 *  - compact history through the last closed epoch, minus the configured lag.
 * <p>
 * When an epoch closes globally:
 *  - record it as committed, with the next WAL sequence;
 *  - persist the epoch counter;
 *  - on a snapshot epoch, write the manifest, then drop snapshots and WAL
 *    segments older than the oldest retained snapshot.
 * <p>
 * Sink acknowledgements go straight to the epoch store so an acknowledged
 * epoch is never delivered twice.
 */
public final class CheckpointCoordinator implements BoundaryHook, EpochListener, SinkAckListener {
    private static final Logger log = Logger.getLogger(CheckpointCoordinator.class.getName());

    private final Snapshotter snapshots;
    private final SnapshotPolicy policy;
    private final EpochStore store;
    private final DeltaLog wal;
    private final EpochCounter counter;
    private final ProgressTracker tracker;
    private final Map<String, Integer> layout;
    private final int retained;
    private final long compactionLag;

    public CheckpointCoordinator(Snapshotter snapshots, SnapshotPolicy policy, EpochStore store, DeltaLog wal,
                                 EpochCounter counter, ProgressTracker tracker, Map<String, Integer> layout,
                                 int retained, long compactionLag) {
        if (retained <= 0) throw new IllegalArgumentException("retained must be > 0");
        if (compactionLag < 0) throw new IllegalArgumentException("compactionLag must be >= 0");
        this.snapshots = snapshots;
        this.policy = policy;
        this.store = store;
        this.wal = wal;
        this.counter = counter;
        this.tracker = tracker;
        this.layout = Map.copyOf(layout);
        this.retained = retained;
        this.compactionLag = compactionLag;
    }

    @Override
    public void atBoundary(String operatorId, int shard, long epoch, Operator operator) {
        if (!layout.containsKey(operatorId)) return;
        if (policy.isSnapshotEpoch(epoch)) {
            snapshots.writeImage(operatorId, shard, epoch, operator.snapshot());
        }
        long through = Math.min(tracker.closedThrough(), epoch - compactionLag);
        if (through >= 0) operator.compact(through);
    }

    @Override
    public void epochClosed(long epoch) {
        store.update(m -> m.withCommitted(epoch).withNextSequence(wal.nextSequence()));
        counter.flush();
        if (!policy.isSnapshotEpoch(epoch)) return;

        snapshots.writeManifest(new SnapshotManifest(epoch, wal.nextSequence() - 1, layout,
                System.currentTimeMillis()));
        log.log(Level.INFO, "Snapshot complete at epoch {0}", epoch);

        List<Long> epochs = snapshots.manifestEpochs();
        if (epochs.size() > retained) {
            long oldestKept = epochs.get(epochs.size() - retained);
            int files = snapshots.deleteBefore(oldestKept);
            int segments = wal.truncateThrough(oldestKept);
            log.log(Level.FINE, "Retention through epoch {0}: {1} snapshot file(s), {2} WAL segment(s)",
                    new Object[]{oldestKept, files, segments});
        }
    }

    @Override
    public void acknowledged(String sinkId, long epoch) {
        store.update(m -> m.withSinkAck(sinkId, epoch));
    }
}
