package io.deltaflow.engine.ingest;

import io.deltaflow.core.Row;
import io.deltaflow.core.time.EpochCounter;
import io.deltaflow.core.time.ProgressTracker;
import io.deltaflow.engine.connector.Update;
import io.deltaflow.engine.scheduler.Dataflow;
import io.deltaflow.storage.DeltaLog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The single point where ingested updates receive their epoch.
 * <p>
 * For every batch:
 *  1) take the current epoch from the {@link EpochCounter};
 *  2) append the batch to the WAL (durable before anything else sees it);
 *  3) admit it into the dataflow.
 * <p>
 * An epoch ends once every active source has ended it. A finished source no
 * longer holds epochs open; when the last one finishes, an epoch that received
 * data is ended so its results become visible.
 */
public final class IngestionBoundary {
    private static final Logger log = Logger.getLogger(IngestionBoundary.class.getName());

    private final EpochCounter counter;
    private final ProgressTracker tracker;
    private final DeltaLog wal;
    private final Dataflow dataflow;

    // guarded by this
    private final Set<String> active;
    private final Set<String> endedCurrent = new HashSet<>();
    private boolean dirty;

    public IngestionBoundary(EpochCounter counter, ProgressTracker tracker, DeltaLog wal, Dataflow dataflow,
                             Collection<String> sourceIds) {
        this.counter = counter;
        this.tracker = tracker;
        this.wal = wal;
        this.dataflow = dataflow;
        this.active = new LinkedHashSet<>(sourceIds);
    }

    /**
     * Log and admit updates of one source into the current epoch.
     *
     * @return the epoch the updates were assigned to
     * @throws io.deltaflow.core.EngineClosedException if the engine no longer accepts input
     */
    public synchronized long ingest(String sourceId, List<Update> updates) throws InterruptedException {
        long epoch = counter.assign();
        if (endedCurrent.contains(sourceId)) {
            throw new IllegalStateException("source " + sourceId + " already ended epoch " + epoch);
        }
        tracker.checkAdmissible(epoch);
        if (updates.isEmpty()) return epoch;
        List<Row> rows = new ArrayList<>(updates.size());
        for (Update u : updates) rows.add(u.atEpoch(epoch));
        wal.appendBatch(epoch, sourceId, rows);
        dataflow.admit(sourceId, epoch, rows);
        dirty = true;
        return epoch;
    }

    /**
     * The source has nothing more for the current epoch.
     *
     * @return the epoch the source ended
     */
    public synchronized long endEpoch(String sourceId) throws InterruptedException {
        long epoch = counter.current();
        if (!active.contains(sourceId)) throw new IllegalStateException("source " + sourceId + " is not active");
        endedCurrent.add(sourceId);
        if (endedCurrent.containsAll(active)) closeCurrentEpoch();
        return epoch;
    }

    /** The source is exhausted or stopped; it no longer holds epochs open. */
    public synchronized void finish(String sourceId) throws InterruptedException {
        if (!active.remove(sourceId)) return;
        endedCurrent.remove(sourceId);
        log.log(Level.INFO, "Source {0} finished", sourceId);
        if (active.isEmpty()) {
            if (dirty) closeCurrentEpoch();
        } else if (endedCurrent.containsAll(active)) {
            closeCurrentEpoch();
        }
    }

    /**
     * End the current epoch regardless of which sources ended it.
     *
     * @return the epoch that was ended
     */
    public synchronized long closeCurrentEpoch() throws InterruptedException {
        long epoch = counter.current();
        wal.appendEpochEnd(epoch);
        counter.advance();
        dataflow.endEpoch(epoch);
        endedCurrent.clear();
        dirty = false;
        log.log(Level.FINE, "Ended epoch {0}", epoch);
        return epoch;
    }

    public synchronized Set<String> activeSources() {
        return Set.copyOf(active);
    }
}
