package io.deltaflow.core.time;

import io.deltaflow.core.LateEpochException;
import io.deltaflow.core.StateException;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Frontier bookkeeping for every operator of a dataflow.
 * <p>
 * Model:
 *  - each operator has one frontier per shard; the operator frontier is the
 *    minimum over its shards and means "the smallest epoch not yet fully processed";
 *  - {@link #advanceFrontier} is called by the shard owner once it has consumed
 *    every batch &lt;= epoch on every input, moving that shard's frontier to epoch + 1;
 *  - an operator may never advance past its input frontier (the minimum frontier
 *    of its upstream operators) and frontiers never move backwards;
 *  - the global low-water frontier is the minimum over all operators; every epoch
 *    below it is closed and published to {@link EpochListener}s exactly once, in order.
 * <p>
 * Listener callbacks run on the reporting thread but outside the bookkeeping lock,
 * serialized so that epochs are always delivered in increasing order.
 */
public final class ProgressTracker {

    private static final class OperatorProgress {
        final String id;
        final long[] shardFrontiers;
        final List<String> upstream;

        OperatorProgress(String id, int shards, List<String> upstream, long initial) {
            this.id = id;
            this.shardFrontiers = new long[shards];
            java.util.Arrays.fill(shardFrontiers, initial);
            this.upstream = upstream;
        }

        long frontier() {
            long min = Long.MAX_VALUE;
            for (long f : shardFrontiers) min = Math.min(min, f);
            return min;
        }
    }

    private final Map<String, OperatorProgress> operators = new LinkedHashMap<>();
    private final List<EpochListener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<Long> pendingClosed = new ArrayDeque<>();
    private final Object dispatchLock = new Object();

    // guarded by this
    private long lowWatermark;

    /**
     * @param initialEpoch first epoch that is not yet processed anywhere
     *                     (0 on a fresh start, snapshot epoch + 1 after recovery)
     */
    public ProgressTracker(long initialEpoch) {
        if (initialEpoch < 0) throw new IllegalArgumentException("initialEpoch must be >= 0");
        this.lowWatermark = initialEpoch;
    }

    /**
     * Register an operator before execution starts.
     *
     * @param operatorId unique operator id
     * @param shards     number of shards owning a frontier
     * @param upstream   ids of operators feeding this one (must already be registered)
     */
    public synchronized void register(String operatorId, int shards, Collection<String> upstream) {
        Objects.requireNonNull(operatorId, "operatorId");
        if (shards <= 0) throw new IllegalArgumentException("shards must be > 0");
        if (operators.containsKey(operatorId)) {
            throw new IllegalArgumentException("operator already registered: " + operatorId);
        }
        for (String u : upstream) {
            if (!operators.containsKey(u)) {
                throw new IllegalArgumentException("unknown upstream " + u + " for " + operatorId);
            }
        }
        operators.put(operatorId, new OperatorProgress(operatorId, shards, List.copyOf(upstream), lowWatermark));
    }

    public void addListener(EpochListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Record that shard {@code shard} of {@code operatorId} finished {@code epoch}.
     *
     * @throws StateException if the frontier would regress or pass the input frontier
     */
    public void advanceFrontier(String operatorId, int shard, long epoch) {
        synchronized (this) {
            OperatorProgress p = operators.get(operatorId);
            if (p == null) throw new IllegalArgumentException("unknown operator " + operatorId);
            long next = epoch + 1;
            if (next <= p.shardFrontiers[shard]) {
                throw new StateException("frontier regression: shard " + shard + " at "
                        + p.shardFrontiers[shard] + " reported epoch " + epoch, operatorId, epoch);
            }
            long input = inputFrontier(p);
            if (next > input) {
                throw new StateException("frontier " + next + " would pass input frontier " + input,
                        operatorId, epoch);
            }
            p.shardFrontiers[shard] = next;

            long newLow = computeLowWatermark();
            for (long e = lowWatermark; e < newLow; e++) {
                pendingClosed.addLast(e);
            }
            lowWatermark = newLow;
        }
        dispatchClosed();
    }

    /** Minimum frontier over the operator's shards. */
    public synchronized long frontier(String operatorId) {
        OperatorProgress p = operators.get(operatorId);
        if (p == null) throw new IllegalArgumentException("unknown operator " + operatorId);
        return p.frontier();
    }

    /** Minimum frontier over the operator's upstream operators (unbounded for roots). */
    public synchronized long inputFrontier(String operatorId) {
        OperatorProgress p = operators.get(operatorId);
        if (p == null) throw new IllegalArgumentException("unknown operator " + operatorId);
        return inputFrontier(p);
    }

    /** First epoch that is not closed yet. */
    public synchronized long lowWatermark() {
        return lowWatermark;
    }

    /** Last closed epoch, or -1 if none. */
    public synchronized long closedThrough() {
        return lowWatermark - 1;
    }

    public synchronized boolean isClosed(long epoch) {
        return epoch < lowWatermark;
    }

    /**
     * Reject data for an epoch that is already closed.
     *
     * @throws LateEpochException if epoch is below the low-water frontier
     */
    public synchronized void checkAdmissible(long epoch) {
        if (epoch < lowWatermark) {
            throw new LateEpochException(epoch, lowWatermark);
        }
    }

    /** Current operator frontiers, in registration order. */
    public synchronized Map<String, Long> frontiers() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (OperatorProgress p : operators.values()) out.put(p.id, p.frontier());
        return out;
    }

    // ---------- internals ----------

    private long inputFrontier(OperatorProgress p) {
        long min = Long.MAX_VALUE;
        for (String u : p.upstream) min = Math.min(min, operators.get(u).frontier());
        return min;
    }

    private long computeLowWatermark() {
        long min = Long.MAX_VALUE;
        for (OperatorProgress p : operators.values()) min = Math.min(min, p.frontier());
        return min == Long.MAX_VALUE ? lowWatermark : min;
    }

    private void dispatchClosed() {
        synchronized (dispatchLock) {
            while (true) {
                Long e;
                synchronized (this) {
                    e = pendingClosed.pollFirst();
                }
                if (e == null) return;
                for (EpochListener l : listeners) l.epochClosed(e);
            }
        }
    }
}
