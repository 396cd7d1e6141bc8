package io.deltaflow.engine.scheduler;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.KeyHashing;
import io.deltaflow.core.Row;
import io.deltaflow.core.time.ProgressTracker;
import io.deltaflow.engine.operator.Operator;

import java.util.ArrayList;
import java.util.List;

/**
 * Worker owning one operator shard.
 * <p>
 * Emitted rows are buffered and, after every operator call, split by key hash
 * over the shards of each consumer. At the end of an epoch the order is:
 * flush the final output, run the boundary hook (snapshot, compaction),
 * report the frontier, then forward EpochEnd, so no consumer can finish an
 * epoch before its producers are accounted for.
 */
final class OperatorWorker extends Worker {

    /** All edges from this instance to one (consumer node, port), indexed by consumer shard. */
    record Outbound(List<EdgeQueue> shards) {}

    private final Operator operator;
    private final List<Outbound> outbound;
    private final ProgressTracker tracker;
    private final BoundaryHook hook;
    private final List<Row> buffer = new ArrayList<>();

    OperatorWorker(String nodeId, int shard, Operator operator, List<Inbound> inbound, List<Outbound> outbound,
                   Mailbox mailbox, ProgressTracker tracker, FailureMonitor failures, BoundaryHook hook,
                   long firstEpoch) {
        super(nodeId, shard, inbound, mailbox, failures, firstEpoch);
        this.operator = operator;
        this.outbound = List.copyOf(outbound);
        this.tracker = tracker;
        this.hook = hook;
    }

    Operator operator() {
        return operator;
    }

    @Override
    protected void onData(int port, DeltaBatch batch) throws InterruptedException {
        operator.applyDelta(port, batch, buffer::add);
        flush(batch.epoch());
    }

    @Override
    protected void completeEpoch(long epoch) throws InterruptedException {
        operator.advanceFrontier(epoch, buffer::add);
        flush(epoch);
        hook.atBoundary(nodeId, shard, epoch, operator);
        tracker.advanceFrontier(nodeId, shard, epoch);
        Message end = new Message.EpochEnd(epoch);
        for (Outbound o : outbound) {
            for (EdgeQueue q : o.shards()) q.put(end);
        }
    }

    private void flush(long epoch) throws InterruptedException {
        if (buffer.isEmpty()) return;
        for (Outbound o : outbound) {
            int n = o.shards().size();
            if (n == 1) {
                o.shards().get(0).put(new Message.Data(new DeltaBatch(epoch, buffer)));
                continue;
            }
            List<List<Row>> parts = new ArrayList<>(n);
            for (int i = 0; i < n; i++) parts.add(new ArrayList<>());
            for (Row r : buffer) parts.get(KeyHashing.shardFor(r.key(), n)).add(r);
            for (int i = 0; i < n; i++) {
                if (!parts.get(i).isEmpty()) {
                    o.shards().get(i).put(new Message.Data(new DeltaBatch(epoch, parts.get(i))));
                }
            }
        }
        buffer.clear();
    }
}
