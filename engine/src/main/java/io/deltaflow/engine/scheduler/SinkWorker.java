package io.deltaflow.engine.scheduler;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.Row;
import io.deltaflow.core.time.ProgressTracker;
import io.deltaflow.engine.connector.RetryPolicy;
import io.deltaflow.engine.connector.SinkConnector;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers one sink's output, a whole epoch at a time.
 * <p>
 * An epoch is written as soon as every input of the sink has ended it: its
 * content is final from then on. The write happens before the epoch closes
 * globally, since global close waits for this sink's frontier.
 * <p>
 * Epochs at or below {@code ackedThrough} were acknowledged before a restart
 * and are being recomputed from the WAL; they are not delivered again.
 * A sink reports its frontier only after the write returned, so an epoch
 * closes globally only once every sink has acknowledged it.
 */
final class SinkWorker extends Worker {
    private static final Logger log = Logger.getLogger(SinkWorker.class.getName());

    private final SinkConnector sink;
    private final RetryPolicy retry;
    private final ProgressTracker tracker;
    private final SinkAckListener acks;
    private final List<Row> pending = new ArrayList<>();
    private long ackedThrough;

    SinkWorker(String sinkId, SinkConnector sink, RetryPolicy retry, List<Inbound> inbound, Mailbox mailbox,
               ProgressTracker tracker, FailureMonitor failures, SinkAckListener acks, long ackedThrough,
               long firstEpoch) {
        super(sinkId, 0, inbound, mailbox, failures, firstEpoch);
        this.sink = sink;
        this.retry = retry;
        this.tracker = tracker;
        this.acks = acks;
        this.ackedThrough = ackedThrough;
    }

    @Override
    protected void onData(int port, DeltaBatch batch) {
        pending.addAll(batch.rows());
    }

    @Override
    protected void completeEpoch(long epoch) throws InterruptedException {
        DeltaBatch out = new DeltaBatch(epoch, pending).consolidate();
        pending.clear();
        if (epoch > ackedThrough) {
            retry.execute("sink " + nodeId, () -> {
                sink.write(epoch, out);
                return null;
            });
            ackedThrough = epoch;
            acks.acknowledged(nodeId, epoch);
        } else {
            log.log(Level.FINE, "Sink {0} already acknowledged epoch {1}, not delivering again",
                    new Object[]{nodeId, epoch});
        }
        tracker.advanceFrontier(nodeId, 0, epoch);
    }
}
