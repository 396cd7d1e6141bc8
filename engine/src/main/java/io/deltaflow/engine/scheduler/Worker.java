package io.deltaflow.engine.scheduler;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.StateException;

import java.util.Arrays;
import java.util.List;

/**
 * Event loop of one node instance (one shard of one node).
 * <p>
 * Epoch barrier:
 *  - the worker processes one epoch at a time, starting at the first open epoch;
 *  - it reads data from every inbound edge that has not yet delivered the end
 *    of the current epoch, in whatever order it arrives;
 *  - an edge that delivered EpochEnd(e) is not read again until every inbound
 *    edge has, so data of epoch e+1 never mixes into epoch e;
 *  - then {@link #completeEpoch(long)} runs and the next epoch starts.
 * <p>
 * Because upstream instances keep draining their own inputs while they wait,
 * a blocked producer always waits on a consumer that is still reading that edge,
 * so bounded queues cannot deadlock.
 * <p>
 * Any exception is reported to the {@link FailureMonitor} and ends the loop.
 */
abstract class Worker implements Runnable {
    private static final long IDLE_WAIT_MILLIS = 50;

    /** One inbound edge and the port it feeds. */
    record Inbound(int port, EdgeQueue queue) {}

    protected final String nodeId;
    protected final int shard;
    private final List<Inbound> inbound;
    private final Mailbox mailbox;
    private final FailureMonitor failures;

    private volatile boolean stopped;
    private volatile long epoch;

    Worker(String nodeId, int shard, List<Inbound> inbound, Mailbox mailbox, FailureMonitor failures, long firstEpoch) {
        if (inbound.isEmpty()) throw new IllegalArgumentException("worker " + nodeId + " has no inputs");
        this.nodeId = nodeId;
        this.shard = shard;
        this.inbound = List.copyOf(inbound);
        this.mailbox = mailbox;
        this.failures = failures;
        this.epoch = firstEpoch;
    }

    /** Apply one batch of the current epoch. */
    protected abstract void onData(int port, DeltaBatch batch) throws InterruptedException;

    /** Every input delivered the whole epoch. */
    protected abstract void completeEpoch(long epoch) throws InterruptedException;

    @Override
    public final void run() {
        try {
            loop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException | Error e) {
            if (!stopped) failures.report(new OperatorFailure(nodeId, shard, epoch, e));
        }
    }

    void stop() {
        stopped = true;
    }

    /** Epoch currently being processed. */
    long epoch() {
        return epoch;
    }

    private void loop() throws InterruptedException {
        int n = inbound.size();
        boolean[] ended = new boolean[n];
        int endedCount = 0;
        while (!stopped) {
            boolean progressed = false;
            for (int i = 0; i < n; i++) {
                Inbound in = inbound.get(i);
                Message m;
                while (!ended[i] && (m = in.queue().poll()) != null) {
                    progressed = true;
                    if (m instanceof Message.Data d) {
                        checkEpoch(d.batch().epoch(), in);
                        onData(in.port(), d.batch());
                    } else {
                        checkEpoch(((Message.EpochEnd) m).epoch(), in);
                        ended[i] = true;
                        endedCount++;
                    }
                }
            }
            if (endedCount == n) {
                completeEpoch(epoch);
                epoch++;
                Arrays.fill(ended, false);
                endedCount = 0;
            } else if (!progressed) {
                mailbox.await(IDLE_WAIT_MILLIS);
            }
        }
    }

    private void checkEpoch(long got, Inbound in) {
        if (got != epoch) {
            throw new StateException("edge " + in.queue() + " delivered epoch " + got + " while " + nodeId
                    + " is processing epoch " + epoch, nodeId, epoch);
        }
    }
}
