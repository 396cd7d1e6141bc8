package io.deltaflow.core.time;

import io.deltaflow.core.EngineClosedException;

import java.util.function.LongConsumer;

/**
 * Process-wide epoch counter shared by the ingestion boundary and the scheduler.
 * <p>
 * Lifecycle:
 *  - created from persisted state ({@link #restoredFrom}) or at epoch 0;
 *  - {@link #assign()} hands out the current epoch to ingested batches;
 *  - {@link #advance()} ends ingestion for the current epoch and opens the next;
 *  - {@link #drain()} stops new ingestion (advance is still allowed so the last
 *    epoch can be closed), {@link #fail()} and {@link #close()} are terminal;
 *  - {@link #flush()} hands the next epoch to the persistence callback; the
 *    engine calls it on every commit and on graceful shutdown.
 * <p>
 * Thread safety: all methods synchronize on this instance; waiters are woken
 * on every state change.
 */
public final class EpochCounter {

    public enum State { RUNNING, DRAINING, FAILED, CLOSED }

    private final LongConsumer flusher;

    // guarded by this
    private long current;
    private State state = State.RUNNING;

    public EpochCounter(long initialEpoch, LongConsumer flusher) {
        if (initialEpoch < 0) throw new IllegalArgumentException("initialEpoch must be >= 0");
        this.current = initialEpoch;
        this.flusher = flusher == null ? e -> { } : flusher;
    }

    public EpochCounter() {
        this(0, null);
    }

    /** Counter resuming at {@code nextEpoch}, typically loaded from the epoch store. */
    public static EpochCounter restoredFrom(long nextEpoch, LongConsumer flusher) {
        return new EpochCounter(nextEpoch, flusher);
    }

    /**
     * Epoch for a batch being ingested now.
     *
     * @throws EngineClosedException if the counter is draining, failed or closed
     */
    public synchronized long assign() {
        if (state != State.RUNNING) {
            throw new EngineClosedException("ingestion rejected: engine is " + state);
        }
        return current;
    }

    public synchronized long current() {
        return current;
    }

    public synchronized State state() {
        return state;
    }

    /**
     * End ingestion for the current epoch and open the next one.
     *
     * @return the epoch that was just ended
     */
    public synchronized long advance() {
        if (state == State.FAILED || state == State.CLOSED) {
            throw new EngineClosedException("cannot advance epoch: engine is " + state);
        }
        long ended = current++;
        notifyAll();
        return ended;
    }

    /**
     * Block until the current epoch is greater than {@code epoch}.
     *
     * @return the new current epoch
     * @throws EngineClosedException if the counter stops running while waiting
     */
    public synchronized long awaitEpochAfter(long epoch) throws InterruptedException {
        while (current <= epoch && state == State.RUNNING) {
            wait();
        }
        if (current <= epoch) {
            throw new EngineClosedException("engine is " + state + " while waiting for epoch " + (epoch + 1));
        }
        return current;
    }

    public synchronized void drain() {
        if (state == State.RUNNING) {
            state = State.DRAINING;
            notifyAll();
        }
    }

    public synchronized void fail() {
        if (state != State.CLOSED) {
            state = State.FAILED;
            notifyAll();
        }
    }

    public synchronized void close() {
        state = State.CLOSED;
        notifyAll();
    }

    /** Persist the next epoch to hand out. */
    public void flush() {
        flusher.accept(current());
    }
}
