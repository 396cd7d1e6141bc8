package io.deltaflow.engine.scheduler;

import io.deltaflow.engine.DataflowFailedException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records the first operator failure and triggers the graph-wide stop.
 * Any operator fault is fatal to the whole dataflow; later failures (usually
 * consequences of the stop) are logged at FINE and otherwise ignored.
 */
public final class FailureMonitor {
    private static final Logger log = Logger.getLogger(FailureMonitor.class.getName());

    private final AtomicReference<OperatorFailure> first = new AtomicReference<>();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /** Run {@code callback} once, on the reporting thread, when the first failure arrives. */
    public void onFailure(Runnable callback) {
        callbacks.add(callback);
    }

    /** @return true if this was the first failure */
    public boolean report(OperatorFailure failure) {
        if (!first.compareAndSet(null, failure)) {
            log.log(Level.FINE, "Ignoring follow-up failure in " + failure.operatorId(), failure.cause());
            return false;
        }
        log.log(Level.WARNING, "Operator " + failure.operatorId() + " shard " + failure.shard()
                + " failed at epoch " + failure.epoch() + "; stopping dataflow", failure.cause());
        for (Runnable r : callbacks) r.run();
        return true;
    }

    public Optional<OperatorFailure> failure() {
        return Optional.ofNullable(first.get());
    }

    public boolean failed() {
        return first.get() != null;
    }

    /** @throws DataflowFailedException if a failure was recorded */
    public void throwIfFailed() {
        OperatorFailure f = first.get();
        if (f != null) throw new DataflowFailedException(f);
    }
}
