package io.deltaflow.core.time;

/** Notified, in epoch order, each time an epoch becomes globally closed. */
@FunctionalInterface
public interface EpochListener {
    void epochClosed(long epoch);
}
