package io.deltaflow.engine.scheduler;

/** Notified after a sink durably acknowledged an epoch. */
@FunctionalInterface
public interface SinkAckListener {

    void acknowledged(String sinkId, long epoch);
}
