package io.deltaflow.engine.connector;

import io.deltaflow.core.DeltaBatch;

/**
 * Sink side of the connector contract.
 * <p>
 * {@link #write} receives the consolidated output change of one epoch once
 * every path into the sink has finished it, so the batch is final. The epoch
 * closes globally only after every sink returned from this call. Epochs
 * arrive in increasing order, each at most once per engine lifetime. Returning
 * normally acknowledges the epoch durably: after a restart it is not delivered
 * again. Transient failures throw {@code ConnectorException} with
 * transient = true and are retried.
 */
public interface SinkConnector {

    void write(long epoch, DeltaBatch batch);
}
