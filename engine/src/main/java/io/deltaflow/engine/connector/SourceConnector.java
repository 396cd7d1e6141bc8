package io.deltaflow.engine.connector;

import java.util.Optional;

/**
 * Source side of the connector contract.
 * <p>
 * Contract:
 *  - {@link #next()} blocks until an event is available and is only called from
 *    one engine thread;
 *  - epochs are assigned by the engine: a source only says where its epochs end;
 *  - transient failures throw {@code ConnectorException} with transient = true
 *    and are retried per {@link #retryPolicy()}; anything else fails the dataflow.
 */
public interface SourceConnector extends AutoCloseable {

    SourceEvent next() throws InterruptedException;

    /** Validation applied to every update, if any. */
    default Optional<Schema> schema() {
        return Optional.empty();
    }

    /** Retry policy for transient failures; empty means the engine default. */
    default Optional<RetryPolicy> retryPolicy() {
        return Optional.empty();
    }

    @Override
    default void close() {
    }
}
