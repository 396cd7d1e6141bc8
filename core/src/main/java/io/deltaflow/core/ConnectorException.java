package io.deltaflow.core;

/**
 * I/O failure at the connector boundary.
 * Transient failures are retried by the engine per the connector's retry policy;
 * permanent ones (or transient ones that exhausted their retries) fail the dataflow.
 */
public class ConnectorException extends DataflowException {
    private final boolean transientFailure;

    public ConnectorException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public ConnectorException(String message, boolean transientFailure) {
        this(message, transientFailure, null);
    }

    public boolean isTransient() { return transientFailure; }
}
