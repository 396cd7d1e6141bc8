package io.deltaflow.core;

/** Snapshot/WAL inconsistency detected at startup; startup halts until an operator intervenes. */
public class RecoveryException extends DataflowException {
    public RecoveryException(String message) {
        super(message);
    }

    public RecoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
