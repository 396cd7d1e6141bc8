package io.deltaflow.core;

/**
 * Root of the engine's error taxonomy.
 * <p>
 * Carries the failing operator id and epoch when known so that a failed
 * dataflow can be reported as "operator X failed at epoch E".
 * Both are optional: -1 / null mean "not attributable".
 */
public abstract class DataflowException extends RuntimeException {
    private final String operatorId;
    private final long epoch;

    protected DataflowException(String message, String operatorId, long epoch, Throwable cause) {
        super(message, cause);
        this.operatorId = operatorId;
        this.epoch = epoch;
    }

    protected DataflowException(String message) {
        this(message, null, -1, null);
    }

    protected DataflowException(String message, Throwable cause) {
        this(message, null, -1, cause);
    }

    /** Operator the fault is attributed to, or null. */
    public String operatorId() { return operatorId; }

    /** Epoch the fault is attributed to, or -1. */
    public long epoch() { return epoch; }
}
