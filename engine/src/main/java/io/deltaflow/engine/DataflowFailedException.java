package io.deltaflow.engine;

import io.deltaflow.core.DataflowException;
import io.deltaflow.engine.scheduler.OperatorFailure;

/**
 * The dataflow stopped because an operator failed. Carries the failing
 * operator and epoch; the underlying error is the cause.
 */
public class DataflowFailedException extends DataflowException {
    private final OperatorFailure failure;

    public DataflowFailedException(OperatorFailure failure) {
        super("operator " + failure.operatorId() + " (shard " + failure.shard() + ") failed at epoch "
                + failure.epoch() + ": " + failure.cause(), failure.operatorId(), failure.epoch(), failure.cause());
        this.failure = failure;
    }

    public OperatorFailure failure() {
        return failure;
    }
}
