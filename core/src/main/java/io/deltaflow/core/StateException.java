package io.deltaflow.core;

/**
 * Index/aggregate invariant violation (negative multiplicity where impossible,
 * frontier regression). Fatal: halts the dataflow so incorrect results never propagate.
 */
public class StateException extends DataflowException {
    public StateException(String message) {
        super(message);
    }

    public StateException(String message, String operatorId, long epoch) {
        super(message, operatorId, epoch, null);
    }
}
