package io.deltaflow.core;

/** Data tagged with an epoch that is already closed. Epochs are never revisited. */
public class LateEpochException extends DataflowException {
    public LateEpochException(long epoch, long lowWatermark) {
        super("epoch " + epoch + " is below the low-water frontier " + lowWatermark, null, epoch, null);
    }
}
