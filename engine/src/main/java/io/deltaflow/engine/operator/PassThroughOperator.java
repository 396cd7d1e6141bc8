package io.deltaflow.engine.operator;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.Row;

/** Forwards every row unchanged: sources, concat and iteration inputs. */
final class PassThroughOperator implements Operator {

    @Override
    public void applyDelta(int port, DeltaBatch batch, Emitter out) {
        for (Row r : batch.rows()) out.emit(r);
    }

    @Override
    public void advanceFrontier(long epoch, Emitter out) {
    }
}
