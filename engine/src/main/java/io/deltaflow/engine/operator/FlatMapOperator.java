package io.deltaflow.engine.operator;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.KeyedValue;
import io.deltaflow.core.Row;

import java.util.List;
import java.util.function.Function;

/** Expands every row into zero or more rows carrying the input's epoch and sign. */
final class FlatMapOperator implements Operator {
    private final Function<KeyedValue, List<KeyedValue>> fn;

    FlatMapOperator(Function<KeyedValue, List<KeyedValue>> fn) {
        this.fn = fn;
    }

    @Override
    public void applyDelta(int port, DeltaBatch batch, Emitter out) {
        for (Row r : batch.rows()) {
            for (KeyedValue kv : fn.apply(r.keyedValue())) {
                out.emit(new Row(kv.key(), kv.value(), r.epoch(), r.diff()));
            }
        }
    }

    @Override
    public void advanceFrontier(long epoch, Emitter out) {
    }
}
