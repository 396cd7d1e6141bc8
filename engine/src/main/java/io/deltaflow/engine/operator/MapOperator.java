package io.deltaflow.engine.operator;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.KeyedValue;
import io.deltaflow.core.Row;

import java.util.function.Function;

/** Applies a pure function to every (key, value); epoch and sign are preserved. */
final class MapOperator implements Operator {
    private final Function<KeyedValue, KeyedValue> fn;

    MapOperator(Function<KeyedValue, KeyedValue> fn) {
        this.fn = fn;
    }

    @Override
    public void applyDelta(int port, DeltaBatch batch, Emitter out) {
        for (Row r : batch.rows()) {
            KeyedValue kv = fn.apply(r.keyedValue());
            out.emit(new Row(kv.key(), kv.value(), r.epoch(), r.diff()));
        }
    }

    @Override
    public void advanceFrontier(long epoch, Emitter out) {
    }
}
