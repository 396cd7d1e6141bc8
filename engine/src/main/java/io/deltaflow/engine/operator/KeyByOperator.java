package io.deltaflow.engine.operator;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.KeyedValue;
import io.deltaflow.core.Row;

import java.util.function.Function;

/** Re-keys rows; the downstream exchange moves them to the shard owning the new key. */
final class KeyByOperator implements Operator {
    private final Function<KeyedValue, String> keyFn;

    KeyByOperator(Function<KeyedValue, String> keyFn) {
        this.keyFn = keyFn;
    }

    @Override
    public void applyDelta(int port, DeltaBatch batch, Emitter out) {
        for (Row r : batch.rows()) {
            out.emit(new Row(keyFn.apply(r.keyedValue()), r.value(), r.epoch(), r.diff()));
        }
    }

    @Override
    public void advanceFrontier(long epoch, Emitter out) {
    }
}
