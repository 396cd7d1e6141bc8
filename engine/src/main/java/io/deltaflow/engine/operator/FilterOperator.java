package io.deltaflow.engine.operator;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.KeyedValue;
import io.deltaflow.core.Row;

import java.util.function.Predicate;

final class FilterOperator implements Operator {
    private final Predicate<KeyedValue> predicate;

    FilterOperator(Predicate<KeyedValue> predicate) {
        this.predicate = predicate;
    }

    @Override
    public void applyDelta(int port, DeltaBatch batch, Emitter out) {
        for (Row r : batch.rows()) {
            if (predicate.test(r.keyedValue())) out.emit(r);
        }
    }

    @Override
    public void advanceFrontier(long epoch, Emitter out) {
    }
}
