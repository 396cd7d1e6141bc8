package io.deltaflow.engine.operator;

import io.deltaflow.core.Row;

/** Receives the rows an operator derives. */
@FunctionalInterface
public interface Emitter {
    void emit(Row row);
}
