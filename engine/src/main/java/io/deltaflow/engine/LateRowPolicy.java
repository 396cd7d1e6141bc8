package io.deltaflow.engine;

import io.deltaflow.engine.operator.LateRowHandler;

/** What a window does with a row whose window is already sealed. */
public enum LateRowPolicy {
    /** Log a warning and drop the row from the results. */
    REPORT,
    /** Fail the dataflow with a {@code LateDataException}. */
    FAIL;

    LateRowHandler handler() {
        return this == FAIL ? LateRowHandler.fail() : LateRowHandler.report();
    }
}
