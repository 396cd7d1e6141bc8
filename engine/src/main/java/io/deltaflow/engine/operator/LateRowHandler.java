package io.deltaflow.engine.operator;

import io.deltaflow.core.LateDataException;
import io.deltaflow.core.Row;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receives rows that arrive for a window that is already sealed.
 * Such rows are never merged into results; the handler decides whether that is
 * reported or fatal.
 */
@FunctionalInterface
public interface LateRowHandler {

    void onLateRow(String operatorId, Row row, long watermark);

    /** Log a warning and carry on. */
    static LateRowHandler report() {
        Logger log = Logger.getLogger(LateRowHandler.class.getName());
        return (op, row, watermark) -> log.log(Level.WARNING,
                "Late row rejected by {0}: {1} (watermark {2})", new Object[]{op, row, watermark});
    }

    /** Fail the dataflow with {@link LateDataException}. */
    static LateRowHandler fail() {
        return (op, row, watermark) -> {
            throw new LateDataException(op, row, "row is later than the allowed lateness (watermark " + watermark + ")");
        };
    }
}
