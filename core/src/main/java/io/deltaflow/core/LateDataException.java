package io.deltaflow.core;

/** A windowed row arrived after its window was sealed (beyond allowed lateness). */
public class LateDataException extends DataflowException {
    private final Row row;

    public LateDataException(String operatorId, Row row, String message) {
        super(message, operatorId, row.epoch(), null);
        this.row = row;
    }

    public Row row() { return row; }
}
