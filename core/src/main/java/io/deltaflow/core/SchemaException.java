package io.deltaflow.core;

/** An ingested row failed type/shape validation. Fatal for its source only. */
public class SchemaException extends DataflowException {
    private final String sourceId;

    public SchemaException(String sourceId, String message) {
        super("source " + sourceId + ": " + message);
        this.sourceId = sourceId;
    }

    public String sourceId() { return sourceId; }
}
