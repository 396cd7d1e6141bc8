package io.deltaflow.engine.graph;

/** A graph description that cannot be executed. */
public class GraphValidationException extends IllegalArgumentException {
    public GraphValidationException(String message) {
        super(message);
    }
}
