package io.deltaflow.core;

/** Ingestion attempted while the engine is draining, failed or closed. */
public class EngineClosedException extends DataflowException {
    public EngineClosedException(String message) {
        super(message);
    }
}
