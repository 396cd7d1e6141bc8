package io.deltaflow.engine.operator;

import java.util.Objects;

/**
 * Engine-wide settings handed to operators at construction.
 *
 * @param operatorId      id used in errors and logs (nested ids are joined with '/')
 * @param maxIterations   default iteration bound for fixpoint scopes
 * @param allowedLateness default lateness bound for windows without their own policy
 * @param lateRows        what to do with rows for sealed windows
 */
public record OperatorContext(String operatorId, int maxIterations, long allowedLateness, LateRowHandler lateRows) {

    public OperatorContext {
        Objects.requireNonNull(operatorId, "operatorId");
        Objects.requireNonNull(lateRows, "lateRows");
        if (maxIterations <= 0) throw new IllegalArgumentException("maxIterations must be > 0");
        if (allowedLateness < 0) throw new IllegalArgumentException("allowedLateness must be >= 0");
    }

    /** Same settings for a node nested inside this one. */
    public OperatorContext nested(String childId) {
        return new OperatorContext(operatorId + "/" + childId, maxIterations, allowedLateness, lateRows);
    }

    public OperatorContext forOperator(String id) {
        return new OperatorContext(id, maxIterations, allowedLateness, lateRows);
    }
}
