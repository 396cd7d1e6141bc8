package io.deltaflow.engine.scheduler;

import java.util.Objects;

/**
 * First fault that stopped a dataflow.
 *
 * @param operatorId node (or source) the fault happened in
 * @param shard      shard of that node, 0 for unsharded nodes and sources
 * @param epoch      epoch being processed
 * @param cause      the original error
 */
public record OperatorFailure(String operatorId, int shard, long epoch, Throwable cause) {
    public OperatorFailure {
        Objects.requireNonNull(operatorId, "operatorId");
        Objects.requireNonNull(cause, "cause");
    }
}
