package io.deltaflow.engine.scheduler;

import io.deltaflow.engine.operator.Operator;

/**
 * Called by the owning worker once a shard finished an epoch, before its
 * progress is reported. Snapshots and compaction happen here because only the
 * owning thread may touch operator state.
 */
@FunctionalInterface
public interface BoundaryHook {

    void atBoundary(String operatorId, int shard, long epoch, Operator operator);

    BoundaryHook NONE = (op, shard, epoch, operator) -> { };
}
