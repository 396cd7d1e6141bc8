package io.deltaflow.engine.operator;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.state.StateImage;

/**
 * Capability interface shared by every operator kind.
 * <p>
 * Contract:
 *  - an instance is owned by exactly one thread (one shard of one node), so
 *    implementations need no synchronization;
 *  - {@link #applyDelta} is called for every batch of the current epoch, on the
 *    input port the batch arrived on, in any interleaving of ports;
 *  - {@link #advanceFrontier} is called once per epoch after every input
 *    delivered the whole epoch; stateful operators emit their consolidated
 *    output changes here;
 *  - every emitted row carries the epoch being processed;
 *  - {@link #compact} may drop history but never changes what later calls emit.
 */
public interface Operator {

    void applyDelta(int port, DeltaBatch batch, Emitter out);

    void advanceFrontier(long epoch, Emitter out);

    /** Collapse history with epoch &lt;= through. */
    default void compact(long through) {
    }

    /** Serializable copy of the current state. */
    default StateImage snapshot() {
        return StateImage.EMPTY;
    }

    /** Replace the current state; called before the first delta. */
    default void restore(StateImage image) {
    }
}
