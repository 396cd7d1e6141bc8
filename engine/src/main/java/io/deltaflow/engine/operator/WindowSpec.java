package io.deltaflow.engine.operator;

import io.deltaflow.core.KeyedValue;

import java.util.Objects;
import java.util.function.ToLongFunction;

/**
 * Parameters of a window node.
 *
 * @param policy    window assignment
 * @param timestamp event time of a row
 * @param reducer   aggregate over the row values of each window
 * @param lateness  lateness bound, or null for the engine default
 */
public record WindowSpec(WindowPolicy policy, ToLongFunction<KeyedValue> timestamp, Reducer reducer,
                         LatenessPolicy lateness) {

    public WindowSpec {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(reducer, "reducer");
    }

    public WindowSpec(WindowPolicy policy, ToLongFunction<KeyedValue> timestamp, Reducer reducer) {
        this(policy, timestamp, reducer, null);
    }

    public WindowSpec withLateness(LatenessPolicy lateness) {
        return new WindowSpec(policy, timestamp, reducer, lateness);
    }
}
