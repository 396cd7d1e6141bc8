package io.deltaflow.engine.operator;

import io.deltaflow.core.Value;

/**
 * A commutative, invertible aggregate over the values of one key.
 * <p>
 * Accumulators see inserts and retractions in any order within an epoch; only
 * the net multiset matters. {@link Reducers} holds the built-in ones.
 */
public interface Reducer {

    String name();

    Accumulator create();

    /** Rebuild an accumulator from {@link Accumulator#save()}. */
    Accumulator restore(Value saved);

    interface Accumulator {

        void add(Value value, long diff);

        /** Net number of values; zero means the group is empty. */
        long count();

        /** Aggregate of a non-empty group. */
        Value result();

        /** True if some value was retracted more often than inserted. */
        boolean negative();

        Value save();
    }
}
