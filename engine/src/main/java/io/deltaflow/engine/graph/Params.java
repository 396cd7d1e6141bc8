package io.deltaflow.engine.graph;

import io.deltaflow.core.KeyedValue;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/** Parameter names understood by the node kinds. */
public final class Params {
    /** MAP: {@link MapFn}; FLAT_MAP: {@link FlatMapFn}. */
    public static final String FN = "fn";
    /** FILTER: {@link FilterFn}. */
    public static final String PREDICATE = "predicate";
    /** KEY_BY: {@link KeyFn}. */
    public static final String KEY_FN = "keyFn";
    /** REDUCE: Reducer. */
    public static final String REDUCER = "reducer";
    /** WINDOW: WindowSpec. */
    public static final String WINDOW = "window";
    /** ITERATE: GraphSpec of the loop body. */
    public static final String BODY = "body";
    /** ITERATE: Integer bound on iterations per epoch (optional). */
    public static final String MAX_ITERATIONS = "maxIterations";

    public interface MapFn extends Function<KeyedValue, KeyedValue> {
    }

    public interface FlatMapFn extends Function<KeyedValue, List<KeyedValue>> {
    }

    public interface FilterFn extends Predicate<KeyedValue> {
    }

    public interface KeyFn extends Function<KeyedValue, String> {
    }

    private Params() {
        // constants
    }
}
