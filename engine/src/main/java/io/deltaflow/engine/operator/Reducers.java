package io.deltaflow.engine.operator;

import io.deltaflow.core.Value;
import io.deltaflow.core.state.ValueCounts;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Built-in reducers.
 * <p>
 * Two state shapes:
 *  - running totals (sum, count, avg): retraction subtracts; per-value counts
 *    ride along so a value retracted more often than inserted is still seen;
 *  - per-value counts (min, max, custom): a {@link ValueCounts} multiset, so
 *    retracting the current extremum falls back to the next remaining value.
 */
public final class Reducers {

    private Reducers() {
        // utility
    }

    /** Sum of numeric values; integral while every value is an Int. */
    public static Reducer sum() {
        return new TotalsReducer("sum");
    }

    /** Number of rows (with multiplicity). */
    public static Reducer count() {
        return new TotalsReducer("count");
    }

    /** Arithmetic mean as a Real. */
    public static Reducer avg() {
        return new TotalsReducer("avg");
    }

    public static Reducer min() {
        return new CountsReducer("min", ValueCounts::min);
    }

    public static Reducer max() {
        return new CountsReducer("max", ValueCounts::max);
    }

    /**
     * Reducer recomputed from the key's whole value multiset on every change.
     * {@code fn} only sees multisets with at least one positive count.
     */
    public static Reducer custom(String name, Function<ValueCounts, Value> fn) {
        return new CountsReducer(name, Objects.requireNonNull(fn, "fn"));
    }

    // ---------- running totals ----------

    private static final class TotalsReducer implements Reducer {
        private final String name;

        TotalsReducer(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Accumulator create() {
            return new Totals(name);
        }

        @Override
        public Accumulator restore(Value saved) {
            Totals t = new Totals(name);
            for (Value pair : ((Value.Tuple) saved).items()) {
                t.add(pair.get(0), pair.get(1).asLong());
            }
            return t;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final class Totals implements Reducer.Accumulator {
        private final String kind;
        long count;
        long intSum;
        double realSum;
        long realCount;
        final ValueCounts values = new ValueCounts();

        Totals(String kind) {
            this.kind = kind;
        }

        @Override
        public void add(Value value, long diff) {
            values.add(value, diff);
            count += diff;
            if ("count".equals(kind)) return;
            if (value instanceof Value.Int i) {
                intSum += i.v() * diff;
            } else if (value instanceof Value.Real r) {
                realSum += r.v() * diff;
                realCount += diff;
            } else {
                throw new IllegalArgumentException(kind + " over non-numeric value " + value);
            }
        }

        @Override
        public long count() {
            return count;
        }

        @Override
        public Value result() {
            switch (kind) {
                case "count":
                    return Value.of(count);
                case "avg":
                    return Value.of((intSum + realSum) / count);
                default:
                    return realCount != 0 ? Value.of(intSum + realSum) : Value.of(intSum);
            }
        }

        @Override
        public boolean negative() {
            return count < 0 || values.hasNegative();
        }

        @Override
        public Value save() {
            return savePairs(values);
        }
    }

    // ---------- per-value counts ----------

    private static final class CountsReducer implements Reducer {
        private final String name;
        private final Function<ValueCounts, Value> fn;

        CountsReducer(String name, Function<ValueCounts, Value> fn) {
            this.name = name;
            this.fn = fn;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Accumulator create() {
            return new Counts(fn);
        }

        @Override
        public Accumulator restore(Value saved) {
            Counts c = new Counts(fn);
            Value.Tuple pairs = (Value.Tuple) saved;
            for (Value pair : pairs.items()) {
                c.values.add(pair.get(0), pair.get(1).asLong());
            }
            return c;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final class Counts implements Reducer.Accumulator {
        private final Function<ValueCounts, Value> fn;
        final ValueCounts values = new ValueCounts();

        Counts(Function<ValueCounts, Value> fn) {
            this.fn = fn;
        }

        @Override
        public void add(Value value, long diff) {
            values.add(value, diff);
        }

        @Override
        public long count() {
            return values.total();
        }

        @Override
        public Value result() {
            return fn.apply(values);
        }

        @Override
        public boolean negative() {
            return values.hasNegative();
        }

        @Override
        public Value save() {
            return savePairs(values);
        }
    }

    /** (value, count) pairs, read back by adding each pair. */
    private static Value savePairs(ValueCounts values) {
        List<Value> pairs = new ArrayList<>();
        for (Map.Entry<Value, Long> e : values.asMap().entrySet()) {
            pairs.add(Value.tuple(e.getKey(), Value.of(e.getValue())));
        }
        return Value.tuple(pairs);
    }
}
