package io.deltaflow.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable dynamically-typed value carried by rows.
 * <p>
 * Variants:
 *  - {@link Null}:  absent value (single instance {@link #NULL}).
 *  - {@link Bool}:  boolean.
 *  - {@link Int}:   64-bit signed integer.
 *  - {@link Real}:  IEEE double.
 *  - {@link Str}:   UTF-16 string.
 *  - {@link Tuple}: ordered list of values (join results, window results, composite keys).
 * <p>
 * Values are totally ordered: first by variant rank (in the order above), then
 * by content. Int and Real compare numerically against each other so that
 * aggregates mixing both still order sensibly; equality remains variant-exact.
 */
public sealed interface Value extends Comparable<Value>
        permits Value.Null, Value.Bool, Value.Int, Value.Real, Value.Str, Value.Tuple {

    Null NULL = new Null();

    static Value of(long v) { return new Int(v); }

    static Value of(double v) { return new Real(v); }

    static Value of(boolean v) { return new Bool(v); }

    static Value of(String v) {
        return v == null ? NULL : new Str(v);
    }

    static Value tuple(Value... items) { return new Tuple(Arrays.asList(items)); }

    static Value tuple(List<Value> items) { return new Tuple(items); }

    /** Variant rank used for cross-type ordering and as the codec tag. */
    int rank();

    /** Numeric view; throws for non-numeric variants. */
    default long asLong() {
        throw new IllegalStateException("not an integer: " + this);
    }

    /** Numeric view; throws for non-numeric variants. */
    default double asDouble() {
        throw new IllegalStateException("not a number: " + this);
    }

    default String asString() {
        throw new IllegalStateException("not a string: " + this);
    }

    /** Element access for tuples. */
    default Value get(int index) {
        throw new IllegalStateException("not a tuple: " + this);
    }

    default boolean isNumeric() { return false; }

    @Override
    default int compareTo(Value o) {
        if (isNumeric() && o.isNumeric()) {
            int c = (this instanceof Int a && o instanceof Int b)
                    ? Long.compare(a.v(), b.v())
                    : Double.compare(asDouble(), o.asDouble());
            return c != 0 ? c : Integer.compare(rank(), o.rank());
        }
        int byRank = Integer.compare(rank(), o.rank());
        if (byRank != 0) return byRank;
        if (this instanceof Bool a) return Boolean.compare(a.v(), ((Bool) o).v());
        if (this instanceof Str a) return a.v().compareTo(((Str) o).v());
        if (this instanceof Tuple a) return compareTuples(a.items(), ((Tuple) o).items());
        return 0; // Null
    }

    private static int compareTuples(List<Value> a, List<Value> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    record Null() implements Value {
        @Override public int rank() { return 0; }
        @Override public String toString() { return "null"; }
    }

    record Bool(boolean v) implements Value {
        @Override public int rank() { return 1; }
        @Override public String toString() { return Boolean.toString(v); }
    }

    record Int(long v) implements Value {
        @Override public int rank() { return 2; }
        @Override public boolean isNumeric() { return true; }
        @Override public long asLong() { return v; }
        @Override public double asDouble() { return v; }
        @Override public String toString() { return Long.toString(v); }
    }

    record Real(double v) implements Value {
        @Override public int rank() { return 3; }
        @Override public boolean isNumeric() { return true; }
        @Override public long asLong() { return (long) v; }
        @Override public double asDouble() { return v; }
        @Override public String toString() { return Double.toString(v); }
    }

    record Str(String v) implements Value {
        public Str {
            Objects.requireNonNull(v, "v");
        }
        @Override public int rank() { return 4; }
        @Override public String asString() { return v; }
        @Override public String toString() { return '"' + v + '"'; }
    }

    record Tuple(List<Value> items) implements Value {
        public Tuple {
            // List.copyOf rejects null elements; use Value.NULL instead.
            items = List.copyOf(items);
        }
        @Override public int rank() { return 5; }
        @Override public Value get(int index) { return items.get(index); }

        public int size() { return items.size(); }

        /** Return a new tuple with {@code extra} appended. */
        public Tuple append(Value extra) {
            var out = new ArrayList<Value>(items.size() + 1);
            out.addAll(items);
            out.add(extra);
            return new Tuple(out);
        }

        @Override public String toString() { return items.toString(); }
    }
}
