package io.deltaflow.core;

import java.util.Objects;

/**
 * A signed change to a collection: (key, value, epoch, diff).
 * <p>
 * diff is the multiplicity of the change: +1 inserts one copy of (key, value),
 * -1 retracts one. Rows with equal key/value/epoch accumulate by summing diffs.
 * Ingested rows always carry +1 or -1; derived rows (join products,
 * consolidated batches) may carry larger magnitudes. A zero diff is never
 * materialized.
 */
public record Row(String key, Value value, long epoch, long diff) {

    public Row {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (epoch < 0) throw new IllegalArgumentException("epoch must be >= 0, got " + epoch);
        if (diff == 0) throw new IllegalArgumentException("diff must be non-zero");
    }

    public static Row insert(String key, Value value, long epoch) {
        return new Row(key, value, epoch, 1);
    }

    public static Row retract(String key, Value value, long epoch) {
        return new Row(key, value, epoch, -1);
    }

    public KeyedValue keyedValue() {
        return new KeyedValue(key, value);
    }

    public Row withEpoch(long newEpoch) {
        return new Row(key, value, newEpoch, diff);
    }

    public Row withDiff(long newDiff) {
        return new Row(key, value, epoch, newDiff);
    }

    public Row negate() {
        return new Row(key, value, epoch, -diff);
    }

    @Override
    public String toString() {
        return "(" + key + ", " + value + ", @" + epoch + ", " + (diff > 0 ? "+" : "") + diff + ")";
    }
}
