package io.deltaflow.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Atomic set of rows sharing one epoch: the unit of propagation between operators.
 * <p>
 * Invariants:
 *  - every row carries {@link #epoch()};
 *  - the row list is immutable.
 */
public record DeltaBatch(long epoch, List<Row> rows) {

    /** Deterministic output order: key, then value, then diff. */
    public static final Comparator<Row> ROW_ORDER = Comparator
            .comparing(Row::key)
            .thenComparing(Row::value)
            .thenComparingLong(Row::diff);

    public DeltaBatch {
        if (epoch < 0) throw new IllegalArgumentException("epoch must be >= 0, got " + epoch);
        rows = List.copyOf(rows);
        for (Row r : rows) {
            if (r.epoch() != epoch) {
                throw new IllegalArgumentException(
                        "row " + r + " does not belong to batch epoch " + epoch);
            }
        }
    }

    public static DeltaBatch empty(long epoch) {
        return new DeltaBatch(epoch, List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    /**
     * Sum multiplicities of equal (key, value) pairs and drop pairs that cancel out.
     * The result is sorted by {@link #ROW_ORDER} so that consolidated batches of
     * equal content are equal regardless of the arrival order of their rows.
     */
    public DeltaBatch consolidate() {
        if (rows.isEmpty()) return this;
        Map<KeyedValue, Long> sums = new LinkedHashMap<>();
        for (Row r : rows) {
            sums.merge(r.keyedValue(), r.diff(), Long::sum);
        }
        List<Row> out = new ArrayList<>(sums.size());
        for (var e : sums.entrySet()) {
            long d = e.getValue();
            if (d != 0) out.add(new Row(e.getKey().key(), e.getKey().value(), epoch, d));
        }
        out.sort(ROW_ORDER);
        return new DeltaBatch(epoch, out);
    }

    /** Batch with every row's diff negated. */
    public DeltaBatch negate() {
        List<Row> out = new ArrayList<>(rows.size());
        for (Row r : rows) out.add(r.negate());
        return new DeltaBatch(epoch, out);
    }

    public static DeltaBatch concat(long epoch, List<DeltaBatch> parts) {
        List<Row> out = new ArrayList<>();
        for (DeltaBatch b : parts) out.addAll(b.rows());
        return new DeltaBatch(epoch, out);
    }
}
