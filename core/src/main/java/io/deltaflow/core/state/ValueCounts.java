package io.deltaflow.core.state;

import io.deltaflow.core.Value;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Ordered multiset of values with signed counts.
 * <p>
 * Backs retraction-aware min/max: retracting the current minimum simply lowers
 * its count, and {@link #min()} falls back to the next value that still has a
 * positive count. Zero counts are removed eagerly.
 */
public final class ValueCounts {

    private final NavigableMap<Value, Long> counts = new TreeMap<>();
    private long total;

    public void add(Value value, long diff) {
        if (diff == 0) return;
        long now = counts.merge(value, diff, Long::sum);
        if (now == 0) counts.remove(value);
        total += diff;
    }

    public long count(Value value) {
        return counts.getOrDefault(value, 0L);
    }

    /** Sum of all counts. */
    public long total() {
        return total;
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /** Smallest value with a positive count, or null. */
    public Value min() {
        for (var e : counts.entrySet()) {
            if (e.getValue() > 0) return e.getKey();
        }
        return null;
    }

    /** Largest value with a positive count, or null. */
    public Value max() {
        for (var e : counts.descendingMap().entrySet()) {
            if (e.getValue() > 0) return e.getKey();
        }
        return null;
    }

    public boolean hasNegative() {
        for (long c : counts.values()) {
            if (c < 0) return true;
        }
        return false;
    }

    /** Read-only ascending view. */
    public Map<Value, Long> asMap() {
        return Collections.unmodifiableMap(counts);
    }
}
