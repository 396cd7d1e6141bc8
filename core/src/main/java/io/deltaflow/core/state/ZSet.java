package io.deltaflow.core.state;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.Row;
import io.deltaflow.core.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Key-indexed multiset with signed multiplicities: key -> (value -> count).
 * <p>
 * Counts may be transiently negative while an epoch is being applied
 * (a retraction can arrive before its insertion); entries whose count sums to
 * zero are removed immediately, so the structure never holds history.
 * Not thread safe: owned by one operator shard.
 */
public final class ZSet {

    private final Map<String, Map<Value, Long>> byKey = new HashMap<>();

    /** Add {@code diff} copies of (key, value); returns the new count. */
    public long update(String key, Value value, long diff) {
        if (diff == 0) return count(key, value);
        Map<Value, Long> values = byKey.computeIfAbsent(key, k -> new HashMap<>());
        long now = values.merge(value, diff, Long::sum);
        if (now == 0) {
            values.remove(value);
            if (values.isEmpty()) byKey.remove(key);
        }
        return now;
    }

    public void apply(Row row) {
        update(row.key(), row.value(), row.diff());
    }

    public void apply(DeltaBatch batch) {
        for (Row r : batch.rows()) apply(r);
    }

    public long count(String key, Value value) {
        Map<Value, Long> values = byKey.get(key);
        if (values == null) return 0;
        return values.getOrDefault(value, 0L);
    }

    /** Read-only view of one key's values, empty if absent. */
    public Map<Value, Long> values(String key) {
        Map<Value, Long> values = byKey.get(key);
        return values == null ? Map.of() : Collections.unmodifiableMap(values);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(byKey.keySet());
    }

    public boolean isEmpty() {
        return byKey.isEmpty();
    }

    /** Number of distinct (key, value) pairs. */
    public int size() {
        int n = 0;
        for (Map<Value, Long> v : byKey.values()) n += v.size();
        return n;
    }

    /** First (key, value) with a negative count, or null when all counts are positive. */
    public Row firstNegative(long epoch) {
        for (var k : byKey.entrySet()) {
            for (var v : k.getValue().entrySet()) {
                if (v.getValue() < 0) return new Row(k.getKey(), v.getKey(), epoch, v.getValue());
            }
        }
        return null;
    }

    /** Contents as rows stamped with {@code epoch}, in deterministic order. */
    public List<Row> toRows(long epoch) {
        List<Row> out = new ArrayList<>(size());
        for (var k : new TreeMap<>(byKey).entrySet()) {
            for (var v : new TreeMap<>(k.getValue()).entrySet()) {
                out.add(new Row(k.getKey(), v.getKey(), epoch, v.getValue()));
            }
        }
        return out;
    }

    /**
     * Rows that turn {@code from} into {@code to}: for every pair, diff = to - from.
     * Output is in deterministic order.
     */
    public static List<Row> difference(ZSet to, ZSet from, long epoch) {
        ZSet d = new ZSet();
        for (var k : to.byKey.entrySet()) {
            for (var v : k.getValue().entrySet()) d.update(k.getKey(), v.getKey(), v.getValue());
        }
        for (var k : from.byKey.entrySet()) {
            for (var v : k.getValue().entrySet()) d.update(k.getKey(), v.getKey(), -v.getValue());
        }
        return d.toRows(epoch);
    }

    public void clear() {
        byKey.clear();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ZSet other)) return false;
        return byKey.equals(other.byKey);
    }

    @Override
    public int hashCode() {
        return byKey.hashCode();
    }

    @Override
    public String toString() {
        return byKey.toString();
    }
}
