package io.deltaflow.core.state;

import io.deltaflow.core.Row;
import io.deltaflow.core.StateException;
import io.deltaflow.core.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-key history index: key -> list of (value, epoch, diff) entries.
 * <p>
 * Used by each side of a join. Entries with the same value and epoch are merged
 * on insert; entries that cancel to zero disappear.
 * <p>
 * Compaction:
 *  - {@link #compact(long)} collapses, per key and value, every entry with
 *    epoch &lt;= through into one entry stamped {@code through};
 *  - the accumulated multiset of every key is unchanged by compaction;
 *  - after compacting through C, {@link #asOf(String, long)} is exact for
 *    every epoch &gt;= C and rejects earlier ones.
 * Not thread safe: owned by one operator shard.
 */
public final class ArrangedIndex {

    /** One history entry of a key. */
    public record Entry(Value value, long epoch, long diff) {}

    private final Map<String, List<Entry>> byKey = new HashMap<>();
    private long compactedThrough = -1;

    /** Merge a row into the history of its key. */
    public void insert(Row row) {
        List<Entry> entries = byKey.computeIfAbsent(row.key(), k -> new ArrayList<>(2));
        for (int i = 0; i < entries.size(); i++) {
            Entry e = entries.get(i);
            if (e.epoch() == row.epoch() && e.value().equals(row.value())) {
                long d = e.diff() + row.diff();
                if (d == 0) {
                    entries.remove(i);
                    if (entries.isEmpty()) byKey.remove(row.key());
                } else {
                    entries.set(i, new Entry(e.value(), e.epoch(), d));
                }
                return;
            }
        }
        entries.add(new Entry(row.value(), row.epoch(), row.diff()));
    }

    /** History entries of a key (read-only), empty if absent. */
    public List<Entry> probe(String key) {
        List<Entry> entries = byKey.get(key);
        return entries == null ? List.of() : Collections.unmodifiableList(entries);
    }

    /** Accumulated multiset of a key over its whole history. */
    public Map<Value, Long> accumulated(String key) {
        return asOf(key, Long.MAX_VALUE);
    }

    /**
     * Multiset of a key as of {@code epoch}: the sum of entries with epoch &lt;= the argument.
     *
     * @throws StateException if epoch precedes the compaction frontier
     */
    public Map<Value, Long> asOf(String key, long epoch) {
        if (epoch < compactedThrough) {
            throw new StateException("epoch " + epoch + " was compacted (through " + compactedThrough + ")");
        }
        Map<Value, Long> out = new TreeMap<>();
        for (Entry e : probe(key)) {
            if (e.epoch() <= epoch) out.merge(e.value(), e.diff(), Long::sum);
        }
        out.values().removeIf(c -> c == 0);
        return out;
    }

    /**
     * Collapse history with epoch &lt;= through.
     *
     * @return number of entries removed by the collapse
     */
    public int compact(long through) {
        if (through <= compactedThrough) return 0;
        int removed = 0;
        var it = byKey.entrySet().iterator();
        while (it.hasNext()) {
            var kv = it.next();
            List<Entry> entries = kv.getValue();
            Map<Value, Long> collapsed = new TreeMap<>();
            List<Entry> kept = new ArrayList<>(entries.size());
            for (Entry e : entries) {
                if (e.epoch() <= through) {
                    collapsed.merge(e.value(), e.diff(), Long::sum);
                } else {
                    kept.add(e);
                }
            }
            List<Entry> rebuilt = new ArrayList<>(collapsed.size() + kept.size());
            for (var c : collapsed.entrySet()) {
                if (c.getValue() != 0) rebuilt.add(new Entry(c.getKey(), through, c.getValue()));
            }
            rebuilt.addAll(kept);
            removed += entries.size() - rebuilt.size();
            if (rebuilt.isEmpty()) {
                it.remove();
            } else {
                kv.setValue(rebuilt);
            }
        }
        compactedThrough = through;
        return removed;
    }

    public long compactedThrough() {
        return compactedThrough;
    }

    public int keyCount() {
        return byKey.size();
    }

    /** Total number of history entries across keys. */
    public int entryCount() {
        int n = 0;
        for (List<Entry> e : byKey.values()) n += e.size();
        return n;
    }

    /** Every entry as a row (epoch = entry epoch), in deterministic order. */
    public List<Row> toRows() {
        List<Row> out = new ArrayList<>(entryCount());
        for (var kv : new TreeMap<>(byKey).entrySet()) {
            for (Entry e : kv.getValue()) {
                out.add(new Row(kv.getKey(), e.value(), e.epoch(), e.diff()));
            }
        }
        out.sort(StateImage.ROW_ORDER);
        return out;
    }

    /** Replace contents with the given rows (as produced by {@link #toRows()}). */
    public void restore(List<Row> rows, long compactedThrough) {
        byKey.clear();
        for (Row r : rows) insert(r);
        this.compactedThrough = compactedThrough;
    }
}
