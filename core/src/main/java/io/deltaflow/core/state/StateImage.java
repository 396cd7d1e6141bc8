package io.deltaflow.core.state;

import io.deltaflow.core.Row;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Serializable form of one operator shard's state: named sections of rows.
 * <p>
 * Every operator maps its indexes and aggregates onto sections (for example a
 * join writes "left" and "right"); scalar bookkeeping goes into a "meta"
 * section of rows with well-known keys. Sections are sorted by name and rows
 * within a section by {@link #ROW_ORDER}, so two images of equal state are equal.
 */
public record StateImage(SortedMap<String, List<Row>> sections) {

    public static final Comparator<Row> ROW_ORDER = Comparator
            .comparing(Row::key)
            .thenComparing(Row::value)
            .thenComparingLong(Row::epoch)
            .thenComparingLong(Row::diff);

    public static final StateImage EMPTY = new StateImage(new TreeMap<>());

    public StateImage {
        TreeMap<String, List<Row>> copy = new TreeMap<>();
        for (var e : sections.entrySet()) {
            List<Row> rows = new ArrayList<>(e.getValue());
            rows.sort(ROW_ORDER);
            copy.put(e.getKey(), List.copyOf(rows));
        }
        sections = Collections.unmodifiableSortedMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Rows of a section, empty if absent. */
    public List<Row> section(String name) {
        return sections.getOrDefault(name, List.of());
    }

    public boolean isEmpty() {
        for (List<Row> rows : sections.values()) {
            if (!rows.isEmpty()) return false;
        }
        return true;
    }

    /**
     * Sections whose name starts with {@code prefix + "/"}, with the prefix removed.
     * Used by operators that nest other operators' images (fixpoint scopes).
     */
    public StateImage nested(String prefix) {
        String p = prefix + "/";
        Map<String, List<Row>> out = new TreeMap<>();
        for (var e : sections.entrySet()) {
            if (e.getKey().startsWith(p)) out.put(e.getKey().substring(p.length()), e.getValue());
        }
        return new StateImage(new TreeMap<>(out));
    }

    public static final class Builder {
        private final TreeMap<String, List<Row>> sections = new TreeMap<>();

        public Builder section(String name, List<Row> rows) {
            sections.put(name, rows);
            return this;
        }

        /** Add every section of {@code inner} under {@code prefix + "/"}. */
        public Builder nest(String prefix, StateImage inner) {
            for (var e : inner.sections().entrySet()) {
                sections.put(prefix + "/" + e.getKey(), e.getValue());
            }
            return this;
        }

        public StateImage build() {
            return new StateImage(sections);
        }
    }
}
