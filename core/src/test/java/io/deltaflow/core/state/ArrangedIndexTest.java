package io.deltaflow.core.state;

import io.deltaflow.core.Row;
import io.deltaflow.core.StateException;
import io.deltaflow.core.Value;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArrangedIndexTest {

    @Test
    void entries_of_same_value_and_epoch_merge_and_cancel() {
        var idx = new ArrangedIndex();
        idx.insert(Row.insert("k", Value.of(1), 0));
        idx.insert(Row.insert("k", Value.of(1), 0));
        assertEquals(1, idx.entryCount());
        assertEquals(2, idx.probe("k").get(0).diff());

        idx.insert(new Row("k", Value.of(1), 0, -2));
        assertEquals(0, idx.keyCount());
        assertTrue(idx.probe("k").isEmpty());
    }

    @Test
    void as_of_sums_history_up_to_epoch() {
        var idx = new ArrangedIndex();
        idx.insert(Row.insert("id", Value.of(5), 0));
        idx.insert(Row.retract("id", Value.of(5), 1));
        idx.insert(Row.insert("id", Value.of(7), 1));

        assertEquals(Map.of(Value.of(5), 1L), idx.asOf("id", 0));
        assertEquals(Map.of(Value.of(7), 1L), idx.asOf("id", 1));
    }

    @Test
    void compaction_collapses_history_without_changing_accumulated_value() {
        var idx = new ArrangedIndex();
        for (long e = 0; e < 10; e++) {
            idx.insert(Row.insert("k", Value.of(e), e));
            if (e > 0) idx.insert(Row.retract("k", Value.of(e - 1), e));
        }
        idx.insert(Row.insert("other", Value.of("x"), 12));
        var before = idx.accumulated("k");
        int entriesBefore = idx.entryCount();

        int removed = idx.compact(9);

        assertEquals(before, idx.accumulated("k"));
        assertEquals(Map.of(Value.of(9L), 1L), idx.accumulated("k"));
        assertTrue(removed > 0);
        assertEquals(entriesBefore - removed, idx.entryCount());
        assertEquals(12, idx.probe("other").get(0).epoch(), "entries after the frontier keep their epoch");
        assertThrows(StateException.class, () -> idx.asOf("k", 3));
    }

    @Test
    void rows_round_trip_through_restore() {
        var idx = new ArrangedIndex();
        idx.insert(Row.insert("a", Value.of(1), 0));
        idx.insert(Row.insert("b", Value.of(2), 1));
        idx.compact(0);

        var copy = new ArrangedIndex();
        copy.restore(idx.toRows(), idx.compactedThrough());

        assertEquals(idx.toRows(), copy.toRows());
        assertEquals(0, copy.compactedThrough());
    }
}
