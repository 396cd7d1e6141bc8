package io.deltaflow.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeltaBatchTest {

    @Test
    void consolidate_sums_multiplicities_and_drops_cancelled_rows() {
        var batch = new DeltaBatch(3, List.of(
                Row.insert("a", Value.of(1), 3),
                Row.insert("b", Value.of(2), 3),
                Row.insert("a", Value.of(1), 3),
                Row.retract("b", Value.of(2), 3)));

        var consolidated = batch.consolidate();

        assertEquals(List.of(new Row("a", Value.of(1), 3, 2)), consolidated.rows());
    }

    @Test
    void consolidation_is_independent_of_arrival_order() {
        var r1 = Row.insert("x", Value.of("p"), 0);
        var r2 = Row.retract("y", Value.of("q"), 0);
        var r3 = Row.insert("x", Value.of("z"), 0);

        var a = new DeltaBatch(0, List.of(r1, r2, r3)).consolidate();
        var b = new DeltaBatch(0, List.of(r3, r1, r2)).consolidate();

        assertEquals(a, b);
    }

    @Test
    void rows_from_another_epoch_are_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new DeltaBatch(1, List.of(Row.insert("a", Value.of(1), 2))));
    }

    @Test
    void zero_diff_rows_cannot_be_built() {
        assertThrows(IllegalArgumentException.class, () -> new Row("a", Value.NULL, 0, 0));
    }
}
