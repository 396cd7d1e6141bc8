package io.deltaflow.engine.operator;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.Row;
import io.deltaflow.core.Value;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DistinctOperatorTest {

    private static final Value V = Value.of("v");

    private static List<Row> epoch(DistinctOperator op, long epoch, Row... rows) {
        List<Row> out = new ArrayList<>();
        op.applyDelta(0, new DeltaBatch(epoch, List.of(rows)), out::add);
        op.advanceFrontier(epoch, out::add);
        return out;
    }

    @Test
    void duplicates_collapse_to_one_row() {
        var op = new DistinctOperator("d");
        assertEquals(List.of(Row.insert("k", V, 0)), epoch(op, 0, Row.insert("k", V, 0), Row.insert("k", V, 0)));
    }

    @Test
    void row_disappears_only_with_its_last_copy() {
        var op = new DistinctOperator("d");
        epoch(op, 0, Row.insert("k", V, 0), Row.insert("k", V, 0));

        assertTrue(epoch(op, 1, Row.retract("k", V, 1)).isEmpty());
        assertEquals(List.of(Row.retract("k", V, 2)), epoch(op, 2, Row.retract("k", V, 2)));
    }

    @Test
    void retract_and_reinsert_in_one_epoch_is_no_change() {
        var op = new DistinctOperator("d");
        epoch(op, 0, Row.insert("k", V, 0));
        assertTrue(epoch(op, 1, Row.retract("k", V, 1), Row.insert("k", V, 1)).isEmpty());
    }
}
