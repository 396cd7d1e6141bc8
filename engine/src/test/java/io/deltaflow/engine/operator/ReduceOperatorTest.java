package io.deltaflow.engine.operator;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.Row;
import io.deltaflow.core.StateException;
import io.deltaflow.core.Value;
import io.deltaflow.core.state.ZSet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ReduceOperatorTest {

    private static List<Row> epoch(ReduceOperator op, long epoch, List<Row> rows) {
        List<Row> out = new ArrayList<>();
        op.applyDelta(0, new DeltaBatch(epoch, rows), out::add);
        op.advanceFrontier(epoch, out::add);
        return out;
    }

    private static Row ins(String key, long v, long epoch) {
        return Row.insert(key, Value.of(v), epoch);
    }

    private static Row del(String key, long v, long epoch) {
        return Row.retract(key, Value.of(v), epoch);
    }

    @Test
    void sum_reads_five_then_seven_after_an_update() {
        var op = new ReduceOperator("sum", Reducers.sum());

        assertEquals(List.of(ins("1", 5, 0)), epoch(op, 0, List.of(ins("1", 5, 0))));

        List<Row> second = epoch(op, 1, List.of(del("1", 5, 1), ins("1", 7, 1)));
        assertEquals(List.of(del("1", 5, 1), ins("1", 7, 1)), second);
    }

    @Test
    void any_interleaving_within_an_epoch_gives_the_net_aggregate() {
        List<Row> rows = new ArrayList<>();
        for (int i = 1; i <= 20; i++) rows.add(ins("k", i, 0));
        for (int i = 1; i <= 20; i += 3) rows.add(del("k", i, 0));
        long expected = 0;
        for (Row r : rows) expected += r.value().asLong() * r.diff();

        Random rnd = new Random(7);
        for (int trial = 0; trial < 25; trial++) {
            List<Row> shuffled = new ArrayList<>(rows);
            Collections.shuffle(shuffled, rnd);
            for (Reducer reducer : List.of(Reducers.sum(), Reducers.count(), Reducers.max(), Reducers.min())) {
                var op = new ReduceOperator("r", reducer);
                List<Row> out = epoch(op, 0, shuffled);
                assertEquals(1, out.size(), reducer.name());
                if (reducer.name().equals("sum")) assertEquals(Value.of(expected), out.get(0).value());
                if (reducer.name().equals("count")) assertEquals(Value.of(13L), out.get(0).value());
                if (reducer.name().equals("max")) assertEquals(Value.of(20L), out.get(0).value());
                if (reducer.name().equals("min")) assertEquals(Value.of(2L), out.get(0).value());
            }
        }
    }

    @Test
    void max_falls_back_to_next_value_when_extremum_is_retracted() {
        var op = new ReduceOperator("max", Reducers.max());
        epoch(op, 0, List.of(ins("k", 3, 0), ins("k", 9, 0), ins("k", 5, 0)));

        List<Row> out = epoch(op, 1, List.of(del("k", 9, 1)));
        assertEquals(List.of(del("k", 9, 1), ins("k", 5, 1)), out);
    }

    @Test
    void min_keeps_duplicate_extremum_until_last_copy_goes() {
        var op = new ReduceOperator("min", Reducers.min());
        epoch(op, 0, List.of(ins("k", 1, 0), ins("k", 1, 0), ins("k", 4, 0)));

        assertTrue(epoch(op, 1, List.of(del("k", 1, 1))).isEmpty());
        assertEquals(List.of(del("k", 1, 2), ins("k", 4, 2)), epoch(op, 2, List.of(del("k", 1, 2))));
    }

    @Test
    void insert_and_retract_in_one_epoch_emit_nothing() {
        var op = new ReduceOperator("sum", Reducers.sum());
        assertTrue(epoch(op, 0, List.of(ins("k", 4, 0), del("k", 4, 0))).isEmpty());
    }

    @Test
    void group_that_empties_is_retracted() {
        var op = new ReduceOperator("count", Reducers.count());
        epoch(op, 0, List.of(ins("k", 4, 0)));
        assertEquals(List.of(Row.retract("k", Value.of(1L), 1)), epoch(op, 1, List.of(del("k", 4, 1))));
    }

    @Test
    void avg_is_real_valued() {
        var op = new ReduceOperator("avg", Reducers.avg());
        List<Row> out = epoch(op, 0, List.of(ins("k", 1, 0), ins("k", 2, 0)));
        assertEquals(1.5, out.get(0).value().asDouble(), 1e-9);
    }

    @Test
    void custom_reducer_recomputes_from_remaining_values() {
        var distinctValues = Reducers.custom("distinctValues", counts -> Value.of((long) counts.asMap().size()));
        var op = new ReduceOperator("d", distinctValues);
        epoch(op, 0, List.of(ins("k", 1, 0), ins("k", 1, 0), ins("k", 2, 0)));
        assertEquals(List.of(Row.retract("k", Value.of(2L), 1), Row.insert("k", Value.of(1L), 1)),
                epoch(op, 1, List.of(del("k", 2, 1))));
    }

    @Test
    void negative_group_at_epoch_close_is_a_state_error() {
        var op = new ReduceOperator("sum", Reducers.sum());
        var e = assertThrows(StateException.class, () -> epoch(op, 0, List.of(del("k", 4, 0))));
        assertEquals("sum", e.operatorId());
        assertEquals(0L, e.epoch());
    }

    @Test
    void retracting_a_value_never_inserted_is_a_state_error_even_when_offset() {
        for (Reducer reducer : List.of(Reducers.sum(), Reducers.count(), Reducers.avg())) {
            var op = new ReduceOperator("r", reducer);
            epoch(op, 0, List.of(ins("1", 5, 0)));

            var e = assertThrows(StateException.class,
                    () -> epoch(op, 1, List.of(del("1", 7, 1), ins("1", 9, 1))), reducer.name());
            assertEquals(1L, e.epoch());
        }
    }

    @Test
    void restored_sum_still_tracks_individual_values() {
        var op = new ReduceOperator("sum", Reducers.sum());
        epoch(op, 0, List.of(ins("k", 2, 0), ins("k", 3, 0)));

        var restored = new ReduceOperator("sum", Reducers.sum());
        restored.restore(op.snapshot());
        assertEquals(List.of(del("k", 5, 1), ins("k", 3, 1)), epoch(restored, 1, List.of(del("k", 2, 1))));
        assertThrows(StateException.class, () -> epoch(restored, 2, List.of(del("k", 2, 2), ins("k", 4, 2))));
    }

    @Test
    void restored_operator_continues_from_snapshot() {
        var op = new ReduceOperator("max", Reducers.max());
        epoch(op, 0, List.of(ins("a", 3, 0), ins("a", 8, 0), ins("b", 1, 0)));

        var restored = new ReduceOperator("max", Reducers.max());
        restored.restore(op.snapshot());
        List<Row> out = epoch(restored, 1, List.of(del("a", 8, 1)));

        ZSet z = new ZSet();
        out.forEach(z::apply);
        assertEquals(-1, z.count("a", Value.of(8L)));
        assertEquals(1, z.count("a", Value.of(3L)));
        assertTrue(z.values("b").isEmpty());
    }
}
