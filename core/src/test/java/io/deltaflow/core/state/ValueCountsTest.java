package io.deltaflow.core.state;

import io.deltaflow.core.Value;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueCountsTest {

    @Test
    void retracted_minimum_falls_back_to_next_smallest() {
        var counts = new ValueCounts();
        counts.add(Value.of(3), 1);
        counts.add(Value.of(1), 1);
        counts.add(Value.of(2), 1);
        assertEquals(Value.of(1), counts.min());
        assertEquals(Value.of(3), counts.max());

        counts.add(Value.of(1), -1);
        assertEquals(Value.of(2), counts.min());

        counts.add(Value.of(3), -1);
        assertEquals(Value.of(2), counts.max());
    }

    @Test
    void duplicate_values_need_every_copy_retracted() {
        var counts = new ValueCounts();
        counts.add(Value.of(1), 2);
        counts.add(Value.of(1), -1);
        assertEquals(Value.of(1), counts.min());
        counts.add(Value.of(1), -1);
        assertNull(counts.min());
        assertTrue(counts.isEmpty());
        assertEquals(0, counts.total());
    }

    @Test
    void transient_negative_counts_are_skipped_for_extrema() {
        var counts = new ValueCounts();
        counts.add(Value.of(0), -1);
        counts.add(Value.of(4), 1);
        assertTrue(counts.hasNegative());
        assertEquals(Value.of(4), counts.min());
    }
}
