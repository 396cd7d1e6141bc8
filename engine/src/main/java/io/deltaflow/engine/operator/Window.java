package io.deltaflow.engine.operator;

import io.deltaflow.core.Value;

/** Half-open event-time interval [start, end). */
public record Window(long start, long end) implements Comparable<Window> {

    public Window {
        if (end <= start) throw new IllegalArgumentException("empty window [" + start + ", " + end + ")");
    }

    public boolean contains(long ts) {
        return ts >= start && ts < end;
    }

    /** Output value of a window aggregate: (start, end, aggregate). */
    public Value withAggregate(Value aggregate) {
        return Value.tuple(Value.of(start), Value.of(end), aggregate);
    }

    @Override
    public int compareTo(Window o) {
        int c = Long.compare(start, o.start);
        return c != 0 ? c : Long.compare(end, o.end);
    }
}
