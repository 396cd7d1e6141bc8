package io.deltaflow.engine.operator;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Assigns event times to windows.
 * <p>
 * Tumbling and sliding windows are fixed per timestamp. Session windows
 * depend on the neighbouring events of the same key, which is why assignment
 * works on the whole set of a key's event times.
 */
public interface WindowPolicy {

    /** Every window that covers at least one of {@code times}, ascending. */
    List<Window> windows(NavigableSet<Long> times);

    /**
     * End of the earliest window an event at {@code ts} would fall into on its own.
     * Once the watermark passes this end plus the lateness bound, such an event is late,
     * even if later windows covering it are still open.
     */
    long firstEnd(long ts);

    /**
     * True if an event at {@code ts} would extend or join the already sealed window
     * {@code sealed}. Only windows that grow with their events can be reached this way.
     */
    default boolean reaches(long ts, Window sealed) {
        return false;
    }

    static WindowPolicy tumbling(long size) {
        if (size <= 0) throw new IllegalArgumentException("size must be > 0");
        return new WindowPolicy() {
            @Override
            public List<Window> windows(NavigableSet<Long> times) {
                TreeSet<Window> out = new TreeSet<>();
                for (long ts : times) {
                    long start = Math.floorDiv(ts, size) * size;
                    out.add(new Window(start, start + size));
                }
                return new ArrayList<>(out);
            }

            @Override
            public long firstEnd(long ts) {
                return Math.floorDiv(ts, size) * size + size;
            }

            @Override
            public String toString() {
                return "tumbling(" + size + ")";
            }
        };
    }

    static WindowPolicy sliding(long size, long slide) {
        if (size <= 0 || slide <= 0) throw new IllegalArgumentException("size and slide must be > 0");
        if (slide > size) throw new IllegalArgumentException("slide must not exceed size");
        return new WindowPolicy() {
            @Override
            public List<Window> windows(NavigableSet<Long> times) {
                TreeSet<Window> out = new TreeSet<>();
                for (long ts : times) {
                    for (long start = Math.floorDiv(ts, slide) * slide; start > ts - size; start -= slide) {
                        out.add(new Window(start, start + size));
                    }
                }
                return new ArrayList<>(out);
            }

            @Override
            public long firstEnd(long ts) {
                // earliest start above ts - size
                return Math.floorDiv(ts - size, slide) * slide + slide + size;
            }

            @Override
            public String toString() {
                return "sliding(" + size + ", " + slide + ")";
            }
        };
    }

    /** Events closer than {@code gap} belong to the same session; a session ends {@code gap} after its last event. */
    static WindowPolicy session(long gap) {
        if (gap <= 0) throw new IllegalArgumentException("gap must be > 0");
        return new WindowPolicy() {
            @Override
            public List<Window> windows(NavigableSet<Long> times) {
                List<Window> out = new ArrayList<>();
                Long first = null;
                long last = 0;
                for (long ts : times) {
                    if (first != null && ts - last >= gap) {
                        out.add(new Window(first, last + gap));
                        first = null;
                    }
                    if (first == null) first = ts;
                    last = ts;
                }
                if (first != null) out.add(new Window(first, last + gap));
                return out;
            }

            @Override
            public long firstEnd(long ts) {
                return ts + gap;
            }

            @Override
            public boolean reaches(long ts, Window sealed) {
                return ts < sealed.end() && ts + gap > sealed.start();
            }

            @Override
            public String toString() {
                return "session(" + gap + ")";
            }
        };
    }
}
