package io.deltaflow.engine.operator;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.Row;
import io.deltaflow.core.StateException;
import io.deltaflow.core.Value;
import io.deltaflow.core.state.StateImage;
import io.deltaflow.core.state.ValueCounts;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Event-time windowed aggregation per key.
 * <p>
 * Time:
 *  - the watermark is the largest event time inserted in any closed epoch of
 *    this shard; it only moves at epoch boundaries;
 *  - a window [start, end) is complete once watermark &gt;= end and is emitted then;
 *  - it keeps accepting changes (emitted as retract + insert corrections) until
 *    it is sealed at watermark &gt;= end + allowed lateness;
 *  - a row is handed to the {@link LateRowHandler} and never merged if any
 *    window it belongs to is sealed: for sliding windows that is the earliest
 *    one covering it, for sessions also any sealed session it would extend.
 * <p>
 * State per key: event time -> value multiset, plus the aggregate last emitted
 * for every complete, unsealed window. Both are dropped once sealed. Sealed
 * window bounds are kept until no admissible row can reach them.
 * Output rows: (key, (start, end, aggregate)).
 */
final class WindowOperator implements Operator {
    private static final long NO_WATERMARK = Long.MIN_VALUE;

    private final String operatorId;
    private final WindowSpec spec;
    private final LatenessPolicy lateness;
    private final LateRowHandler lateRows;

    private final Map<String, TreeMap<Long, ValueCounts>> events = new HashMap<>();
    private final Map<String, TreeMap<Window, Value>> emitted = new HashMap<>();
    private final Map<String, TreeSet<Window>> sealed = new HashMap<>();
    private final Set<String> touched = new HashSet<>();
    private long watermark = NO_WATERMARK;
    private long pendingMax = NO_WATERMARK;

    WindowOperator(String operatorId, WindowSpec spec, LatenessPolicy defaultLateness, LateRowHandler lateRows) {
        this.operatorId = operatorId;
        this.spec = spec;
        this.lateness = spec.lateness() != null ? spec.lateness() : defaultLateness;
        this.lateRows = lateRows;
    }

    @Override
    public void applyDelta(int port, DeltaBatch batch, Emitter out) {
        for (Row r : batch.rows()) {
            long ts = spec.timestamp().applyAsLong(r.keyedValue());
            if (late(r.key(), ts)) {
                lateRows.onLateRow(operatorId, r, watermark);
                continue;
            }
            TreeMap<Long, ValueCounts> byTime = events.computeIfAbsent(r.key(), k -> new TreeMap<>());
            ValueCounts values = byTime.computeIfAbsent(ts, t -> new ValueCounts());
            values.add(r.value(), r.diff());
            if (values.isEmpty()) byTime.remove(ts);
            if (byTime.isEmpty()) events.remove(r.key());
            touched.add(r.key());
            if (r.diff() > 0) pendingMax = Math.max(pendingMax, ts);
        }
    }

    private boolean late(String key, long ts) {
        if (watermark == NO_WATERMARK) return false;
        if (spec.policy().firstEnd(ts) + lateness.allowedLateness(key) <= watermark) return true;
        TreeSet<Window> closed = sealed.get(key);
        if (closed == null) return false;
        for (Window w : closed) {
            if (spec.policy().reaches(ts, w)) return true;
        }
        return false;
    }

    @Override
    public void advanceFrontier(long epoch, Emitter out) {
        long previous = watermark;
        if (pendingMax > watermark) watermark = pendingMax;
        pendingMax = NO_WATERMARK;
        if (watermark == NO_WATERMARK) {
            touched.clear();
            return;
        }

        Set<String> keys = new TreeSet<>(touched);
        if (watermark != previous) {
            keys.addAll(events.keySet());
            keys.addAll(emitted.keySet());
            keys.addAll(sealed.keySet());
        }
        for (String key : keys) {
            refresh(key, previous, epoch, out);
        }
        touched.clear();
    }

    private void refresh(String key, long previous, long epoch, Emitter out) {
        long allowed = lateness.allowedLateness(key);
        TreeMap<Long, ValueCounts> byTime = events.getOrDefault(key, new TreeMap<>());
        TreeMap<Window, Value> before = emitted.getOrDefault(key, new TreeMap<>());
        TreeMap<Window, Value> after = new TreeMap<>();

        List<Window> windows = spec.policy().windows(byTime.navigableKeySet());
        for (Window w : windows) {
            if (w.end() > watermark) continue; // not complete yet
            if (previous != NO_WATERMARK && w.end() + allowed <= previous) continue; // sealed earlier
            Reducer.Accumulator acc = spec.reducer().create();
            for (var e : byTime.subMap(w.start(), true, w.end(), false).entrySet()) {
                for (var v : e.getValue().asMap().entrySet()) acc.add(v.getKey(), v.getValue());
            }
            if (acc.negative()) {
                throw new StateException("negative multiplicity in window " + w + " of key '" + key + "'",
                        operatorId, epoch);
            }
            if (acc.count() > 0) after.put(w, acc.result());
        }

        for (var e : before.entrySet()) {
            if (!Objects.equals(e.getValue(), after.get(e.getKey()))) {
                out.emit(Row.retract(key, e.getKey().withAggregate(e.getValue()), epoch));
            }
        }
        for (var e : after.entrySet()) {
            if (!Objects.equals(e.getValue(), before.get(e.getKey()))) {
                out.emit(Row.insert(key, e.getKey().withAggregate(e.getValue()), epoch));
            }
        }

        // seal: forget emitted results and events no open window still needs
        after.keySet().removeIf(w -> w.end() + allowed <= watermark);
        if (after.isEmpty()) emitted.remove(key); else emitted.put(key, after);

        TreeSet<Window> closed = sealed.getOrDefault(key, new TreeSet<>());
        for (Window w : windows) {
            if (w.end() + allowed <= watermark) closed.add(w);
        }
        // firstEnd grows with ts and a reaching row has ts < end
        closed.removeIf(w -> spec.policy().firstEnd(w.end()) + allowed <= watermark);
        if (closed.isEmpty()) sealed.remove(key); else sealed.put(key, closed);

        List<Long> drop = new ArrayList<>();
        for (long ts : byTime.keySet()) {
            boolean needed = false;
            for (Window w : windows) {
                if (w.contains(ts) && w.end() + allowed > watermark) {
                    needed = true;
                    break;
                }
            }
            if (!needed) drop.add(ts);
        }
        for (long ts : drop) byTime.remove(ts);
        if (byTime.isEmpty()) events.remove(key);
    }

    @Override
    public StateImage snapshot() {
        List<Row> ev = new ArrayList<>();
        for (var k : events.entrySet()) {
            for (var t : k.getValue().entrySet()) {
                for (var v : t.getValue().asMap().entrySet()) {
                    ev.add(new Row(k.getKey(), Value.tuple(Value.of(t.getKey()), v.getKey()), 0, v.getValue()));
                }
            }
        }
        List<Row> em = new ArrayList<>();
        for (var k : emitted.entrySet()) {
            for (var w : k.getValue().entrySet()) {
                em.add(Row.insert(k.getKey(), w.getKey().withAggregate(w.getValue()), 0));
            }
        }
        List<Row> closed = new ArrayList<>();
        for (var k : sealed.entrySet()) {
            for (Window w : k.getValue()) {
                closed.add(Row.insert(k.getKey(), Value.tuple(Value.of(w.start()), Value.of(w.end())), 0));
            }
        }
        List<Row> meta = new ArrayList<>();
        if (watermark != NO_WATERMARK) meta.add(Row.insert("watermark", Value.of(watermark), 0));
        return StateImage.builder().section("events", ev).section("emitted", em).section("sealed", closed)
                .section("meta", meta).build();
    }

    @Override
    public void restore(StateImage image) {
        events.clear();
        emitted.clear();
        sealed.clear();
        watermark = NO_WATERMARK;
        for (Row r : image.section("events")) {
            events.computeIfAbsent(r.key(), k -> new TreeMap<>())
                    .computeIfAbsent(r.value().get(0).asLong(), t -> new ValueCounts())
                    .add(r.value().get(1), r.diff());
        }
        for (Row r : image.section("emitted")) {
            Window w = new Window(r.value().get(0).asLong(), r.value().get(1).asLong());
            emitted.computeIfAbsent(r.key(), k -> new TreeMap<>()).put(w, r.value().get(2));
        }
        for (Row r : image.section("sealed")) {
            sealed.computeIfAbsent(r.key(), k -> new TreeSet<>())
                    .add(new Window(r.value().get(0).asLong(), r.value().get(1).asLong()));
        }
        for (Row r : image.section("meta")) {
            if (r.key().equals("watermark")) watermark = r.value().asLong();
        }
    }
}
