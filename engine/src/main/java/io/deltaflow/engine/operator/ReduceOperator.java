package io.deltaflow.engine.operator;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.Row;
import io.deltaflow.core.StateException;
import io.deltaflow.core.Value;
import io.deltaflow.core.state.StateImage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Group-by-key aggregation.
 * <p>
 * Deltas only update per-key accumulators; the keys they touch are remembered
 * and at the end of the epoch each touched key emits at most one retraction of
 * its previous aggregate and one insertion of the new one. Inserts and
 * retractions inside an epoch therefore never show up as intermediate results,
 * and their order does not matter.
 */
final class ReduceOperator implements Operator {
    private final String operatorId;
    private final Reducer reducer;
    private final Map<String, Reducer.Accumulator> groups = new HashMap<>();
    private final Map<String, Value> emitted = new HashMap<>();
    private final TreeSet<String> touched = new TreeSet<>();

    ReduceOperator(String operatorId, Reducer reducer) {
        this.operatorId = operatorId;
        this.reducer = reducer;
    }

    @Override
    public void applyDelta(int port, DeltaBatch batch, Emitter out) {
        for (Row r : batch.rows()) {
            groups.computeIfAbsent(r.key(), k -> reducer.create()).add(r.value(), r.diff());
            touched.add(r.key());
        }
    }

    @Override
    public void advanceFrontier(long epoch, Emitter out) {
        for (String key : touched) {
            Reducer.Accumulator acc = groups.get(key);
            if (acc.negative()) {
                throw new StateException("negative multiplicity in group '" + key + "' of " + reducer.name(),
                        operatorId, epoch);
            }
            Value now = acc.count() > 0 ? acc.result() : null;
            if (acc.count() == 0) groups.remove(key);
            Value before = emitted.get(key);
            if (Objects.equals(before, now)) continue;
            if (before != null) out.emit(Row.retract(key, before, epoch));
            if (now != null) {
                out.emit(Row.insert(key, now, epoch));
                emitted.put(key, now);
            } else {
                emitted.remove(key);
            }
        }
        touched.clear();
    }

    @Override
    public StateImage snapshot() {
        List<Row> accs = new ArrayList<>(groups.size());
        for (var e : groups.entrySet()) accs.add(Row.insert(e.getKey(), e.getValue().save(), 0));
        List<Row> out = new ArrayList<>(emitted.size());
        for (var e : emitted.entrySet()) out.add(Row.insert(e.getKey(), e.getValue(), 0));
        return StateImage.builder().section("groups", accs).section("emitted", out).build();
    }

    @Override
    public void restore(StateImage image) {
        groups.clear();
        emitted.clear();
        for (Row r : image.section("groups")) groups.put(r.key(), reducer.restore(r.value()));
        for (Row r : image.section("emitted")) emitted.put(r.key(), r.value());
    }
}
