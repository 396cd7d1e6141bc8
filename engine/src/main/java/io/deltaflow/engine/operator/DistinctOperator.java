package io.deltaflow.engine.operator;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.KeyedValue;
import io.deltaflow.core.Row;
import io.deltaflow.core.StateException;
import io.deltaflow.core.state.StateImage;
import io.deltaflow.core.state.ZSet;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Set semantics: every (key, value) with a positive count appears exactly once.
 * Presence changes are decided at the end of the epoch.
 */
final class DistinctOperator implements Operator {
    private final String operatorId;
    private final ZSet counts = new ZSet();
    // (key, value) -> present before this epoch
    private final Map<KeyedValue, Boolean> touched = new LinkedHashMap<>();

    DistinctOperator(String operatorId) {
        this.operatorId = operatorId;
    }

    @Override
    public void applyDelta(int port, DeltaBatch batch, Emitter out) {
        for (Row r : batch.rows()) {
            touched.putIfAbsent(r.keyedValue(), counts.count(r.key(), r.value()) > 0);
            counts.apply(r);
        }
    }

    @Override
    public void advanceFrontier(long epoch, Emitter out) {
        for (var e : touched.entrySet()) {
            KeyedValue kv = e.getKey();
            long now = counts.count(kv.key(), kv.value());
            if (now < 0) {
                throw new StateException("negative multiplicity for " + kv, operatorId, epoch);
            }
            boolean was = e.getValue();
            if (was && now == 0) out.emit(Row.retract(kv.key(), kv.value(), epoch));
            if (!was && now > 0) out.emit(Row.insert(kv.key(), kv.value(), epoch));
        }
        touched.clear();
    }

    @Override
    public StateImage snapshot() {
        return StateImage.builder().section("counts", counts.toRows(0)).build();
    }

    @Override
    public void restore(StateImage image) {
        counts.clear();
        for (Row r : image.section("counts")) counts.apply(r);
    }
}
