package io.deltaflow.engine.operator;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.Row;
import io.deltaflow.core.Value;
import io.deltaflow.core.state.ArrangedIndex;
import io.deltaflow.core.state.StateImage;

import java.util.List;

/**
 * Symmetric incremental inner join on the row key.
 * <p>
 * A delta on one side at epoch e is probed against the other side's index;
 * each match yields (key, (left, right)) at epoch e with diff = product of
 * the two diffs. The delta is then merged into its own side's index.
 * Because probing happens before inserting, a pair of rows arriving in the
 * same epoch is joined exactly once whichever side comes first.
 */
final class JoinOperator implements Operator {
    static final int LEFT = 0;
    static final int RIGHT = 1;

    private final ArrangedIndex left = new ArrangedIndex();
    private final ArrangedIndex right = new ArrangedIndex();

    @Override
    public void applyDelta(int port, DeltaBatch batch, Emitter out) {
        ArrangedIndex own = port == LEFT ? left : right;
        ArrangedIndex other = port == LEFT ? right : left;
        for (Row r : batch.rows()) {
            for (ArrangedIndex.Entry match : other.probe(r.key())) {
                Value joined = port == LEFT
                        ? Value.tuple(r.value(), match.value())
                        : Value.tuple(match.value(), r.value());
                out.emit(new Row(r.key(), joined, batch.epoch(), r.diff() * match.diff()));
            }
            own.insert(r);
        }
    }

    @Override
    public void advanceFrontier(long epoch, Emitter out) {
        // products are emitted as deltas arrive
    }

    @Override
    public void compact(long through) {
        left.compact(through);
        right.compact(through);
    }

    @Override
    public StateImage snapshot() {
        return StateImage.builder()
                .section("left", left.toRows())
                .section("right", right.toRows())
                .section("meta", List.of(Row.insert("compactedThrough", Value.of(left.compactedThrough()), 0)))
                .build();
    }

    @Override
    public void restore(StateImage image) {
        long compacted = -1;
        for (Row r : image.section("meta")) {
            if (r.key().equals("compactedThrough")) compacted = r.value().asLong();
        }
        left.restore(image.section("left"), compacted);
        right.restore(image.section("right"), compacted);
    }
}
