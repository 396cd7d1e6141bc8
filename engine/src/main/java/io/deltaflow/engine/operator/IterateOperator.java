package io.deltaflow.engine.operator;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.NonConvergenceException;
import io.deltaflow.core.Row;
import io.deltaflow.core.Value;
import io.deltaflow.core.state.StateImage;
import io.deltaflow.core.state.ZSet;
import io.deltaflow.core.time.IterationTime;
import io.deltaflow.engine.graph.GraphSpec;
import io.deltaflow.engine.graph.NodeKind;
import io.deltaflow.engine.graph.NodeSpec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixpoint scope: iterates a body graph f until its output equals its input.
 * <p>
 * The result for an input collection X is the limit of x0 = X, x(i+1) = f(x(i)),
 * the same collection a from-scratch recomputation would produce.
 * <p>
 * Incremental scheme, with I the body's accumulated input and B its
 * accumulated output (B = f(I) because the body is itself incremental):
 * <pre>
 *   feed = X - I
 *   while feed is not empty:
 *       push feed through the body at the next iteration time
 *       I += feed; B += body output
 *       feed = B - I
 * </pre>
 * The loop stops when B = I, i.e. f(I) = I. The operator emits the change of I
 * over the epoch. Body operators keep their state across epochs, so a small
 * input change costs only the iterations it actually disturbs.
 * <p>
 * Inside the scope, time is {@link IterationTime}(epoch, i). Body operators see
 * it flattened onto one increasing counter ("tick"), which is what their
 * epoch-ordered state needs.
 */
final class IterateOperator implements Operator {
    private static final Logger log = Logger.getLogger(IterateOperator.class.getName());

    private final String operatorId;
    private final int maxIterations;
    private final List<NodeSpec> order;
    private final Map<String, Operator> body = new LinkedHashMap<>();
    private final String inputId;
    private final String outputId;

    private final ZSet input = new ZSet();
    private final ZSet bodyIn = new ZSet();
    private final ZSet bodyOut = new ZSet();
    private long tick;
    private boolean changed;

    IterateOperator(String operatorId, GraphSpec bodySpec, int maxIterations, OperatorContext ctx) {
        this.operatorId = operatorId;
        this.maxIterations = maxIterations;
        this.order = bodySpec.topologicalOrder();
        this.inputId = bodySpec.ofKind(NodeKind.ITERATION_INPUT).get(0).id();
        String out = null;
        for (NodeSpec n : order) {
            body.put(n.id(), Operators.create(n, ctx.nested(n.id())));
            if (bodySpec.consumersOf(n.id()).isEmpty()) out = n.id();
        }
        this.outputId = out;
    }

    @Override
    public void applyDelta(int port, DeltaBatch batch, Emitter out) {
        input.apply(batch);
        changed |= !batch.isEmpty();
    }

    @Override
    public void advanceFrontier(long epoch, Emitter out) {
        if (!changed) return;
        changed = false;

        ZSet change = new ZSet();
        IterationTime time = IterationTime.start(epoch);
        List<Row> feed = ZSet.difference(input, bodyIn, tick);
        while (!feed.isEmpty()) {
            if (time.iteration() >= maxIterations) {
                throw new NonConvergenceException(operatorId, epoch, time.iteration());
            }
            for (Row r : feed) {
                bodyIn.apply(r);
                change.apply(r);
            }
            for (Row r : runBody(new DeltaBatch(tick, feed))) bodyOut.apply(r);
            tick++;
            time = time.next();
            feed = ZSet.difference(bodyOut, bodyIn, tick);
        }
        log.log(Level.FINE, "{0} reached fixpoint at {1}", new Object[]{operatorId, time});
        for (Operator op : body.values()) op.compact(tick - 1);
        for (Row r : change.toRows(epoch)) out.emit(r);
    }

    /** One pass of {@code feed} through the body; returns the output node's rows. */
    private List<Row> runBody(DeltaBatch feed) {
        Map<String, List<Row>> produced = new HashMap<>();
        for (NodeSpec n : order) {
            if (n.id().equals(inputId)) {
                produced.put(n.id(), feed.rows());
                continue;
            }
            Operator op = body.get(n.id());
            List<Row> emitted = new ArrayList<>();
            for (int port = 0; port < n.inputs().size(); port++) {
                List<Row> in = produced.get(n.inputs().get(port));
                if (!in.isEmpty()) op.applyDelta(port, new DeltaBatch(feed.epoch(), in), emitted::add);
            }
            op.advanceFrontier(feed.epoch(), emitted::add);
            produced.put(n.id(), emitted);
        }
        return produced.get(outputId);
    }

    @Override
    public StateImage snapshot() {
        StateImage.Builder b = StateImage.builder()
                .section("input", input.toRows(0))
                .section("bodyIn", bodyIn.toRows(0))
                .section("bodyOut", bodyOut.toRows(0))
                .section("meta", List.of(Row.insert("tick", Value.of(tick), 0)));
        for (var e : body.entrySet()) b.nest("body." + e.getKey(), e.getValue().snapshot());
        return b.build();
    }

    @Override
    public void restore(StateImage image) {
        input.clear();
        bodyIn.clear();
        bodyOut.clear();
        for (Row r : image.section("input")) input.apply(r);
        for (Row r : image.section("bodyIn")) bodyIn.apply(r);
        for (Row r : image.section("bodyOut")) bodyOut.apply(r);
        for (Row r : image.section("meta")) {
            if (r.key().equals("tick")) tick = r.value().asLong();
        }
        for (var e : body.entrySet()) e.getValue().restore(image.nested("body." + e.getKey()));
    }
}
