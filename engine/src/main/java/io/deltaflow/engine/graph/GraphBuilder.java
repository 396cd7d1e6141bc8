package io.deltaflow.engine.graph;

import io.deltaflow.core.KeyedValue;
import io.deltaflow.engine.operator.Reducer;
import io.deltaflow.engine.operator.WindowSpec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Fluent construction of a {@link GraphSpec}.
 * <pre>
 *   GraphSpec g = new GraphBuilder()
 *       .source("orders")
 *       .reduce("totals", "orders", Reducers.sum())
 *       .sink("out", "totals")
 *       .build();
 * </pre>
 */
public final class GraphBuilder {
    private final List<NodeSpec> nodes = new ArrayList<>();

    public GraphBuilder source(String id) {
        return add(id, NodeKind.SOURCE, List.of(), Map.of());
    }

    /** Entry point of an iterate body: the current iterate collection. */
    public GraphBuilder iterationInput(String id) {
        return add(id, NodeKind.ITERATION_INPUT, List.of(), Map.of());
    }

    public GraphBuilder map(String id, String input, Function<KeyedValue, KeyedValue> fn) {
        return add(id, NodeKind.MAP, List.of(input), Map.of(Params.FN, (Params.MapFn) fn::apply));
    }

    public GraphBuilder filter(String id, String input, Predicate<KeyedValue> predicate) {
        return add(id, NodeKind.FILTER, List.of(input),
                Map.of(Params.PREDICATE, (Params.FilterFn) predicate::test));
    }

    public GraphBuilder flatMap(String id, String input, Function<KeyedValue, List<KeyedValue>> fn) {
        return add(id, NodeKind.FLAT_MAP, List.of(input), Map.of(Params.FN, (Params.FlatMapFn) fn::apply));
    }

    public GraphBuilder keyBy(String id, String input, Function<KeyedValue, String> keyFn) {
        return add(id, NodeKind.KEY_BY, List.of(input), Map.of(Params.KEY_FN, (Params.KeyFn) keyFn::apply));
    }

    public GraphBuilder concat(String id, String... inputs) {
        return add(id, NodeKind.CONCAT, Arrays.asList(inputs), Map.of());
    }

    /** Inner join on the row key; output values are (left, right) tuples. */
    public GraphBuilder join(String id, String left, String right) {
        return add(id, NodeKind.JOIN, List.of(left, right), Map.of());
    }

    public GraphBuilder reduce(String id, String input, Reducer reducer) {
        return add(id, NodeKind.REDUCE, List.of(input), Map.of(Params.REDUCER, reducer));
    }

    /** Number of rows per key. */
    public GraphBuilder count(String id, String input) {
        return add(id, NodeKind.COUNT, List.of(input), Map.of());
    }

    public GraphBuilder distinct(String id, String input) {
        return add(id, NodeKind.DISTINCT, List.of(input), Map.of());
    }

    public GraphBuilder window(String id, String input, WindowSpec spec) {
        return add(id, NodeKind.WINDOW, List.of(input), Map.of(Params.WINDOW, spec));
    }

    public GraphBuilder iterate(String id, String input, GraphSpec body) {
        return add(id, NodeKind.ITERATE, List.of(input), Map.of(Params.BODY, body));
    }

    public GraphBuilder iterate(String id, String input, GraphSpec body, int maxIterations) {
        return add(id, NodeKind.ITERATE, List.of(input), Map.of(Params.BODY, body, Params.MAX_ITERATIONS, maxIterations));
    }

    public GraphBuilder sink(String id, String input) {
        return add(id, NodeKind.SINK, List.of(input), Map.of());
    }

    public GraphBuilder node(NodeSpec node) {
        nodes.add(node);
        return this;
    }

    /** Build and validate a top-level graph. */
    public GraphSpec build() {
        GraphSpec g = new GraphSpec(nodes);
        GraphValidator.validate(g);
        return g;
    }

    /** Build and validate an iterate body. */
    public GraphSpec buildBody() {
        GraphSpec g = new GraphSpec(nodes);
        GraphValidator.validateBody("body", g);
        return g;
    }

    private GraphBuilder add(String id, NodeKind kind, List<String> inputs, Map<String, Object> params) {
        nodes.add(new NodeSpec(id, kind, inputs, params));
        return this;
    }
}
