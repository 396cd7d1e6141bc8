package io.deltaflow.engine.graph;

import io.deltaflow.engine.operator.Reducers;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphValidatorTest {

    private static GraphValidationException invalid(GraphBuilder b) {
        return assertThrows(GraphValidationException.class, b::build);
    }

    @Test
    void valid_graph_is_ordered_inputs_first() {
        GraphSpec g = new GraphBuilder()
                .sink("out", "totals")
                .reduce("totals", "in", Reducers.sum())
                .source("in")
                .build();

        List<String> order = g.topologicalOrder().stream().map(NodeSpec::id).toList();
        assertEquals(List.of("in", "totals", "out"), order);
        assertEquals(1, g.consumersOf("in").size());
    }

    @Test
    void duplicate_ids_are_rejected() {
        var e = invalid(new GraphBuilder().source("in").map("in", "in", kv -> kv).sink("out", "in"));
        assertTrue(e.getMessage().contains("duplicate"), e.getMessage());
    }

    @Test
    void unknown_input_is_rejected() {
        var e = invalid(new GraphBuilder().source("in").sink("out", "missing"));
        assertTrue(e.getMessage().contains("unknown input missing"), e.getMessage());
    }

    @Test
    void graph_needs_a_source_and_a_sink() {
        assertTrue(invalid(new GraphBuilder().source("in").count("c", "in")).getMessage().contains("no sink"));
        assertTrue(invalid(new GraphBuilder().iterationInput("x").sink("out", "x")).getMessage().contains("no source"));
    }

    @Test
    void join_takes_exactly_two_inputs() {
        var g = new GraphBuilder()
                .source("a")
                .node(new NodeSpec("j", NodeKind.JOIN, List.of("a"), Map.of()))
                .sink("out", "j");
        assertTrue(invalid(g).getMessage().contains("takes 2 input(s), got 1"));
    }

    @Test
    void ids_must_be_usable_as_directory_names() {
        var e = invalid(new GraphBuilder().source("in/../x").sink("out", "in/../x"));
        assertTrue(e.getMessage().contains("invalid node id"));
    }

    @Test
    void sinks_feed_nothing() {
        var e = invalid(new GraphBuilder().source("in").sink("s1", "in").sink("s2", "s1"));
        assertTrue(e.getMessage().contains("must not feed"));
    }

    @Test
    void cycles_are_rejected_outside_iterate() {
        var g = new GraphBuilder()
                .source("in")
                .concat("a", "in", "b")
                .map("b", "a", kv -> kv)
                .sink("out", "b");
        assertTrue(invalid(g).getMessage().contains("cycle"));
    }

    @Test
    void iteration_input_only_inside_a_body() {
        var e = invalid(new GraphBuilder().source("in").iterationInput("loop").concat("c", "in", "loop").sink("out", "c"));
        assertTrue(e.getMessage().contains("iteration_input"));
    }

    @Test
    void missing_or_mistyped_parameter_is_rejected() {
        var g = new GraphBuilder()
                .source("in")
                .node(new NodeSpec("r", NodeKind.REDUCE, List.of("in"), Map.of(Params.REDUCER, "sum")))
                .sink("out", "r");
        assertTrue(invalid(g).getMessage().contains("must be a Reducer"));

        var noFn = new GraphBuilder()
                .source("in")
                .node(new NodeSpec("m", NodeKind.MAP, List.of("in"), Map.of()))
                .sink("out", "m");
        assertTrue(invalid(noFn).getMessage().contains("missing parameter 'fn'"));
    }

    @Test
    void function_of_another_node_kind_is_rejected() {
        Params.FlatMapFn expand = kv -> List.of(kv, kv);
        var g = new GraphBuilder()
                .source("in")
                .node(new NodeSpec("m", NodeKind.MAP, List.of("in"), Map.of(Params.FN, expand)))
                .sink("out", "m");
        assertTrue(invalid(g).getMessage().contains("must be a MapFn"), invalid(g).getMessage());

        var ok = new GraphBuilder()
                .source("in")
                .flatMap("f", "in", kv -> List.of(kv))
                .keyBy("k", "f", kv -> kv.key() + "!")
                .filter("p", "k", kv -> true)
                .map("m", "p", kv -> kv)
                .sink("out", "m")
                .build();
        assertEquals(6, ok.nodes().size());
    }

    @Test
    void iterate_body_is_validated() {
        GraphSpec twoOutputs = new GraphSpec(List.of(
                new NodeSpec("x", NodeKind.ITERATION_INPUT, List.of(), Map.of()),
                new NodeSpec("d1", NodeKind.DISTINCT, List.of("x"), Map.of()),
                new NodeSpec("d2", NodeKind.DISTINCT, List.of("x"), Map.of())));
        var e = invalid(new GraphBuilder().source("in").iterate("loop", "in", twoOutputs).sink("out", "loop"));
        assertTrue(e.getMessage().contains("exactly one output node"), e.getMessage());

        GraphSpec withSource = new GraphSpec(List.of(
                new NodeSpec("x", NodeKind.ITERATION_INPUT, List.of(), Map.of()),
                new NodeSpec("s", NodeKind.SOURCE, List.of(), Map.of()),
                new NodeSpec("c", NodeKind.CONCAT, List.of("x", "s"), Map.of())));
        e = invalid(new GraphBuilder().source("in").iterate("loop", "in", withSource).sink("out", "loop"));
        assertTrue(e.getMessage().contains("sources or sinks"), e.getMessage());
    }

    @Test
    void iterate_bound_must_be_positive() {
        GraphSpec body = new GraphBuilder().iterationInput("x").distinct("d", "x").buildBody();
        var e = invalid(new GraphBuilder().source("in").iterate("loop", "in", body, 0).sink("out", "loop"));
        assertTrue(e.getMessage().contains("maxIterations"));
    }
}
