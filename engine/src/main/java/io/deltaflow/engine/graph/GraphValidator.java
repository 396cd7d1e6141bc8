package io.deltaflow.engine.graph;

import io.deltaflow.engine.operator.Reducer;
import io.deltaflow.engine.operator.WindowSpec;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural checks run before a graph is executed.
 * <p>
 * Top-level graph:
 *  - node ids are unique and match [A-Za-z0-9_.-]+ (they name snapshot directories);
 *  - every input exists and every node has the arity of its kind;
 *  - at least one source and one sink; sinks feed nothing;
 *  - no cycles (iteration only happens inside ITERATE bodies);
 *  - kind-specific parameters are present and typed.
 * <p>
 * ITERATE bodies are validated recursively: exactly one ITERATION_INPUT, no
 * sources or sinks, and exactly one node nobody consumes (the body output).
 */
public final class GraphValidator {
    private static final Pattern ID = Pattern.compile("[A-Za-z0-9_.-]+");

    private GraphValidator() {
        // utility
    }

    /** @throws GraphValidationException describing the first problem found */
    public static void validate(GraphSpec graph) {
        checkNodes(graph, false);
        if (graph.ofKind(NodeKind.SOURCE).isEmpty()) throw new GraphValidationException("graph has no source");
        if (graph.ofKind(NodeKind.SINK).isEmpty()) throw new GraphValidationException("graph has no sink");
        if (!graph.ofKind(NodeKind.ITERATION_INPUT).isEmpty()) {
            throw new GraphValidationException("iteration_input is only allowed inside an iterate body");
        }
        for (NodeSpec sink : graph.ofKind(NodeKind.SINK)) {
            if (!graph.consumersOf(sink.id()).isEmpty()) {
                throw new GraphValidationException("sink " + sink.id() + " must not feed other nodes");
            }
        }
    }

    static void validateBody(String iterateId, GraphSpec body) {
        checkNodes(body, true);
        List<NodeSpec> inputs = body.ofKind(NodeKind.ITERATION_INPUT);
        if (inputs.size() != 1) {
            throw new GraphValidationException("iterate " + iterateId + " body needs exactly one iteration_input, found "
                    + inputs.size());
        }
        if (!body.ofKind(NodeKind.SOURCE).isEmpty() || !body.ofKind(NodeKind.SINK).isEmpty()) {
            throw new GraphValidationException("iterate " + iterateId + " body must not contain sources or sinks");
        }
        long outputs = body.nodes().stream().filter(n -> body.consumersOf(n.id()).isEmpty()).count();
        if (outputs != 1) {
            throw new GraphValidationException("iterate " + iterateId + " body needs exactly one output node, found "
                    + outputs);
        }
    }

    private static void checkNodes(GraphSpec graph, boolean nested) {
        for (NodeSpec n : graph.nodes()) {
            if (!ID.matcher(n.id()).matches()) {
                throw new GraphValidationException("invalid node id '" + n.id() + "'");
            }
            int arity = n.inputs().size();
            if (arity < n.kind().minInputs() || arity > n.kind().maxInputs()) {
                throw new GraphValidationException("node " + n.id() + " (" + n.kind() + ") takes "
                        + describeArity(n.kind()) + " input(s), got " + arity);
            }
            for (String in : n.inputs()) {
                if (!graph.contains(in)) {
                    throw new GraphValidationException("node " + n.id() + " reads unknown input " + in);
                }
            }
            checkParams(n);
        }
        graph.topologicalOrder(); // cycle check
    }

    private static void checkParams(NodeSpec n) {
        switch (n.kind()) {
            case MAP -> n.param(Params.FN, Params.MapFn.class);
            case FLAT_MAP -> n.param(Params.FN, Params.FlatMapFn.class);
            case FILTER -> n.param(Params.PREDICATE, Params.FilterFn.class);
            case KEY_BY -> n.param(Params.KEY_FN, Params.KeyFn.class);
            case REDUCE -> n.param(Params.REDUCER, Reducer.class);
            case WINDOW -> n.param(Params.WINDOW, WindowSpec.class);
            case ITERATE -> {
                Integer max = n.param(Params.MAX_ITERATIONS, Integer.class, null);
                if (max != null && max <= 0) {
                    throw new GraphValidationException("iterate " + n.id() + " maxIterations must be > 0");
                }
                validateBody(n.id(), n.param(Params.BODY, GraphSpec.class));
            }
            default -> {
                // no parameters
            }
        }
    }

    private static String describeArity(NodeKind kind) {
        if (kind.minInputs() == kind.maxInputs()) return Integer.toString(kind.minInputs());
        if (kind.maxInputs() == Integer.MAX_VALUE) return "at least " + kind.minInputs();
        return kind.minInputs() + ".." + kind.maxInputs();
    }
}
