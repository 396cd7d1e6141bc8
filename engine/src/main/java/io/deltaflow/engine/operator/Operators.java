package io.deltaflow.engine.operator;

import io.deltaflow.engine.graph.GraphSpec;
import io.deltaflow.engine.graph.NodeSpec;
import io.deltaflow.engine.graph.Params;

/**
 * Creates the operator instance for a node. One call per shard: instances are
 * never shared between threads.
 */
public final class Operators {

    private Operators() {
        // factory
    }

    public static Operator create(NodeSpec node, OperatorContext ctx) {
        String id = ctx.operatorId();
        switch (node.kind()) {
            case SOURCE:
            case ITERATION_INPUT:
            case CONCAT:
                return new PassThroughOperator();
            case MAP:
                return new MapOperator(node.param(Params.FN, Params.MapFn.class));
            case FILTER:
                return new FilterOperator(node.param(Params.PREDICATE, Params.FilterFn.class));
            case FLAT_MAP:
                return new FlatMapOperator(node.param(Params.FN, Params.FlatMapFn.class));
            case KEY_BY:
                return new KeyByOperator(node.param(Params.KEY_FN, Params.KeyFn.class));
            case JOIN:
                return new JoinOperator();
            case REDUCE:
                return new ReduceOperator(id, node.param(Params.REDUCER, Reducer.class));
            case COUNT:
                return new ReduceOperator(id, Reducers.count());
            case DISTINCT:
                return new DistinctOperator(id);
            case WINDOW:
                return new WindowOperator(id, node.param(Params.WINDOW, WindowSpec.class),
                        LatenessPolicy.fixed(ctx.allowedLateness()), ctx.lateRows());
            case ITERATE:
                return new IterateOperator(id, node.param(Params.BODY, GraphSpec.class),
                        node.param(Params.MAX_ITERATIONS, Integer.class, ctx.maxIterations()), ctx);
            default:
                throw new IllegalArgumentException("no operator for node kind " + node.kind());
        }
    }
}
