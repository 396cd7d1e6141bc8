package io.deltaflow.engine.graph;

/**
 * Kinds of dataflow nodes. Each kind fixes how many inputs a node takes and
 * whether its state is partitioned by key across shards.
 */
public enum NodeKind {
    SOURCE(0, 0, false),
    ITERATION_INPUT(0, 0, false),
    MAP(1, 1, true),
    FILTER(1, 1, true),
    FLAT_MAP(1, 1, true),
    KEY_BY(1, 1, true),
    CONCAT(1, Integer.MAX_VALUE, true),
    JOIN(2, 2, true),
    REDUCE(1, 1, true),
    COUNT(1, 1, true),
    DISTINCT(1, 1, true),
    WINDOW(1, 1, true),
    ITERATE(1, 1, false),
    SINK(1, 1, false);

    private final int minInputs;
    private final int maxInputs;
    private final boolean sharded;

    NodeKind(int minInputs, int maxInputs, boolean sharded) {
        this.minInputs = minInputs;
        this.maxInputs = maxInputs;
        this.sharded = sharded;
    }

    public int minInputs() {
        return minInputs;
    }

    public int maxInputs() {
        return maxInputs;
    }

    /** True if the node runs one instance per shard, rows routed by key hash. */
    public boolean sharded() {
        return sharded;
    }

    public boolean stateful() {
        return this == JOIN || this == REDUCE || this == COUNT || this == DISTINCT
                || this == WINDOW || this == ITERATE;
    }
}
