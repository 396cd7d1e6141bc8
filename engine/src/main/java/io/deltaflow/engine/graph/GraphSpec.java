package io.deltaflow.engine.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated description of a dataflow: nodes keyed by id, kept in
 * declaration order. Construction does not validate; use {@link GraphValidator}
 * (or {@link GraphBuilder#build()}, which does).
 */
public final class GraphSpec {

    private final Map<String, NodeSpec> nodes = new LinkedHashMap<>();

    public GraphSpec(List<NodeSpec> nodes) {
        for (NodeSpec n : nodes) {
            if (this.nodes.putIfAbsent(n.id(), n) != null) {
                throw new GraphValidationException("duplicate node id: " + n.id());
            }
        }
    }

    public List<NodeSpec> nodes() {
        return List.copyOf(nodes.values());
    }

    public NodeSpec node(String id) {
        NodeSpec n = nodes.get(id);
        if (n == null) throw new GraphValidationException("unknown node: " + id);
        return n;
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public List<NodeSpec> ofKind(NodeKind kind) {
        List<NodeSpec> out = new ArrayList<>();
        for (NodeSpec n : nodes.values()) if (n.kind() == kind) out.add(n);
        return out;
    }

    /** Consumers of {@code id} with the port they read it on, in declaration order. */
    public List<Consumer> consumersOf(String id) {
        List<Consumer> out = new ArrayList<>();
        for (NodeSpec n : nodes.values()) {
            for (int port = 0; port < n.inputs().size(); port++) {
                if (n.inputs().get(port).equals(id)) out.add(new Consumer(n, port));
            }
        }
        return out;
    }

    /**
     * Nodes ordered so that every node comes after all of its inputs.
     *
     * @throws GraphValidationException on a cycle or an unknown input
     */
    public List<NodeSpec> topologicalOrder() {
        List<NodeSpec> out = new ArrayList<>(nodes.size());
        Map<String, Integer> state = new LinkedHashMap<>(); // 1 = visiting, 2 = done
        for (NodeSpec n : nodes.values()) visit(n, state, out);
        return out;
    }

    private void visit(NodeSpec n, Map<String, Integer> state, List<NodeSpec> out) {
        Integer s = state.get(n.id());
        if (s != null) {
            if (s == 1) throw new GraphValidationException("cycle through node " + n.id());
            return;
        }
        state.put(n.id(), 1);
        for (String in : n.inputs()) {
            if (!nodes.containsKey(in)) {
                throw new GraphValidationException("node " + n.id() + " reads unknown input " + in);
            }
            visit(nodes.get(in), state, out);
        }
        state.put(n.id(), 2);
        out.add(n);
    }

    /** A node reading another node's output on a given input port. */
    public record Consumer(NodeSpec node, int port) {}
}
