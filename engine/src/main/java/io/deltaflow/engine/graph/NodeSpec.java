package io.deltaflow.engine.graph;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One node of a dataflow description.
 *
 * @param id     unique id within its graph; also names snapshot directories
 * @param kind   operator kind
 * @param inputs ids of input nodes, in port order
 * @param params kind-specific parameters (user functions, reducer, window spec, iterate body)
 */
public record NodeSpec(String id, NodeKind kind, List<String> inputs, Map<String, Object> params) {

    public NodeSpec {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        inputs = List.copyOf(inputs);
        params = Map.copyOf(params);
    }

    /**
     * Required parameter of the given type.
     *
     * @throws GraphValidationException if missing or of another type
     */
    public <T> T param(String name, Class<T> type) {
        Object v = params.get(name);
        if (v == null) {
            throw new GraphValidationException("node " + id + " (" + kind + ") is missing parameter '" + name + "'");
        }
        if (!type.isInstance(v)) {
            throw new GraphValidationException("node " + id + " parameter '" + name + "' must be a "
                    + type.getSimpleName() + " but is " + v.getClass().getSimpleName());
        }
        return type.cast(v);
    }

    /** Optional parameter; {@code fallback} if absent. */
    public <T> T param(String name, Class<T> type, T fallback) {
        return params.containsKey(name) ? param(name, type) : fallback;
    }
}
