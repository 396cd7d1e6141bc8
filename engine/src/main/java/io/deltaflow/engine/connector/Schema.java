package io.deltaflow.engine.connector;

import io.deltaflow.core.SchemaException;
import io.deltaflow.core.Value;

import java.util.function.Predicate;

/**
 * Validation of ingested updates. A violation stops the offending source only.
 */
@FunctionalInterface
public interface Schema {

    /** @throws SchemaException if the update is not acceptable */
    void validate(String sourceId, Update update);

    /** Non-blank keys and values of the given type. */
    static Schema valuesOfType(Class<? extends Value> type) {
        return matching(type::isInstance, "value of type " + type.getSimpleName());
    }

    /** Non-blank keys and values accepted by {@code check}. */
    static Schema matching(Predicate<Value> check, String description) {
        return (sourceId, u) -> {
            if (u.key().isBlank()) throw new SchemaException(sourceId, "blank key in " + u);
            if (!check.test(u.value())) {
                throw new SchemaException(sourceId, "expected " + description + " but got " + u.value()
                        + " for key '" + u.key() + "'");
            }
        };
    }
}
