package io.deltaflow.core;

import java.util.Objects;

/**
 * The (key, value) part of a row, as seen by user functions.
 * Epoch and multiplicity are carried by the engine around the function call.
 */
public record KeyedValue(String key, Value value) {
    public KeyedValue {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public static KeyedValue of(String key, long value) {
        return new KeyedValue(key, Value.of(value));
    }
}
