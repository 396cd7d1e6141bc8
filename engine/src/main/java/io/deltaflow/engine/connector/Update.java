package io.deltaflow.engine.connector;

import io.deltaflow.core.Row;
import io.deltaflow.core.Value;

import java.util.Objects;

/**
 * A change produced by a source, before the engine assigns its epoch.
 *
 * @param diff +1 insertion, -1 retraction (other non-zero values are multiplicities)
 */
public record Update(String key, Value value, long diff) {

    public Update {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (diff == 0) throw new IllegalArgumentException("diff must not be 0");
    }

    public static Update insert(String key, Value value) {
        return new Update(key, value, 1);
    }

    public static Update retract(String key, Value value) {
        return new Update(key, value, -1);
    }

    public Row atEpoch(long epoch) {
        return new Row(key, value, epoch, diff);
    }
}
