package io.deltaflow.engine.operator;

/**
 * How long after a window completes it still accepts corrections, in event-time units.
 * A window [start, end) completes when the watermark reaches {@code end} and is
 * sealed once the watermark reaches {@code end + allowedLateness(key)}.
 */
@FunctionalInterface
public interface LatenessPolicy {

    long allowedLateness(String key);

    static LatenessPolicy fixed(long lateness) {
        if (lateness < 0) throw new IllegalArgumentException("lateness must be >= 0");
        return key -> lateness;
    }
}
