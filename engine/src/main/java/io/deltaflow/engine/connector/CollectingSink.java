package io.deltaflow.engine.connector;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.Row;
import io.deltaflow.core.Value;
import io.deltaflow.core.state.ZSet;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Materializing sink: keeps the accumulated contents of its collection
 * and every delivered epoch. Thread safe; readers see whole epochs only.
 */
public final class CollectingSink implements SinkConnector {
    private final ZSet contents = new ZSet();
    private final List<DeltaBatch> deliveries = new ArrayList<>();
    private long lastEpoch = -1;

    @Override
    public synchronized void write(long epoch, DeltaBatch batch) {
        if (epoch <= lastEpoch) {
            throw new IllegalStateException("epoch " + epoch + " delivered after " + lastEpoch);
        }
        contents.apply(batch);
        deliveries.add(batch);
        lastEpoch = epoch;
        notifyAll();
    }

    /** Last delivered epoch, or -1. */
    public synchronized long lastEpoch() {
        return lastEpoch;
    }

    public synchronized List<DeltaBatch> deliveries() {
        return List.copyOf(deliveries);
    }

    /** Current multiset of one key. */
    public synchronized Map<Value, Long> values(String key) {
        return Map.copyOf(contents.values(key));
    }

    /** The only value of a key, or null if the key is absent. */
    public synchronized Value value(String key) {
        Map<Value, Long> v = contents.values(key);
        if (v.isEmpty()) return null;
        if (v.size() != 1) throw new IllegalStateException("key " + key + " holds " + v);
        return v.keySet().iterator().next();
    }

    /** Whole collection as rows (diff = multiplicity), sorted. */
    public synchronized List<Row> rows() {
        return contents.toRows(Math.max(lastEpoch, 0));
    }

    /** Block until {@code epoch} was delivered. */
    public synchronized boolean awaitEpoch(long epoch, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (lastEpoch < epoch) {
            long left = deadline - System.nanoTime();
            if (left <= 0) return false;
            wait(Math.max(1, left / 1_000_000));
        }
        return true;
    }
}
