package io.deltaflow.storage;

import java.util.Map;
import java.util.Objects;

/**
 * Marker of a complete snapshot, stored as JSON next to the images.
 *
 * @param epoch        closed epoch the images reflect
 * @param lastSequence highest WAL sequence the images reflect, or -1
 * @param shards       operator id -> number of shard images
 * @param createdAtMillis wall-clock creation time, informational
 */
public record SnapshotManifest(long epoch, long lastSequence, Map<String, Integer> shards, long createdAtMillis) {
    public SnapshotManifest {
        if (epoch < 0) throw new IllegalArgumentException("epoch must be >= 0");
        shards = Map.copyOf(Objects.requireNonNull(shards, "shards"));
    }
}
