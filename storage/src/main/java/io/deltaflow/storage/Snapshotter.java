package io.deltaflow.storage;

import io.deltaflow.core.state.StateImage;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is one {@link StateImage} per operator shard, all taken at the
 * same closed epoch, plus a manifest written after every image (and every
 * sink acknowledgement) for that epoch is durable. Only epochs with a manifest
 * count as snapshots. On restart:
 *  - we load the latest manifest and every image it names, then
 *  - replay WAL records with a later epoch.
 */
public interface Snapshotter {

    /**
     * Persist one shard image. Images are write-once: a second write for the
     * same (operator, shard, epoch) keeps the first.
     */
    void writeImage(String operatorId, int shard, long epoch, StateImage image);

    /** Load an image, or empty if it was never written. */
    Optional<StateImage> readImage(String operatorId, int shard, long epoch);

    /** Mark the snapshot at {@code manifest.epoch()} complete. */
    void writeManifest(SnapshotManifest manifest);

    /** Latest complete snapshot, if any. */
    Optional<SnapshotManifest> latestManifest();

    /** Epochs of all complete snapshots, oldest first. */
    List<Long> manifestEpochs();

    /**
     * Delete manifests and images older than {@code epoch}.
     *
     * @return number of files deleted
     */
    int deleteBefore(long epoch);
}
