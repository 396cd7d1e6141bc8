package io.deltaflow.storage;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotPolicyTest {

    @Test
    void snapshots_every_nth_epoch() {
        var p = new SnapshotPolicy(3);
        assertFalse(p.isSnapshotEpoch(0));
        assertFalse(p.isSnapshotEpoch(1));
        assertTrue(p.isSnapshotEpoch(2));
        assertTrue(p.isSnapshotEpoch(5));
    }

    @Test
    void forced_epoch_is_snapshotted_off_interval() {
        var p = new SnapshotPolicy(100);
        p.force(7);
        assertTrue(p.isSnapshotEpoch(7));
        assertFalse(p.isSnapshotEpoch(8));
    }

    @Test
    void rejects_non_positive_interval() {
        assertThrows(IllegalArgumentException.class, () -> new SnapshotPolicy(0));
    }
}
