package io.deltaflow.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileEpochStoreTest {

    @TempDir Path dir;

    @Test
    void fresh_store_starts_at_initial_metadata() {
        var store = new FileEpochStore(dir.resolve("epochs.json"));
        assertEquals(EpochMetadata.INITIAL, store.load());
    }

    @Test
    void updates_survive_reopen() {
        Path file = dir.resolve("epochs.json");
        var store = new FileEpochStore(file);
        store.update(m -> m.withNextEpoch(4).withCommitted(3).withNextSequence(12));
        store.update(m -> m.withSinkAck("out", 3));

        EpochMetadata loaded = new FileEpochStore(file).load();
        assertEquals(new EpochMetadata(4, 3, 12, Map.of("out", 3L)), loaded);
        assertEquals(3, loaded.ackedBy("out"));
        assertEquals(-1, loaded.ackedBy("other"));
    }

    @Test
    void epochs_and_acks_never_move_backwards() {
        var store = new FileEpochStore(dir.resolve("epochs.json"));
        store.update(m -> m.withNextEpoch(5).withCommitted(4).withSinkAck("out", 4));
        EpochMetadata m = store.update(x -> x.withNextEpoch(2).withCommitted(1).withSinkAck("out", 1));

        assertEquals(5, m.nextEpoch());
        assertEquals(4, m.committedEpoch());
        assertEquals(4, m.ackedBy("out"));
    }
}
