package io.deltaflow.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @TempDir
    Path dir;

    private Path write(String json) throws Exception {
        Path p = dir.resolve("engine.json");
        Files.writeString(p, json);
        return p;
    }

    @Test
    void absent_fields_keep_their_defaults() throws Exception {
        EngineConfig cfg = EngineConfig.fromJsonFile(write("{\"dataDir\": \"./data\", \"shards\": 8, \"lateRows\": \"fail\"}"));

        assertEquals(Path.of("./data"), cfg.dataDir());
        assertEquals(8, cfg.shards());
        assertEquals(LateRowPolicy.FAIL, cfg.lateRows());

        EngineConfig d = EngineConfig.defaults(Path.of("./data"));
        assertEquals(d.queueCapacity(), cfg.queueCapacity());
        assertEquals(d.snapshotEveryEpochs(), cfg.snapshotEveryEpochs());
        assertEquals(0, cfg.allowedLateness());
        assertEquals(-1, cfg.adminPort());
    }

    @Test
    void data_dir_is_required() throws Exception {
        Path p = write("{\"shards\": 2}");
        var e = assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJsonFile(p));
        assertTrue(e.getMessage().contains("dataDir"));
    }

    @Test
    void out_of_range_values_are_rejected() throws Exception {
        Path p = write("{\"dataDir\": \"d\", \"shards\": 0}");
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJsonFile(p));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.defaults(dir).withAllowedLateness(-1));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.defaults(dir).withAdminPort(70000));
    }

    @Test
    void unreadable_file_names_the_path() throws Exception {
        Path p = write("{\"dataDir\": \"d\", \"shardz\": 3}");
        var e = assertThrows(RuntimeException.class, () -> EngineConfig.fromJsonFile(p));
        assertTrue(e.getMessage().contains(p.toString()));
    }

    @Test
    void connector_retry_follows_the_configured_attempts() {
        var retry = EngineConfig.defaults(dir).withConnectorRetry(7, 10).connectorRetry();
        assertEquals(7, retry.maxAttempts());
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.defaults(dir).withConnectorRetry(0, 10));
    }
}
