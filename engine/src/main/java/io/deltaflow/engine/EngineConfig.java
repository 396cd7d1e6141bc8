package io.deltaflow.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.deltaflow.engine.connector.RetryPolicy;
import io.deltaflow.engine.dto.JsonEngineConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Engine configuration.
 *
 * Fields:
 *  - dataDir:               root of the WAL, snapshots and epoch store
 *  - shards:                instances per key-sharded operator
 *  - queueCapacity:         messages per edge queue before producers block
 *  - walRotateBytes:        WAL segment size before rotation
 *  - snapshotEveryEpochs:   snapshot interval in closed epochs
 *  - retainedSnapshots:     complete snapshots kept on disk
 *  - compactionLag:         closed epochs kept uncompacted in operator history
 *  - maxIterations:         default bound for iterate nodes
 *  - allowedLateness:       default window lateness, in event-time units
 *  - lateRows:              handling of rows for sealed windows
 *  - adminPort:             admin HTTP port; 0 picks a free port, negative disables it
 *  - shutdownTimeoutMillis: bound for draining on shutdown
 *  - connectorMaxAttempts / connectorBackoffMillis: default retry for connectors
 */
public record EngineConfig(
        Path dataDir,
        int shards,
        int queueCapacity,
        long walRotateBytes,
        int snapshotEveryEpochs,
        int retainedSnapshots,
        long compactionLag,
        int maxIterations,
        long allowedLateness,
        LateRowPolicy lateRows,
        int adminPort,
        long shutdownTimeoutMillis,
        int connectorMaxAttempts,
        long connectorBackoffMillis
) {

    public EngineConfig {
        Objects.requireNonNull(dataDir, "dataDir");
        Objects.requireNonNull(lateRows, "lateRows");
        if (shards <= 0) throw new IllegalArgumentException("shards must be > 0");
        if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity must be > 0");
        if (walRotateBytes <= 0) throw new IllegalArgumentException("walRotateBytes must be > 0");
        if (snapshotEveryEpochs <= 0) throw new IllegalArgumentException("snapshotEveryEpochs must be > 0");
        if (retainedSnapshots <= 0) throw new IllegalArgumentException("retainedSnapshots must be > 0");
        if (compactionLag < 0) throw new IllegalArgumentException("compactionLag must be >= 0");
        if (maxIterations <= 0) throw new IllegalArgumentException("maxIterations must be > 0");
        if (allowedLateness < 0) throw new IllegalArgumentException("allowedLateness must be >= 0");
        if (adminPort > 65535) throw new IllegalArgumentException("adminPort out of range");
        if (shutdownTimeoutMillis <= 0) throw new IllegalArgumentException("shutdownTimeoutMillis must be > 0");
        if (connectorMaxAttempts <= 0) throw new IllegalArgumentException("connectorMaxAttempts must be > 0");
        if (connectorBackoffMillis < 0) throw new IllegalArgumentException("connectorBackoffMillis must be >= 0");
    }

    public static EngineConfig defaults(Path dataDir) {
        return new EngineConfig(dataDir, 4, 64, 64L * 1024 * 1024, 10, 2, 0, 1000, 0,
                LateRowPolicy.REPORT, -1, 30_000, 5, 50);
    }

    public static EngineConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonEngineConfig cfg = mapper.readValue(path.toFile(), JsonEngineConfig.class);
            if (cfg.dataDir == null || cfg.dataDir.isBlank()) {
                throw new IllegalArgumentException("dataDir is required");
            }
            EngineConfig d = defaults(Path.of(cfg.dataDir));
            return new EngineConfig(
                    d.dataDir(),
                    cfg.shards != null ? cfg.shards : d.shards(),
                    cfg.queueCapacity != null ? cfg.queueCapacity : d.queueCapacity(),
                    cfg.walRotateBytes != null ? cfg.walRotateBytes : d.walRotateBytes(),
                    cfg.snapshotEveryEpochs != null ? cfg.snapshotEveryEpochs : d.snapshotEveryEpochs(),
                    cfg.retainedSnapshots != null ? cfg.retainedSnapshots : d.retainedSnapshots(),
                    cfg.compactionLag != null ? cfg.compactionLag : d.compactionLag(),
                    cfg.maxIterations != null ? cfg.maxIterations : d.maxIterations(),
                    cfg.allowedLateness != null ? cfg.allowedLateness : d.allowedLateness(),
                    cfg.lateRows != null ? LateRowPolicy.valueOf(cfg.lateRows.toUpperCase(Locale.ROOT)) : d.lateRows(),
                    cfg.adminPort != null ? cfg.adminPort : d.adminPort(),
                    cfg.shutdownTimeoutMillis != null ? cfg.shutdownTimeoutMillis : d.shutdownTimeoutMillis(),
                    cfg.connectorMaxAttempts != null ? cfg.connectorMaxAttempts : d.connectorMaxAttempts(),
                    cfg.connectorBackoffMillis != null ? cfg.connectorBackoffMillis : d.connectorBackoffMillis()
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load EngineConfig from " + path, e);
        }
    }

    /** Default retry policy for connectors that do not bring their own. */
    public RetryPolicy connectorRetry() {
        Duration initial = Duration.ofMillis(connectorBackoffMillis);
        return new RetryPolicy(connectorMaxAttempts, initial, initial.multipliedBy(32));
    }

    public EngineConfig withShards(int v) {
        return new EngineConfig(dataDir, v, queueCapacity, walRotateBytes, snapshotEveryEpochs, retainedSnapshots,
                compactionLag, maxIterations, allowedLateness, lateRows, adminPort, shutdownTimeoutMillis,
                connectorMaxAttempts, connectorBackoffMillis);
    }

    public EngineConfig withQueueCapacity(int v) {
        return new EngineConfig(dataDir, shards, v, walRotateBytes, snapshotEveryEpochs, retainedSnapshots,
                compactionLag, maxIterations, allowedLateness, lateRows, adminPort, shutdownTimeoutMillis,
                connectorMaxAttempts, connectorBackoffMillis);
    }

    public EngineConfig withWalRotateBytes(long v) {
        return new EngineConfig(dataDir, shards, queueCapacity, v, snapshotEveryEpochs, retainedSnapshots,
                compactionLag, maxIterations, allowedLateness, lateRows, adminPort, shutdownTimeoutMillis,
                connectorMaxAttempts, connectorBackoffMillis);
    }

    public EngineConfig withSnapshotEveryEpochs(int v) {
        return new EngineConfig(dataDir, shards, queueCapacity, walRotateBytes, v, retainedSnapshots,
                compactionLag, maxIterations, allowedLateness, lateRows, adminPort, shutdownTimeoutMillis,
                connectorMaxAttempts, connectorBackoffMillis);
    }

    public EngineConfig withRetainedSnapshots(int v) {
        return new EngineConfig(dataDir, shards, queueCapacity, walRotateBytes, snapshotEveryEpochs, v,
                compactionLag, maxIterations, allowedLateness, lateRows, adminPort, shutdownTimeoutMillis,
                connectorMaxAttempts, connectorBackoffMillis);
    }

    public EngineConfig withMaxIterations(int v) {
        return new EngineConfig(dataDir, shards, queueCapacity, walRotateBytes, snapshotEveryEpochs,
                retainedSnapshots, compactionLag, v, allowedLateness, lateRows, adminPort, shutdownTimeoutMillis,
                connectorMaxAttempts, connectorBackoffMillis);
    }

    public EngineConfig withAllowedLateness(long v) {
        return new EngineConfig(dataDir, shards, queueCapacity, walRotateBytes, snapshotEveryEpochs,
                retainedSnapshots, compactionLag, maxIterations, v, lateRows, adminPort, shutdownTimeoutMillis,
                connectorMaxAttempts, connectorBackoffMillis);
    }

    public EngineConfig withLateRows(LateRowPolicy v) {
        return new EngineConfig(dataDir, shards, queueCapacity, walRotateBytes, snapshotEveryEpochs,
                retainedSnapshots, compactionLag, maxIterations, allowedLateness, v, adminPort,
                shutdownTimeoutMillis, connectorMaxAttempts, connectorBackoffMillis);
    }

    public EngineConfig withAdminPort(int v) {
        return new EngineConfig(dataDir, shards, queueCapacity, walRotateBytes, snapshotEveryEpochs,
                retainedSnapshots, compactionLag, maxIterations, allowedLateness, lateRows, v,
                shutdownTimeoutMillis, connectorMaxAttempts, connectorBackoffMillis);
    }

    public EngineConfig withConnectorRetry(int maxAttempts, long backoffMillis) {
        return new EngineConfig(dataDir, shards, queueCapacity, walRotateBytes, snapshotEveryEpochs,
                retainedSnapshots, compactionLag, maxIterations, allowedLateness, lateRows, adminPort,
                shutdownTimeoutMillis, maxAttempts, backoffMillis);
    }
}
