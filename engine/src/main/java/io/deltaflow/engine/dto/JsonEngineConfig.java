package io.deltaflow.engine.dto;

/**
 * JSON shape of an engine configuration file. Absent fields keep their defaults.
 * Example:
 *   {
 *     "dataDir": "./data",
 *     "shards": 4,
 *     "snapshotEveryEpochs": 10,
 *     "lateRows": "REPORT",
 *     "adminPort": 8080
 *   }
 */
public class JsonEngineConfig {
    public String dataDir;
    public Integer shards;
    public Integer queueCapacity;
    public Long walRotateBytes;
    public Integer snapshotEveryEpochs;
    public Integer retainedSnapshots;
    public Long compactionLag;
    public Integer maxIterations;
    public Long allowedLateness;
    public String lateRows;
    public Integer adminPort;
    public Long shutdownTimeoutMillis;
    public Integer connectorMaxAttempts;
    public Long connectorBackoffMillis;
}
