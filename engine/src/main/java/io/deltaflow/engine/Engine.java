package io.deltaflow.engine;

import io.deltaflow.core.DataflowException;
import io.deltaflow.core.EngineClosedException;
import io.deltaflow.core.RecoveryException;
import io.deltaflow.core.time.EpochCounter;
import io.deltaflow.core.time.ProgressTracker;
import io.deltaflow.engine.admin.AdminServer;
import io.deltaflow.engine.connector.SinkConnector;
import io.deltaflow.engine.connector.SourceConnector;
import io.deltaflow.engine.graph.GraphSpec;
import io.deltaflow.engine.graph.GraphValidator;
import io.deltaflow.engine.graph.NodeKind;
import io.deltaflow.engine.graph.NodeSpec;
import io.deltaflow.engine.ingest.IngestionBoundary;
import io.deltaflow.engine.ingest.SourceDriver;
import io.deltaflow.engine.recovery.CheckpointCoordinator;
import io.deltaflow.engine.recovery.RecoveryManager;
import io.deltaflow.engine.scheduler.Dataflow;
import io.deltaflow.engine.scheduler.FailureMonitor;
import io.deltaflow.engine.scheduler.OperatorFailure;
import io.deltaflow.storage.DeltaLog;
import io.deltaflow.storage.EpochMetadata;
import io.deltaflow.storage.FileEpochStore;
import io.deltaflow.storage.FileSnapshotter;
import io.deltaflow.storage.FileWal;
import io.deltaflow.storage.SnapshotManifest;
import io.deltaflow.storage.SnapshotPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of a running dataflow.
 *
 * Responsibilities:
 *  - Validate the graph and its connector bindings.
 *  - Wire storage (WAL, snapshots, epoch store) and recover from it.
 *  - Start one worker per operator shard, one driver per source and,
 *    optionally, the admin HTTP server.
 *  - Expose progress (closed, committed and current epochs, frontiers).
 *  - Shut down gracefully: stop ingestion, close the open epoch, take a final
 *    snapshot, persist the epoch counter.
 *
 * Any operator failure stops the whole dataflow; waiting callers get a
 * {@link DataflowFailedException} naming the operator and epoch. Restarting on
 * the same data directory resumes from the last complete snapshot.
 */
public final class Engine implements AutoCloseable {
    private static final Logger log = Logger.getLogger(Engine.class.getName());

    private final GraphSpec graph;
    private final EngineConfig config;
    private final Map<String, SinkConnector> sinks;
    private final FailureMonitor failures = new FailureMonitor();
    private final Object progress = new Object();
    private final List<SourceDriver> drivers = new CopyOnWriteArrayList<>();

    private FileEpochStore store;
    private DeltaLog wal;
    private SnapshotPolicy policy;
    private ProgressTracker tracker;
    private EpochCounter counter;
    private Dataflow dataflow;
    private IngestionBoundary boundary;
    private AdminServer admin;
    private boolean closed;
    // last epoch whose close every listener has handled; guarded by progress
    private long announced;

    private Engine(GraphSpec graph, EngineConfig config, Map<String, SinkConnector> sinks) {
        this.graph = graph;
        this.config = config;
        this.sinks = Map.copyOf(sinks);
    }

    public static Builder builder(GraphSpec graph, EngineConfig config) {
        return new Builder(graph, config);
    }

    /** Binds connectors to the graph's sources and sinks, then starts the engine. */
    public static final class Builder {
        private final GraphSpec graph;
        private final EngineConfig config;
        private final Map<String, SourceConnector> sources = new LinkedHashMap<>();
        private final Map<String, SinkConnector> sinks = new LinkedHashMap<>();

        private Builder(GraphSpec graph, EngineConfig config) {
            this.graph = graph;
            this.config = config;
        }

        public Builder source(String id, SourceConnector connector) {
            sources.put(id, connector);
            return this;
        }

        public Builder sink(String id, SinkConnector connector) {
            sinks.put(id, connector);
            return this;
        }

        /**
         * Validate, recover and start.
         *
         * @throws io.deltaflow.engine.graph.GraphValidationException on an invalid graph
         * @throws IllegalArgumentException if connectors do not match the graph's sources and sinks
         * @throws RecoveryException if persisted state is inconsistent
         */
        public Engine start() {
            GraphValidator.validate(graph);
            checkBindings(NodeKind.SOURCE, sources.keySet());
            checkBindings(NodeKind.SINK, sinks.keySet());
            Engine engine = new Engine(graph, config, sinks);
            try {
                engine.start(sources);
            } catch (RuntimeException e) {
                engine.abortStart();
                throw e;
            }
            return engine;
        }

        private void checkBindings(NodeKind kind, Set<String> bound) {
            List<String> declared = new ArrayList<>();
            for (NodeSpec n : graph.ofKind(kind)) declared.add(n.id());
            for (String id : declared) {
                if (!bound.contains(id)) throw new IllegalArgumentException("no connector for " + kind + " " + id);
            }
            for (String id : bound) {
                if (!declared.contains(id)) throw new IllegalArgumentException("graph has no " + kind + " " + id);
            }
        }
    }

    private void start(Map<String, SourceConnector> sources) {
        var dataDir = config.dataDir();

        // ------ Storage -------
        store = new FileEpochStore(dataDir.resolve("epochs.json"));
        EpochMetadata meta = store.load();
        wal = DeltaLog.open(new FileWal(dataDir.resolve("wal"), config.walRotateBytes()), meta.nextSequence());
        var snapshots = new FileSnapshotter(dataDir.resolve("snapshots"));
        policy = new SnapshotPolicy(config.snapshotEveryEpochs());

        long snapshotEpoch = snapshots.latestManifest().map(SnapshotManifest::epoch).orElse(-1L);
        long openEpoch = Math.max(snapshotEpoch, wal.summary().lastEndedEpoch()) + 1;
        if (meta.nextEpoch() > openEpoch) {
            throw new RecoveryException("epoch store expects epoch " + meta.nextEpoch()
                    + " but snapshots and WAL only reach epoch " + openEpoch);
        }

        // ------ Time -------
        tracker = new ProgressTracker(snapshotEpoch + 1);
        counter = EpochCounter.restoredFrom(openEpoch, next -> store.update(m -> m.withNextEpoch(next)));

        // ------ Dataflow -------
        Map<String, Integer> layout = Dataflow.shardLayout(graph, config.shards());
        var coordinator = new CheckpointCoordinator(snapshots, policy, store, wal, counter, tracker, layout,
                config.retainedSnapshots(), config.compactionLag());
        announced = tracker.closedThrough();
        tracker.addListener(coordinator);
        tracker.addListener(epoch -> {
            synchronized (progress) {
                announced = epoch;
                progress.notifyAll();
            }
        });
        failures.onFailure(this::onFailure);

        var dfConfig = new Dataflow.Config(config.shards(), config.queueCapacity(), config.maxIterations(),
                config.allowedLateness(), config.lateRows().handler(), config.connectorRetry());
        dataflow = new Dataflow(graph, dfConfig, tracker, failures, coordinator, sinks, meta::ackedBy, coordinator);

        // ------ Recovery -------
        var recovery = new RecoveryManager(snapshots, wal, dataflow);
        recovery.restore();
        dataflow.start();
        RecoveryManager.Replay replay;
        try {
            replay = recovery.replay(snapshotEpoch);
        } catch (EngineClosedException e) {
            failures.throwIfFailed();
            throw e;
        }
        if (replay.openEpoch() != openEpoch) {
            throw new RecoveryException("WAL replay ended at epoch " + replay.openEpoch()
                    + ", expected " + openEpoch);
        }

        // ------ Ingestion -------
        boundary = new IngestionBoundary(counter, tracker, wal, dataflow, sources.keySet());
        for (var e : sources.entrySet()) {
            drivers.add(new SourceDriver(e.getKey(), e.getValue(), config.connectorRetry(), boundary, counter,
                    failures));
        }
        drivers.forEach(SourceDriver::start);

        if (config.adminPort() >= 0) {
            admin = new AdminServer(config.adminPort(), this);
            admin.start();
        }
        log.log(Level.INFO, "Engine started: {0} nodes, {1} shards, snapshot epoch {2}, open epoch {3}",
                new Object[]{graph.nodes().size(), config.shards(), snapshotEpoch, openEpoch});
    }

    private void stopDrivers() {
        for (SourceDriver d : drivers) {
            try {
                d.stop(config.shutdownTimeoutMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void abortStart() {
        if (counter != null) counter.fail();
        stopDrivers();
        if (dataflow != null) dataflow.stop(config.shutdownTimeoutMillis());
        if (wal != null) wal.close();
    }

    private void onFailure() {
        counter.fail();
        stopDrivers();
        dataflow.stop(config.shutdownTimeoutMillis());
        synchronized (progress) {
            progress.notifyAll();
        }
    }

    /**
     * Block until {@code epoch} is globally closed and committed.
     *
     * @return false on timeout
     * @throws DataflowFailedException if the dataflow failed
     */
    public boolean awaitClosed(long epoch, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (progress) {
            while (announced < epoch) {
                failures.throwIfFailed();
                long left = deadline - System.nanoTime();
                if (left <= 0) return false;
                TimeUnit.NANOSECONDS.timedWait(progress, left);
            }
        }
        return true;
    }

    /** Last globally closed epoch, or -1. */
    public long closedThrough() {
        return tracker.closedThrough();
    }

    /** Last epoch recorded as committed in the epoch store, or -1. */
    public long committedEpoch() {
        return store.load().committedEpoch();
    }

    /** Epoch currently accepting input. */
    public long currentEpoch() {
        return counter.current();
    }

    public Map<String, Long> frontiers() {
        return tracker.frontiers();
    }

    public EpochCounter.State state() {
        return counter.state();
    }

    public Optional<OperatorFailure> failure() {
        return failures.failure();
    }

    public GraphSpec graph() {
        return graph;
    }

    public Optional<SinkConnector> sink(String id) {
        return Optional.ofNullable(sinks.get(id));
    }

    /** Port the admin server listens on, or -1 if it is disabled. */
    public int adminPort() {
        return admin == null ? -1 : admin.port();
    }

    /**
     * Graceful shutdown: stop ingestion, close the open epoch with a forced
     * snapshot, persist the epoch counter, stop every thread.
     */
    public synchronized void shutdown() {
        if (closed) return;
        closed = true;
        counter.drain();
        try {
            stopDrivers();
            if (!failures.failed()) {
                long last = counter.current();
                policy.force(last);
                boundary.closeCurrentEpoch();
                if (!awaitClosed(last, Duration.ofMillis(config.shutdownTimeoutMillis()))) {
                    log.log(Level.WARNING, "Epoch {0} did not close within {1}ms",
                            new Object[]{last, config.shutdownTimeoutMillis()});
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (DataflowException e) {
            log.log(Level.WARNING, "Dataflow failed during shutdown", e);
        } finally {
            counter.close();
            counter.flush();
            if (admin != null) admin.stop();
            dataflow.stop(config.shutdownTimeoutMillis());
            wal.close();
        }
        log.log(Level.INFO, "Engine stopped: closed through epoch {0}, committed {1}",
                new Object[]{tracker.closedThrough(), committedEpoch()});
    }

    @Override
    public void close() {
        shutdown();
    }

    /** Stop every thread without closing the open epoch or persisting anything more, like a crash. */
    synchronized void halt() {
        if (closed) return;
        closed = true;
        counter.fail();
        stopDrivers();
        if (admin != null) admin.stop();
        dataflow.stop(config.shutdownTimeoutMillis());
        wal.close();
    }
}
