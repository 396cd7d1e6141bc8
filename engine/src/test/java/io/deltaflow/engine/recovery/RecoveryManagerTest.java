package io.deltaflow.engine.recovery;

import io.deltaflow.core.RecoveryException;
import io.deltaflow.core.Row;
import io.deltaflow.core.Value;
import io.deltaflow.core.time.ProgressTracker;
import io.deltaflow.engine.connector.CollectingSink;
import io.deltaflow.engine.connector.RetryPolicy;
import io.deltaflow.engine.graph.GraphBuilder;
import io.deltaflow.engine.graph.GraphSpec;
import io.deltaflow.engine.operator.LateRowHandler;
import io.deltaflow.engine.scheduler.BoundaryHook;
import io.deltaflow.engine.scheduler.Dataflow;
import io.deltaflow.engine.scheduler.FailureMonitor;
import io.deltaflow.storage.DeltaLog;
import io.deltaflow.storage.FileSnapshotter;
import io.deltaflow.storage.FileWal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryManagerTest {

    private static final GraphSpec GRAPH = new GraphBuilder().source("in").count("n", "in").sink("out", "n").build();

    @TempDir
    Path dir;

    private DeltaLog wal;
    private Dataflow dataflow;
    private final CollectingSink sink = new CollectingSink();

    @BeforeEach
    void openLog() {
        wal = DeltaLog.open(new FileWal(dir.resolve("wal"), 1 << 20), 0);
    }

    @AfterEach
    void close() {
        if (dataflow != null) dataflow.stop(1000);
        wal.close();
    }

    private Dataflow dataflow(long firstEpoch) {
        var cfg = new Dataflow.Config(1, 16, 100, 0, LateRowHandler.report(), RetryPolicy.none());
        dataflow = new Dataflow(GRAPH, cfg, new ProgressTracker(firstEpoch), new FailureMonitor(), BoundaryHook.NONE,
                Map.of("out", sink), id -> -1, (id, epoch) -> { });
        return dataflow;
    }

    private void logEpoch(long epoch, boolean ended, String... keys) {
        for (String k : keys) wal.appendBatch(epoch, "in", List.of(Row.insert(k, Value.of(epoch), epoch)));
        if (ended) wal.appendEpochEnd(epoch);
    }

    @Test
    void replay_skips_snapshotted_epochs_and_leaves_the_open_one_pending() throws Exception {
        logEpoch(0, true, "a", "b");
        logEpoch(1, true, "a");
        logEpoch(2, false, "c");

        Dataflow df = dataflow(1);
        var recovery = new RecoveryManager(new FileSnapshotter(dir.resolve("snapshots")), wal, df);
        df.start();
        RecoveryManager.Replay replay = recovery.replay(0);

        assertEquals(2, replay.openEpoch());
        assertEquals(6, replay.records());
        assertTrue(sink.awaitEpoch(1, Duration.ofSeconds(10)));
        assertEquals(1, sink.deliveries().size());
        assertEquals(Value.of(1L), sink.value("a"));
        assertNull(sink.value("b"));
        assertNull(sink.value("c"));
    }

    @Test
    void gap_in_logged_epochs_fails_recovery() {
        logEpoch(0, true, "a");
        logEpoch(2, true, "a");

        var recovery = new RecoveryManager(new FileSnapshotter(dir.resolve("snapshots")), wal, dataflow(0));
        var e = assertThrows(RecoveryException.class, () -> recovery.replay(-1));
        assertTrue(e.getMessage().contains("WAL gap"), e.getMessage());
    }

    @Test
    void no_snapshot_means_nothing_to_restore() {
        var recovery = new RecoveryManager(new FileSnapshotter(dir.resolve("snapshots")), wal, dataflow(0));
        assertTrue(recovery.restore().isEmpty());
    }
}
