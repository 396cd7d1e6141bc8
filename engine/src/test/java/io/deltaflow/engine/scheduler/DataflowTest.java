package io.deltaflow.engine.scheduler;

import io.deltaflow.core.EngineClosedException;
import io.deltaflow.core.Row;
import io.deltaflow.core.Value;
import io.deltaflow.core.time.ProgressTracker;
import io.deltaflow.engine.connector.CollectingSink;
import io.deltaflow.engine.connector.RetryPolicy;
import io.deltaflow.engine.graph.GraphBuilder;
import io.deltaflow.engine.graph.GraphSpec;
import io.deltaflow.engine.operator.LateRowHandler;
import io.deltaflow.engine.operator.Reducers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DataflowTest {

    private static final GraphSpec GRAPH = new GraphBuilder()
            .source("in")
            .filter("positive", "in", kv -> kv.value().asLong() > 0)
            .reduce("sum", "positive", Reducers.sum())
            .sink("out", "sum")
            .build();

    private final ProgressTracker tracker = new ProgressTracker(0);
    private final FailureMonitor failures = new FailureMonitor();
    private final CollectingSink sink = new CollectingSink();
    private final List<Long> acks = new CopyOnWriteArrayList<>();
    private Dataflow dataflow;

    private Dataflow dataflow(int shards, int capacity, long ackedThrough) {
        var cfg = new Dataflow.Config(shards, capacity, 100, 0, LateRowHandler.report(), RetryPolicy.none());
        dataflow = new Dataflow(GRAPH, cfg, tracker, failures, BoundaryHook.NONE, Map.of("out", sink),
                id -> ackedThrough, (id, epoch) -> acks.add(epoch));
        return dataflow;
    }

    @AfterEach
    void stop() {
        if (dataflow != null) dataflow.stop(1000);
    }

    private static List<Row> rows(long epoch, long... values) {
        List<Row> out = new ArrayList<>();
        for (int i = 0; i < values.length; i++) out.add(Row.insert("k" + (i % 3), Value.of(values[i]), epoch));
        return out;
    }

    @Test
    void epoch_flows_through_every_shard_to_the_sink() throws Exception {
        var df = dataflow(3, 4, -1);
        df.start();
        df.admit("in", 0, rows(0, 1, 2, 3, -4, 5, 6));
        df.endEpoch(0);

        assertTrue(sink.awaitEpoch(0, Duration.ofSeconds(10)));
        assertEquals(Value.of(1L), sink.value("k0"), "-4 is filtered out");
        assertEquals(Value.of(7L), sink.value("k1"));
        assertEquals(Value.of(9L), sink.value("k2"));
        assertEquals(List.of(0L), acks);
        assertFalse(failures.failed());
    }

    @Test
    void sink_gets_a_final_epoch_before_it_closes_globally() throws Exception {
        List<Long> closedAtWrite = new CopyOnWriteArrayList<>();
        var written = new CountDownLatch(1);
        var closed = new CountDownLatch(1);
        tracker.addListener(e -> closed.countDown());
        var cfg = new Dataflow.Config(2, 4, 100, 0, LateRowHandler.report(), RetryPolicy.none());
        dataflow = new Dataflow(GRAPH, cfg, tracker, failures, BoundaryHook.NONE,
                Map.of("out", (epoch, batch) -> {
                    closedAtWrite.add(tracker.closedThrough());
                    written.countDown();
                }),
                id -> -1, (id, epoch) -> acks.add(epoch));
        dataflow.start();
        dataflow.admit("in", 0, rows(0, 1, 2));
        dataflow.endEpoch(0);

        assertTrue(written.await(10, TimeUnit.SECONDS));
        assertTrue(closed.await(10, TimeUnit.SECONDS));
        assertEquals(List.of(-1L), closedAtWrite);
        assertEquals(0, tracker.closedThrough());
    }

    @Test
    void acknowledged_epoch_closes_without_delivery() throws Exception {
        var closed = new CountDownLatch(2);
        tracker.addListener(e -> closed.countDown());
        var df = dataflow(2, 4, 0);
        df.start();
        df.admit("in", 0, rows(0, 1));
        df.endEpoch(0);
        df.admit("in", 1, rows(1, 2));
        df.endEpoch(1);

        assertTrue(closed.await(10, TimeUnit.SECONDS));
        assertEquals(1, sink.lastEpoch());
        assertEquals(1, sink.deliveries().size());
        assertEquals(List.of(1L), acks);
    }

    @Test
    void stateful_nodes_are_laid_out_per_shard() {
        assertEquals(Map.of("sum", 4), Dataflow.shardLayout(GRAPH, 4));
    }

    @Test
    void feeding_a_stopped_dataflow_fails_instead_of_blocking() throws Exception {
        var df = dataflow(1, 1, -1);
        df.admit("in", 0, rows(0, 1));
        df.stop(100);
        assertThrows(EngineClosedException.class, () -> df.admit("in", 0, rows(0, 2)));
    }

    @Test
    void unknown_source_is_rejected() {
        var df = dataflow(1, 1, -1);
        assertThrows(IllegalArgumentException.class, () -> df.admit("nope", 0, rows(0, 1)));
    }
}
