package io.deltaflow.engine;

import io.deltaflow.core.ConnectorException;
import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.RecoveryException;
import io.deltaflow.core.Row;
import io.deltaflow.core.Value;
import io.deltaflow.core.time.EpochCounter;
import io.deltaflow.engine.connector.CollectingSink;
import io.deltaflow.engine.connector.QueueSource;
import io.deltaflow.engine.connector.Schema;
import io.deltaflow.engine.connector.SinkConnector;
import io.deltaflow.engine.connector.SourceConnector;
import io.deltaflow.engine.connector.SourceEvent;
import io.deltaflow.engine.graph.GraphBuilder;
import io.deltaflow.engine.graph.GraphSpec;
import io.deltaflow.engine.operator.Reducers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EngineTest {

    private static final Duration T = Duration.ofSeconds(10);

    @TempDir
    Path dir;

    private static GraphSpec sumGraph() {
        return new GraphBuilder()
                .source("in")
                .reduce("totals", "in", Reducers.sum())
                .sink("out", "totals")
                .build();
    }

    private EngineConfig config() {
        return EngineConfig.defaults(dir).withShards(2).withConnectorRetry(3, 1);
    }

    private static Value v(long n) {
        return Value.of(n);
    }

    @Test
    void sum_by_id_reads_five_then_seven() throws Exception {
        var src = new QueueSource();
        var sink = new CollectingSink();
        try (Engine engine = Engine.builder(sumGraph(), config()).source("in", src).sink("out", sink).start()) {
            src.insert("1", v(5)).endEpoch();
            assertTrue(engine.awaitClosed(0, T));
            assertEquals(v(5), sink.value("1"));

            src.retract("1", v(5)).insert("1", v(7)).endEpoch();
            assertTrue(engine.awaitClosed(1, T));
            assertEquals(v(7), sink.value("1"));

            DeltaBatch second = sink.deliveries().get(1);
            assertEquals(Set.of(Row.retract("1", v(5), 1), Row.insert("1", v(7), 1)), Set.copyOf(second.rows()));
            assertEquals(1, engine.committedEpoch());
            assertEquals(2, engine.currentEpoch());
        }
    }

    @Test
    void interleaved_updates_within_an_epoch_give_the_net_sum() throws Exception {
        var src = new QueueSource();
        var sink = new CollectingSink();
        try (Engine engine = Engine.builder(sumGraph(), config()).source("in", src).sink("out", sink).start()) {
            src.retract("a", v(4)).insert("a", v(3)).insert("a", v(4)).insert("a", v(10)).retract("a", v(10)).endEpoch();
            assertTrue(engine.awaitClosed(0, T));
            assertEquals(v(3), sink.value("a"));
            assertEquals(1, sink.deliveries().get(0).rows().size());
        }
    }

    @Test
    void epoch_closes_only_when_every_source_ended_it() throws Exception {
        GraphSpec g = new GraphBuilder()
                .source("a")
                .source("b")
                .concat("both", "a", "b")
                .count("n", "both")
                .sink("out", "n")
                .build();
        var a = new QueueSource();
        var b = new QueueSource();
        var sink = new CollectingSink();
        try (Engine engine = Engine.builder(g, config()).source("a", a).source("b", b).sink("out", sink).start()) {
            a.insert("k", v(1)).endEpoch();
            assertFalse(engine.awaitClosed(0, Duration.ofMillis(200)));

            b.insert("k", v(2)).insert("k", v(3)).endEpoch();
            assertTrue(engine.awaitClosed(0, T));
            assertEquals(v(3), sink.value("k"));
        }
    }

    @Test
    void join_across_shards_matches_each_key() throws Exception {
        GraphSpec g = new GraphBuilder()
                .source("users")
                .source("orders")
                .join("j", "users", "orders")
                .sink("out", "j")
                .build();
        var users = new QueueSource();
        var orders = new QueueSource();
        var sink = new CollectingSink();
        try (Engine engine = Engine.builder(g, config().withShards(3))
                .source("users", users).source("orders", orders).sink("out", sink).start()) {
            for (int i = 0; i < 20; i++) {
                users.insert("u" + i, Value.of("user" + i));
                orders.insert("u" + i, v(i * 10L));
            }
            users.endEpoch();
            orders.endEpoch();
            assertTrue(engine.awaitClosed(0, T));
            for (int i = 0; i < 20; i++) {
                assertEquals(Value.tuple(Value.of("user" + i), v(i * 10L)), sink.value("u" + i));
            }

            users.retract("u3", Value.of("user3")).endEpoch();
            orders.endEpoch();
            assertTrue(engine.awaitClosed(1, T));
            assertNull(sink.value("u3"));
            assertEquals(19, sink.rows().size());
        }
    }

    @Test
    void small_queues_apply_backpressure_without_losing_rows() throws Exception {
        var src = new QueueSource();
        var sink = new CollectingSink();
        EngineConfig cfg = config().withShards(3).withQueueCapacity(1);
        try (Engine engine = Engine.builder(sumGraph(), cfg).source("in", src).sink("out", sink).start()) {
            long expected = 0;
            for (int i = 1; i <= 300; i++) {
                src.insert("k" + (i % 7), v(i));
                expected += i;
            }
            src.endEpoch();
            assertTrue(engine.awaitClosed(0, T));

            long total = 0;
            for (int k = 0; k < 7; k++) total += sink.value("k" + k).asLong();
            assertEquals(expected, total);
        }
    }

    @Test
    void crash_recovery_replays_the_log_without_redelivering() throws Exception {
        var sink = new CollectingSink();
        var src = new QueueSource();
        Engine first = Engine.builder(sumGraph(), config()).source("in", src).sink("out", sink).start();
        src.insert("a", v(2)).insert("a", v(3)).endEpoch();
        assertTrue(first.awaitClosed(0, T));
        first.halt();

        var again = new QueueSource();
        try (Engine second = Engine.builder(sumGraph(), config()).source("in", again).sink("out", sink).start()) {
            assertTrue(second.awaitClosed(0, T), "replayed epoch closes again");
            assertEquals(1, second.currentEpoch());

            again.insert("a", v(2)).endEpoch();
            assertTrue(second.awaitClosed(1, T));
            assertEquals(v(7), sink.value("a"));
            assertEquals(2, sink.deliveries().size());
            assertTrue(second.failure().isEmpty());
        }
    }

    @Test
    void graceful_restart_resumes_from_the_final_snapshot() throws Exception {
        var sink = new CollectingSink();
        var src = new QueueSource();
        try (Engine first = Engine.builder(sumGraph(), config()).source("in", src).sink("out", sink).start()) {
            src.insert("a", v(5)).endEpoch();
            assertTrue(first.awaitClosed(0, T));
        }
        // shutdown closed epoch 1 with a forced snapshot
        assertEquals(1, sink.lastEpoch());

        var again = new QueueSource();
        try (Engine second = Engine.builder(sumGraph(), config()).source("in", again).sink("out", sink).start()) {
            assertEquals(1, second.closedThrough());
            assertEquals(2, second.currentEpoch());

            again.insert("a", v(2)).endEpoch();
            assertTrue(second.awaitClosed(2, T));
            assertEquals(v(7), sink.value("a"));
        }
    }

    @Test
    void restart_with_another_shard_count_is_rejected() throws Exception {
        var src = new QueueSource();
        try (Engine first = Engine.builder(sumGraph(), config()).source("in", src)
                .sink("out", new CollectingSink()).start()) {
            src.insert("a", v(1)).endEpoch();
            assertTrue(first.awaitClosed(0, T));
        }

        var builder = Engine.builder(sumGraph(), config().withShards(3))
                .source("in", new QueueSource()).sink("out", new CollectingSink());
        var e = assertThrows(RecoveryException.class, builder::start);
        assertTrue(e.getMessage().contains("totals"), e.getMessage());
    }

    @Test
    void operator_failure_stops_the_dataflow() throws Exception {
        GraphSpec g = new GraphBuilder()
                .source("in")
                .map("parse", "in", kv -> {
                    if (kv.value().asString().equals("boom")) throw new IllegalArgumentException("cannot parse boom");
                    return kv;
                })
                .sink("out", "parse")
                .build();
        var src = new QueueSource();
        try (Engine engine = Engine.builder(g, config()).source("in", src).sink("out", new CollectingSink()).start()) {
            src.insert("a", Value.of("ok")).insert("b", Value.of("boom")).endEpoch();

            var e = assertThrows(DataflowFailedException.class, () -> engine.awaitClosed(0, T));
            assertEquals("parse", e.operatorId());
            assertEquals(0, e.epoch());
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
            assertEquals(EpochCounter.State.FAILED, engine.state());
            assertTrue(engine.failure().isPresent());
        }
    }

    @Test
    void schema_violation_stops_only_that_source() throws Exception {
        GraphSpec g = new GraphBuilder()
                .source("typed")
                .source("free")
                .concat("both", "typed", "free")
                .sink("out", "both")
                .build();
        var typed = new QueueSource(Schema.valuesOfType(Value.Int.class));
        var free = new QueueSource();
        var sink = new CollectingSink();
        try (Engine engine = Engine.builder(g, config()).source("typed", typed).source("free", free)
                .sink("out", sink).start()) {
            typed.insert("x", Value.of("not a number"));
            free.insert("k", v(1)).endEpoch();

            assertTrue(engine.awaitClosed(0, T));
            assertEquals(v(1), sink.value("k"));
            assertNull(sink.value("x"));

            free.insert("k", v(2)).endEpoch();
            assertTrue(engine.awaitClosed(1, T));
            assertTrue(engine.failure().isEmpty());
        }
    }

    @Test
    void transient_connector_failures_are_retried() throws Exception {
        var queue = new QueueSource();
        var flakySource = new FlakySource(queue, 2);
        var sink = new CollectingSink();
        var flakySink = new FlakySink(sink, 2);
        try (Engine engine = Engine.builder(sumGraph(), config().withConnectorRetry(5, 1))
                .source("in", flakySource).sink("out", flakySink).start()) {
            queue.insert("a", v(4)).endEpoch();
            assertTrue(engine.awaitClosed(0, T));
            assertEquals(v(4), sink.value("a"));
            assertEquals(2, flakySource.failures.get());
            assertEquals(2, flakySink.failures.get());
        }
    }

    @Test
    void permanent_source_failure_fails_the_dataflow() throws Exception {
        SourceConnector broken = () -> {
            throw new ConnectorException("connection refused", false);
        };
        try (Engine engine = Engine.builder(sumGraph(), config()).source("in", broken)
                .sink("out", new CollectingSink()).start()) {
            var e = assertThrows(DataflowFailedException.class, () -> engine.awaitClosed(0, T));
            assertEquals("in", e.operatorId());
            assertInstanceOf(ConnectorException.class, e.getCause());
        }
    }

    @Test
    void connectors_must_match_sources_and_sinks() {
        var missingSink = Engine.builder(sumGraph(), config()).source("in", new QueueSource());
        assertThrows(IllegalArgumentException.class, missingSink::start);

        var extraSource = Engine.builder(sumGraph(), config()).source("in", new QueueSource())
                .source("other", new QueueSource()).sink("out", new CollectingSink());
        assertThrows(IllegalArgumentException.class, extraSource::start);
    }

    @Test
    void finished_source_closes_its_last_epoch() throws Exception {
        var src = new QueueSource();
        var sink = new CollectingSink();
        try (Engine engine = Engine.builder(sumGraph(), config()).source("in", src).sink("out", sink).start()) {
            src.insert("a", v(9)).finish();
            assertTrue(engine.awaitClosed(0, T));
            assertEquals(v(9), sink.value("a"));
            assertEquals(Map.of(v(9), 1L), sink.values("a"));
        }
    }

    /** Throws a transient error on the first {@code failing} calls. */
    private static final class FlakySource implements SourceConnector {
        private final SourceConnector delegate;
        private final int failing;
        final AtomicInteger failures = new AtomicInteger();

        FlakySource(SourceConnector delegate, int failing) {
            this.delegate = delegate;
            this.failing = failing;
        }

        @Override
        public SourceEvent next() throws InterruptedException {
            if (failures.get() < failing) {
                failures.incrementAndGet();
                throw new ConnectorException("temporarily unavailable", true);
            }
            return delegate.next();
        }

        @Override
        public Optional<Schema> schema() {
            return delegate.schema();
        }
    }

    private static final class FlakySink implements SinkConnector {
        private final SinkConnector delegate;
        private final int failing;
        final AtomicInteger failures = new AtomicInteger();

        FlakySink(SinkConnector delegate, int failing) {
            this.delegate = delegate;
            this.failing = failing;
        }

        @Override
        public void write(long epoch, DeltaBatch batch) {
            if (failures.get() < failing) {
                failures.incrementAndGet();
                throw new ConnectorException("sink busy", true);
            }
            delegate.write(epoch, batch);
        }
    }
}
