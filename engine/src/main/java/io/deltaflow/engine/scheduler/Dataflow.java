package io.deltaflow.engine.scheduler;

import io.deltaflow.core.DeltaBatch;
import io.deltaflow.core.EngineClosedException;
import io.deltaflow.core.RecoveryException;
import io.deltaflow.core.Row;
import io.deltaflow.core.state.StateImage;
import io.deltaflow.core.time.ProgressTracker;
import io.deltaflow.engine.connector.RetryPolicy;
import io.deltaflow.engine.connector.SinkConnector;
import io.deltaflow.engine.graph.GraphSpec;
import io.deltaflow.engine.graph.NodeKind;
import io.deltaflow.engine.graph.NodeSpec;
import io.deltaflow.engine.operator.LateRowHandler;
import io.deltaflow.engine.operator.Operator;
import io.deltaflow.engine.operator.OperatorContext;
import io.deltaflow.engine.operator.Operators;
import io.deltaflow.storage.SnapshotManifest;
import io.deltaflow.storage.Snapshotter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToLongFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Physical plan of a validated graph: one worker thread per node shard,
 * connected by bounded queues.
 * <p>
 * Layout:
 *  - SOURCE, ITERATE and SINK nodes run a single instance; every other kind
 *    runs {@link Config#shards()} instances;
 *  - every producer instance has its own queue to every consumer instance, so
 *    per-edge FIFO order holds and an EpochEnd on one edge means that producer
 *    is done with the epoch;
 *  - rows are routed to consumer shards by key hash.
 * <p>
 * Sources are fed through an ingress queue per source, see {@link #admit} and
 * {@link #endEpoch}.
 */
public final class Dataflow {
    private static final Logger log = Logger.getLogger(Dataflow.class.getName());
    private static final long INGRESS_POLL_MILLIS = 50;

    /**
     * Execution settings.
     *
     * @param shards          instances per sharded node
     * @param queueCapacity   messages per edge queue before the producer blocks
     * @param maxIterations   default bound for iterate nodes
     * @param allowedLateness default lateness for windows
     * @param lateRows        handling of rows for sealed windows
     * @param sinkRetry       retry policy for sink writes
     */
    public record Config(int shards, int queueCapacity, int maxIterations, long allowedLateness,
                         LateRowHandler lateRows, RetryPolicy sinkRetry) {
        public Config {
            if (shards <= 0) throw new IllegalArgumentException("shards must be > 0");
            if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity must be > 0");
            Objects.requireNonNull(lateRows, "lateRows");
            Objects.requireNonNull(sinkRetry, "sinkRetry");
        }
    }

    private final GraphSpec graph;
    private final Map<String, EdgeQueue> ingress = new LinkedHashMap<>();
    private final Map<String, List<OperatorWorker>> operators = new LinkedHashMap<>();
    private final List<Worker> workers = new ArrayList<>();
    private final List<Thread> threads = new ArrayList<>();

    private volatile boolean started;
    private volatile boolean stopped;

    public Dataflow(GraphSpec graph, Config config, ProgressTracker tracker, FailureMonitor failures,
                    BoundaryHook hook, Map<String, SinkConnector> sinks, ToLongFunction<String> ackedThrough,
                    SinkAckListener acks) {
        this.graph = graph;
        long firstEpoch = tracker.lowWatermark();
        int cap = config.queueCapacity();

        List<NodeSpec> order = graph.topologicalOrder();
        Map<String, int[]> instances = new LinkedHashMap<>();
        Map<String, List<Mailbox>> mailboxes = new LinkedHashMap<>();
        Map<String, List<List<Worker.Inbound>>> inbound = new LinkedHashMap<>();
        // producer id -> producer shard -> "consumer#port" -> queue per consumer shard
        Map<String, List<Map<String, EdgeQueue[]>>> outbound = new LinkedHashMap<>();

        for (NodeSpec node : order) {
            int n = shardsOf(node, config.shards());
            instances.put(node.id(), new int[]{n});
            List<Mailbox> boxes = new ArrayList<>(n);
            List<List<Worker.Inbound>> ins = new ArrayList<>(n);
            List<Map<String, EdgeQueue[]>> outs = new ArrayList<>(n);
            for (int j = 0; j < n; j++) {
                boxes.add(new Mailbox());
                ins.add(new ArrayList<>());
                outs.add(new LinkedHashMap<>());
            }
            mailboxes.put(node.id(), boxes);
            inbound.put(node.id(), ins);
            outbound.put(node.id(), outs);

            if (node.kind() == NodeKind.SOURCE) {
                EdgeQueue q = new EdgeQueue("ingress->" + node.id(), cap, boxes.get(0));
                ingress.put(node.id(), q);
                ins.get(0).add(new Worker.Inbound(0, q));
            }
            for (int port = 0; port < node.inputs().size(); port++) {
                String up = node.inputs().get(port);
                int producers = instances.get(up)[0];
                for (int i = 0; i < producers; i++) {
                    EdgeQueue[] perShard = new EdgeQueue[n];
                    for (int j = 0; j < n; j++) {
                        EdgeQueue q = new EdgeQueue(up + "[" + i + "]->" + node.id() + "[" + j + "]:" + port,
                                cap, boxes.get(j));
                        perShard[j] = q;
                        ins.get(j).add(new Worker.Inbound(port, q));
                    }
                    outbound.get(up).get(i).put(node.id() + "#" + port, perShard);
                }
            }
            tracker.register(node.id(), n, node.inputs());
        }

        OperatorContext base = new OperatorContext("dataflow", config.maxIterations(), config.allowedLateness(),
                config.lateRows());
        for (NodeSpec node : order) {
            int n = instances.get(node.id())[0];
            if (node.kind() == NodeKind.SINK) {
                SinkConnector sink = sinks.get(node.id());
                if (sink == null) throw new IllegalArgumentException("no connector bound to sink " + node.id());
                workers.add(new SinkWorker(node.id(), sink, config.sinkRetry(), inbound.get(node.id()).get(0),
                        mailboxes.get(node.id()).get(0), tracker, failures, acks,
                        ackedThrough.applyAsLong(node.id()), firstEpoch));
                continue;
            }
            List<OperatorWorker> shardWorkers = new ArrayList<>(n);
            for (int j = 0; j < n; j++) {
                List<OperatorWorker.Outbound> outs = new ArrayList<>();
                for (EdgeQueue[] qs : outbound.get(node.id()).get(j).values()) {
                    outs.add(new OperatorWorker.Outbound(List.of(qs)));
                }
                Operator op = Operators.create(node, base.forOperator(node.id()));
                OperatorWorker w = new OperatorWorker(node.id(), j, op, inbound.get(node.id()).get(j), outs,
                        mailboxes.get(node.id()).get(j), tracker, failures, hook, firstEpoch);
                shardWorkers.add(w);
                workers.add(w);
            }
            operators.put(node.id(), shardWorkers);
        }
    }

    /** Stateful operators and their shard counts, as recorded in snapshot manifests. */
    public static Map<String, Integer> shardLayout(GraphSpec graph, int shards) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (NodeSpec n : graph.topologicalOrder()) {
            if (n.kind().stateful()) out.put(n.id(), shardsOf(n, shards));
        }
        return out;
    }

    private static int shardsOf(NodeSpec node, int shards) {
        return node.kind().sharded() ? shards : 1;
    }

    /**
     * Load every stateful operator shard from the snapshot described by {@code manifest}.
     * Must be called before {@link #start()}.
     *
     * @throws RecoveryException if the snapshot does not match this graph
     */
    public void restore(Snapshotter snapshots, SnapshotManifest manifest) {
        if (started) throw new IllegalStateException("restore after start");
        for (String op : manifest.shards().keySet()) {
            List<OperatorWorker> ws = operators.get(op);
            if (ws == null || !graph.node(op).kind().stateful()) {
                throw new RecoveryException("snapshot at epoch " + manifest.epoch()
                        + " has state for unknown operator " + op);
            }
        }
        for (Map.Entry<String, List<OperatorWorker>> e : operators.entrySet()) {
            if (!graph.node(e.getKey()).kind().stateful()) continue;
            Integer recorded = manifest.shards().get(e.getKey());
            int n = e.getValue().size();
            if (recorded == null || recorded != n) {
                throw new RecoveryException("snapshot at epoch " + manifest.epoch() + " has " + recorded
                        + " shards for " + e.getKey() + ", graph needs " + n);
            }
            for (int shard = 0; shard < n; shard++) {
                final int s = shard;
                StateImage img = snapshots.readImage(e.getKey(), shard, manifest.epoch())
                        .orElseThrow(() -> new RecoveryException("missing image for " + e.getKey() + " shard " + s
                                + " at epoch " + manifest.epoch()));
                e.getValue().get(shard).operator().restore(img);
            }
        }
        log.info(() -> "Restored " + manifest.shards().size() + " operators from snapshot at epoch " + manifest.epoch());
    }

    /**
     * Feed rows of one source into the graph. Blocks while the ingress queue is full.
     *
     * @throws EngineClosedException if the dataflow stops while blocked
     */
    public void admit(String sourceId, long epoch, List<Row> rows) throws InterruptedException {
        EdgeQueue q = ingress.get(sourceId);
        if (q == null) throw new IllegalArgumentException("unknown source " + sourceId);
        if (rows.isEmpty()) return;
        feed(q, new Message.Data(new DeltaBatch(epoch, rows)));
    }

    /** No more rows for {@code epoch} from any source. */
    public void endEpoch(long epoch) throws InterruptedException {
        Message end = new Message.EpochEnd(epoch);
        for (EdgeQueue q : ingress.values()) feed(q, end);
    }

    private void feed(EdgeQueue q, Message m) throws InterruptedException {
        while (!q.offer(m, INGRESS_POLL_MILLIS)) {
            if (stopped) throw new EngineClosedException("dataflow stopped; cannot feed " + q);
        }
    }

    public synchronized void start() {
        if (started) throw new IllegalStateException("already started");
        started = true;
        for (Worker w : workers) {
            Thread t = new Thread(w, "deltaflow-" + w.nodeId + "-" + w.shard);
            t.setDaemon(true);
            threads.add(t);
        }
        threads.forEach(Thread::start);
        log.info(() -> "Started " + threads.size() + " workers for " + graph.nodes().size() + " nodes");
    }

    /** Stop every worker and wait for them, except the calling thread if it is one. */
    public synchronized void stop(long timeoutMillis) {
        stopped = true;
        for (Worker w : workers) w.stop();
        Thread self = Thread.currentThread();
        for (Thread t : threads) if (t != self) t.interrupt();
        long deadline = System.currentTimeMillis() + timeoutMillis;
        for (Thread t : threads) {
            if (t == self) continue;
            try {
                t.join(Math.max(1, deadline - System.currentTimeMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (t.isAlive()) log.log(Level.WARNING, "Worker {0} did not stop in time", t.getName());
        }
    }
}
