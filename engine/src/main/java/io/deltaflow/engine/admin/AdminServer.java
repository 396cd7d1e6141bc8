package io.deltaflow.engine.admin;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.deltaflow.core.Row;
import io.deltaflow.core.Value;
import io.deltaflow.core.time.EpochCounter;
import io.deltaflow.engine.Engine;
import io.deltaflow.engine.connector.CollectingSink;
import io.deltaflow.engine.connector.SinkConnector;
import io.deltaflow.engine.dto.CollectionResponse;
import io.deltaflow.engine.dto.ProgressResponse;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only HTTP view of a running engine.
 *
 * Path layout:
 *   - GET /admin/health          200 {"status":"ok"}, 503 once the dataflow failed
 *   - GET /admin/progress        epochs, frontiers and the failure, if any
 *   - GET /collections/{sink}    contents of a materializing sink as of its last epoch
 */
public final class AdminServer {
    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final Engine engine;

    public AdminServer(int port, Engine engine) {
        this.engine = engine;
        this.server = Undertow.builder()
                .addHttpListener(port, "127.0.0.1")
                .setHandler(exchange -> {
                    long start = System.nanoTime();
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                    int status;
                    Throwable error = null;
                    try {
                        if (!"GET".equals(method)) {
                            status = send(exchange, 405, Map.of("error", "method not allowed"));
                        } else if ("/admin/health".equals(path)) {
                            status = handleHealth(exchange);
                        } else if ("/admin/progress".equals(path)) {
                            status = send(exchange, 200, progress());
                        } else if (path.startsWith("/collections/")) {
                            status = handleCollection(exchange, path.substring("/collections/".length()));
                        } else {
                            status = send(exchange, 404, Map.of("error", "not found"));
                        }
                    } catch (Exception e) {
                        error = e;
                        status = send(exchange, 500, Map.of("error", e.getClass().getSimpleName(),
                                "message", String.valueOf(e.getMessage())));
                    }
                    long totalMs = (System.nanoTime() - start) / 1_000_000L;
                    RequestLogger.logRequest(method, path, status, totalMs, error);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    // ---------- handlers ----------

    private int handleHealth(HttpServerExchange ex) {
        if (engine.state() == EpochCounter.State.FAILED || engine.failure().isPresent()) {
            return send(ex, 503, Map.of("status", "failed"));
        }
        return send(ex, 200, Map.of("status", "ok", "state", engine.state().name()));
    }

    private ProgressResponse progress() {
        var dto = new ProgressResponse();
        dto.state = engine.state().name();
        dto.currentEpoch = engine.currentEpoch();
        dto.closedThrough = engine.closedThrough();
        dto.committedEpoch = engine.committedEpoch();
        dto.frontiers = engine.frontiers();
        engine.failure().ifPresent(f -> {
            var view = new ProgressResponse.FailureView();
            view.operatorId = f.operatorId();
            view.shard = f.shard();
            view.epoch = f.epoch();
            view.error = String.valueOf(f.cause());
            dto.failure = view;
        });
        return dto;
    }

    private int handleCollection(HttpServerExchange ex, String sinkId) {
        if (sinkId.isBlank()) return send(ex, 400, Map.of("error", "sink must not be empty"));
        Optional<SinkConnector> sink = engine.sink(sinkId);
        if (sink.isEmpty()) return send(ex, 404, Map.of("error", "unknown sink " + sinkId));
        if (!(sink.get() instanceof CollectingSink c)) {
            return send(ex, 404, Map.of("error", "sink " + sinkId + " does not materialize its collection"));
        }
        var dto = new CollectionResponse();
        dto.sink = sinkId;
        dto.epoch = c.lastEpoch();
        dto.rows = new ArrayList<>();
        for (Row r : c.rows()) {
            var e = new CollectionResponse.Entry();
            e.key = r.key();
            e.value = plain(r.value());
            e.count = r.diff();
            dto.rows.add(e);
        }
        return send(ex, 200, dto);
    }

    /** Value as a JSON-friendly Java object. */
    static Object plain(Value v) {
        if (v instanceof Value.Bool b) return b.v();
        if (v instanceof Value.Int i) return i.v();
        if (v instanceof Value.Real r) return r.v();
        if (v instanceof Value.Str s) return s.v();
        if (v instanceof Value.Tuple t) {
            List<Object> items = new ArrayList<>(t.size());
            for (Value item : t.items()) items.add(plain(item));
            return items;
        }
        return null;
    }

    private int send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
            return code;
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
            return 500;
        }
    }
}
