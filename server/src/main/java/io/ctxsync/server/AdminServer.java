// file: server/src/main/java/io/ctxsync/server/AdminServer.java
package io.ctxsync.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ctxsync.server.dto.SyncRequest;
import io.ctxsync.sync.SyncOutcome;
import io.ctxsync.sync.SyncPassReport;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator-facing HTTP listener. Not a caller protocol: contexts are not
 * read or written through it.
 *
 * Path layout:
 *   - GET  /admin/health     liveness
 *   - GET  /admin/metrics    EngineMetrics as JSON
 *   - POST /admin/sync       on-demand sync pass; optional body {"contextIds":[...]},
 *                            no body (or no ids) syncs every tracked context
 *
 * Handlers run on Undertow worker threads since a sync pass blocks.
 */
public final class AdminServer {
    private static final Logger LOG = Logger.getLogger(AdminServer.class.getName());
    private static final int MAX_BODY_BYTES = 1024 * 1024;

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final ContextManager manager;

    /** @param port listener port, 0 picks a free one (see {@link #port()}) */
    public AdminServer(int port, ContextManager manager) {
        this.manager = manager;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    if (exchange.isInIoThread()) {
                        exchange.dispatch(this::route);
                        return;
                    }
                    route(exchange);
                }).build();
    }

    public void start() {
        server.start();
        LOG.info("Admin listener on port " + port());
    }

    public void stop() {
        server.stop();
    }

    /** Bound port; only meaningful after {@link #start()}. */
    public int port() {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange ex) {
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        long start = System.nanoTime();

        switch (path) {
            case "/admin/health" -> {
                int status = "GET".equals(method) ? 200 : 405;
                send(ex, status, status == 200 ? Map.of("status", "ok") : Map.of("error", "method not allowed"));
                RequestLogger.logRequest(method, path, status, elapsedMillis(start), null);
            }
            case "/admin/metrics" -> {
                if ("GET".equals(method)) {
                    handleMetrics(ex, method, path, start);
                } else {
                    send(ex, 405, Map.of("error", "method not allowed"));
                    RequestLogger.logRequest(method, path, 405, elapsedMillis(start), null);
                }
            }
            case "/admin/sync" -> {
                if ("POST".equals(method)) {
                    handleSync(ex, method, path, start);
                } else {
                    send(ex, 405, Map.of("error", "method not allowed"));
                    RequestLogger.logRequest(method, path, 405, elapsedMillis(start), null);
                }
            }
            default -> {
                send(ex, 404, Map.of("error", "not found"));
                RequestLogger.logRequest(method, path, 404, elapsedMillis(start), null);
            }
        }
    }

    // ---------- handlers ----------

    private void handleMetrics(HttpServerExchange ex, String method, String path, long start) {
        int status = 200;
        Throwable error = null;
        try {
            send(ex, status, manager.metrics().toMap());
        } catch (RuntimeException e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", "internal error"));
        } finally {
            RequestLogger.logRequest(method, path, status, elapsedMillis(start), error);
        }
    }

    /** POST /admin/sync */
    private void handleSync(HttpServerExchange ex, String method, String path, long start) {
        int status = 500;
        Throwable error = null;
        try {
            byte[] body = readBody(ex);
            if (body.length > MAX_BODY_BYTES) {
                status = 413;
                send(ex, status, Map.of("error", "request body too large"));
                return;
            }
            SyncRequest req = null;
            if (body.length > 0) {
                try {
                    req = json.readValue(body, SyncRequest.class);
                } catch (JsonProcessingException e) {
                    status = 400;
                    send(ex, status, Map.of("error", "invalid JSON"));
                    return;
                }
            }
            SyncOutcome outcome = (req == null || req.contextIds == null || req.contextIds.isEmpty())
                    ? manager.syncTracked()
                    : manager.syncNow(req.contextIds);
            status = 200;
            send(ex, status, describe(outcome));
        } catch (IllegalArgumentException e) {
            status = 400;
            send(ex, status, Map.of("error", String.valueOf(e.getMessage())));
        } catch (IOException | RuntimeException e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", "internal error"));
        } finally {
            RequestLogger.logRequest(method, path, status, elapsedMillis(start), error);
        }
    }

    static Map<String, Object> describe(SyncOutcome outcome) {
        SyncPassReport r = outcome.report();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("passId", r.passId());
        out.put("outcome", outcome.getClass().getSimpleName());
        out.put("contexts", r.contexts());
        out.put("committed", r.committed());
        out.put("conflicts", r.conflictCount());
        out.put("partial", r.partialContexts());
        out.put("elapsedMillis", r.elapsed().toMillis());
        if (outcome instanceof SyncOutcome.PartialIndexFailure p) {
            out.put("unindexed", p.unindexed());
        } else if (outcome instanceof SyncOutcome.RolledBack rb) {
            out.put("failedIn", rb.failedIn().name());
            out.put("error", String.valueOf(rb.cause().getMessage()));
        } else if (outcome instanceof SyncOutcome.Aborted a) {
            out.put("error", String.valueOf(a.cause().getMessage()));
        }
        return out;
    }

    // ---------- helpers ----------

    private static byte[] readBody(HttpServerExchange ex) throws IOException {
        ex.startBlocking();
        return ex.getInputStream().readNBytes(MAX_BODY_BYTES + 1);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            byte[] bytes = json.writeValueAsBytes(body);
            ex.setStatusCode(code);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            LOG.log(Level.WARNING, "Failed to serialize admin response", e);
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
