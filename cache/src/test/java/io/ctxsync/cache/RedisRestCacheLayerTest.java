package io.ctxsync.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ctxsync.core.Payload;
import io.ctxsync.core.SourceSystem;
import io.undertow.Undertow;
import io.undertow.util.Headers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class RedisRestCacheLayerTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final Map<String, String> data = new ConcurrentHashMap<>();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();
    private final List<JsonNode> commands = new CopyOnWriteArrayList<>();
    private volatile int forcedStatus = 0;

    private Undertow server;
    private boolean stopped;
    private URI base;

    @BeforeEach
    void startFakeRedis() {
        server = Undertow.builder()
                .addHttpListener(0, "127.0.0.1")
                .setHandler(exchange -> exchange.getRequestReceiver().receiveFullBytes((ex, body) -> {
                    authHeaders.add(ex.getRequestHeaders().getFirst(Headers.AUTHORIZATION));
                    if (forcedStatus != 0) {
                        ex.setStatusCode(forcedStatus);
                        ex.getResponseSender().send("{}");
                        return;
                    }
                    try {
                        ArrayNode out = JSON.createArrayNode();
                        for (JsonNode cmd : JSON.readTree(body)) {
                            commands.add(cmd);
                            out.add(execute(cmd));
                        }
                        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                        ex.getResponseSender().send(JSON.writeValueAsString(out));
                    } catch (Exception e) {
                        ex.setStatusCode(500);
                        ex.getResponseSender().send("{}");
                    }
                }))
                .build();
        server.start();
        int port = ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
        base = URI.create("http://127.0.0.1:" + port);
    }

    @AfterEach
    void stop() {
        if (!stopped) server.stop();
    }

    private void stopServer() {
        server.stop();
        stopped = true;
    }

    private ObjectNode execute(JsonNode cmd) {
        ObjectNode r = JSON.createObjectNode();
        switch (cmd.get(0).asText()) {
            case "GET" -> {
                String v = data.get(cmd.get(1).asText());
                if (v == null) r.putNull("result"); else r.put("result", v);
            }
            case "SET" -> {
                data.put(cmd.get(1).asText(), cmd.get(2).asText());
                r.put("result", "OK");
            }
            case "DEL" -> r.put("result", data.remove(cmd.get(1).asText()) == null ? 0 : 1);
            case "DBSIZE" -> r.put("result", data.size());
            default -> r.put("error", "ERR unknown command");
        }
        return r;
    }

    private static CacheEntry entry(String key) {
        var value = new CachedContext(key, 9, Payload.parse("{\"team\":\"core\"}"), SourceSystem.B,
                Instant.parse("2024-02-02T10:00:00Z"));
        return new CacheEntry(key, value, Tier.L2, Instant.parse("2024-02-02T11:00:00Z"));
    }

    @Test
    void set_get_delete_round_trip_through_pipeline() {
        var layer = new RedisRestCacheLayer(base, "secret", Duration.ofSeconds(2));

        layer.put(entry("c1"), Duration.ofMillis(3600_500));
        assertEquals(1, layer.size());
        assertEquals(entry("c1"), layer.get("c1").orElseThrow());

        layer.remove("c1");
        assertTrue(layer.get("c1").isEmpty());

        assertTrue(data.isEmpty());
        assertTrue(authHeaders.stream().allMatch("Bearer secret"::equals));
        JsonNode set = commands.stream().filter(c -> c.get(0).asText().equals("SET")).findFirst().orElseThrow();
        assertEquals(RedisRestCacheLayer.KEY_PREFIX + "c1", set.get(1).asText());
        assertEquals("EX", set.get(3).asText());
        assertEquals("3601", set.get(4).asText());
    }

    @Test
    void http_error_is_reported_as_unavailable() {
        var layer = new RedisRestCacheLayer(base, "secret", Duration.ofSeconds(2));
        forcedStatus = 503;
        assertThrows(CacheLayerUnavailableException.class, () -> layer.get("c1"));
    }

    @Test
    void unreachable_endpoint_is_reported_as_unavailable() {
        stopServer();
        var layer = new RedisRestCacheLayer(base, "secret", Duration.ofMillis(300));
        assertThrows(CacheLayerUnavailableException.class, () -> layer.get("c1"));
    }

    @Test
    void tier_cache_treats_a_down_redis_as_a_miss() {
        stopServer();
        var l1 = new LocalCacheLayer();
        var l2 = new RedisRestCacheLayer(base, "secret", Duration.ofMillis(300));
        var cache = TierCache.builder().layer(Tier.L1, l1).layer(Tier.L2, l2).build();

        assertTrue(cache.get("anything").isEmpty());
        assertEquals(1, cache.metrics().misses());
        assertTrue(cache.metrics().errors() >= 1);
    }
}
