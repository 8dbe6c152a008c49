package io.ctxsync.sync;

import io.ctxsync.core.Payload;
import io.undertow.Undertow;
import io.undertow.util.Headers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HttpExternalSystemTest {

    private static final Instant FETCH_TIME = Instant.parse("2024-06-01T00:00:00Z");

    private final Map<String, String> bodies = new ConcurrentHashMap<>();
    private final List<String> paths = new CopyOnWriteArrayList<>();
    private volatile int forcedStatus = 0;

    private Undertow server;
    private HttpExternalSystem system;

    @BeforeEach
    void startFakeProducer() {
        server = Undertow.builder()
                .addHttpListener(0, "127.0.0.1")
                .setHandler(exchange -> {
                    String path = exchange.getRequestURI();
                    paths.add(path);
                    if (forcedStatus != 0) {
                        exchange.setStatusCode(forcedStatus);
                        exchange.getResponseSender().send("oops");
                        return;
                    }
                    String body = bodies.get(path);
                    if (body == null) {
                        exchange.setStatusCode(404);
                        exchange.getResponseSender().send("");
                        return;
                    }
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                    exchange.getResponseSender().send(body);
                })
                .build();
        server.start();
        int port = ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
        system = new HttpExternalSystem("system-a", URI.create("http://127.0.0.1:" + port + "/"),
                Duration.ofSeconds(2), HttpClient.newHttpClient(), Clock.fixed(FETCH_TIME, ZoneOffset.UTC));
    }

    @AfterEach
    void stop() {
        server.stop();
    }

    @Test
    void parses_the_producer_view() {
        bodies.put("/contexts/ctx-1",
                "{\"payload\":{\"b\":2,\"a\":1},\"sourceVersion\":7,\"updatedAt\":\"2024-05-01T12:00:00Z\",\"extra\":true}");

        SourceSnapshot snap = system.fetchCurrent("ctx-1").orElseThrow();

        assertEquals(Payload.parse("{\"a\":1,\"b\":2}"), snap.payload());
        assertEquals(7, snap.sourceVersion());
        assertEquals(Instant.parse("2024-05-01T12:00:00Z"), snap.updatedAt());
    }

    @Test
    void missing_timestamp_falls_back_to_fetch_time() {
        bodies.put("/contexts/ctx-1", "{\"payload\":{\"a\":1},\"sourceVersion\":1}");

        assertEquals(FETCH_TIME, system.fetchCurrent("ctx-1").orElseThrow().updatedAt());
    }

    @Test
    void not_found_is_an_empty_view() {
        assertEquals(Optional.empty(), system.fetchCurrent("unknown"));
    }

    @Test
    void ids_are_url_encoded() {
        system.fetchCurrent("team a/b");

        assertEquals("/contexts/team+a%2Fb", paths.get(0));
    }

    @Test
    void server_error_is_unavailable() {
        forcedStatus = 503;

        assertThrows(ExternalSystemUnavailableException.class, () -> system.fetchCurrent("ctx-1"));
    }

    @Test
    void non_object_payload_is_unavailable() {
        bodies.put("/contexts/ctx-1", "{\"payload\":[1,2],\"sourceVersion\":1}");

        assertThrows(ExternalSystemUnavailableException.class, () -> system.fetchCurrent("ctx-1"));
    }
}
