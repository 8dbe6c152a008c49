package io.ctxsync.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * L2: Redis reached through its REST pipeline endpoint.
 * <p>
 * Talks to:
 *
 *   POST {base}/pipeline
 *   Authorization: Bearer {token}
 *   [["GET","ctxsync:cache:ctx-1"]]
 *
 * Response JSON, one object per command:
 *
 *   [{"result": "..."}]   or   [{"error": "..."}]
 * <p>
 * Entries are stored as JSON strings with {@code SET key value EX seconds}, so
 * Redis drops them on its own once the tier TTL passes. Every failure (I/O,
 * timeout, non-200, error result) is raised as CacheLayerUnavailableException.
 */
public final class RedisRestCacheLayer implements CacheLayer {
    public static final String KEY_PREFIX = "ctxsync:cache:";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI pipelineUri;
    private final String token;
    private final Duration timeout;
    private final HttpClient client;

    public RedisRestCacheLayer(URI baseUri, String token, Duration timeout) {
        this(baseUri, token, timeout, HttpClient.newBuilder().connectTimeout(timeout).build());
    }

    public RedisRestCacheLayer(URI baseUri, String token, Duration timeout, HttpClient client) {
        Objects.requireNonNull(baseUri, "baseUri");
        String base = baseUri.toString();
        this.pipelineUri = URI.create((base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/pipeline");
        this.token = Objects.requireNonNull(token, "token");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        JsonNode result = single(List.of("GET", KEY_PREFIX + key));
        if (result == null || result.isNull()) return Optional.empty();
        return Optional.of(CacheEntryCodec.decode(result.asText()));
    }

    @Override
    public void put(CacheEntry entry, Duration ttl) {
        long seconds = Math.max(1, (ttl.toMillis() + 999) / 1000);
        single(List.of("SET", KEY_PREFIX + entry.key(), CacheEntryCodec.encode(entry), "EX", Long.toString(seconds)));
    }

    @Override
    public void remove(String key) {
        single(List.of("DEL", KEY_PREFIX + key));
    }

    /** DBSIZE of the backing database; shared databases report foreign keys too. */
    @Override
    public long size() {
        JsonNode result = single(List.of("DBSIZE"));
        return result == null ? 0 : result.asLong();
    }

    @Override
    public void flush() {
        // writes are synchronous
    }

    @Override
    public void close() {
        // HttpClient has no close on JDK 17
    }

    // ---------- helpers ----------

    private JsonNode single(List<String> command) {
        JsonNode results = pipeline(List.of(command));
        if (!results.isArray() || results.size() != 1) {
            throw new CacheLayerUnavailableException("unexpected pipeline response for " + command.get(0));
        }
        JsonNode r = results.get(0);
        if (r.hasNonNull("error")) {
            throw new CacheLayerUnavailableException("redis " + command.get(0) + " failed: " + r.get("error").asText());
        }
        return r.get("result");
    }

    private JsonNode pipeline(List<List<String>> commands) {
        String body;
        try {
            body = MAPPER.writeValueAsString(commands);
        } catch (JsonProcessingException e) {
            throw new CacheLayerUnavailableException("cannot encode pipeline", e);
        }
        HttpRequest req = HttpRequest.newBuilder(pipelineUri)
                .timeout(timeout)
                .header("Authorization", "Bearer " + token)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200) {
                throw new CacheLayerUnavailableException("redis REST returned HTTP " + resp.statusCode());
            }
            return MAPPER.readTree(resp.body());
        } catch (IOException e) {
            throw new CacheLayerUnavailableException("redis REST call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheLayerUnavailableException("interrupted calling redis REST", e);
        }
    }
}
