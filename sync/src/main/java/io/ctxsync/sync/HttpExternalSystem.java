// file: sync/src/main/java/io/ctxsync/sync/HttpExternalSystem.java
package io.ctxsync.sync;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.ctxsync.core.Payload;
import io.ctxsync.core.ValidationException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * HTTP-based ExternalSystem.
 *
 * Talks to a producer's read endpoint:
 *
 *   GET {base}/contexts/{contextId}
 *
 * Response JSON (200):
 *
 *   {
 *     "payload": { ... },
 *     "sourceVersion": 42,
 *     "updatedAt": "2024-05-01T12:00:00Z"
 *   }
 *
 * A 404 means the producer holds nothing for the id. Any other status, a
 * timeout or an unparseable body raises ExternalSystemUnavailableException.
 * A missing updatedAt falls back to the time of the fetch.
 */
public final class HttpExternalSystem implements ExternalSystem {

    private final String name;
    private final URI baseUri;
    private final Duration timeout;
    private final HttpClient client;
    private final Clock clock;

    public HttpExternalSystem(String name, URI baseUri, Duration timeout) {
        this(name, baseUri, timeout,
                HttpClient.newBuilder().connectTimeout(timeout).build(),
                Clock.systemUTC());
    }

    public HttpExternalSystem(String name, URI baseUri, Duration timeout, HttpClient client, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.client = Objects.requireNonNull(client, "client");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<SourceSnapshot> fetchCurrent(String contextId) {
        String base = baseUri.toString();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        URI uri = URI.create(base + "/contexts/" + URLEncoder.encode(contextId, StandardCharsets.UTF_8));

        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<byte[]> resp;
        try {
            resp = client.send(req, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new ExternalSystemUnavailableException(
                    "System " + name + " unreachable for context " + contextId + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalSystemUnavailableException(
                    "Interrupted while fetching context " + contextId + " from " + name, e);
        }

        if (resp.statusCode() == 404) return Optional.empty();
        if (resp.statusCode() != 200) {
            throw new ExternalSystemUnavailableException(
                    "System " + name + " returned HTTP " + resp.statusCode() + " for context " + contextId);
        }

        try {
            ContextDto dto = Payload.MAPPER.readValue(resp.body(), ContextDto.class);
            Instant updatedAt = dto.updatedAt() == null ? clock.instant() : Instant.parse(dto.updatedAt());
            return Optional.of(new SourceSnapshot(Payload.of(dto.payload()), dto.sourceVersion(), updatedAt));
        } catch (IOException | DateTimeParseException | ValidationException e) {
            throw new ExternalSystemUnavailableException(
                    "System " + name + " sent an unreadable body for context " + contextId, e);
        }
    }

    // ---------- JSON DTO ----------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ContextDto {
        private final JsonNode payload;
        private final long sourceVersion;
        private final String updatedAt;

        @JsonCreator
        public ContextDto(
                @JsonProperty("payload") JsonNode payload,
                @JsonProperty("sourceVersion") long sourceVersion,
                @JsonProperty("updatedAt") String updatedAt
        ) {
            this.payload = payload;
            this.sourceVersion = sourceVersion;
            this.updatedAt = updatedAt;
        }

        public JsonNode payload() {
            return payload;
        }

        public long sourceVersion() {
            return sourceVersion;
        }

        public String updatedAt() {
            return updatedAt;
        }
    }
}
