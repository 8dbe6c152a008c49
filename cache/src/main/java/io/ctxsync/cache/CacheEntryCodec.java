package io.ctxsync.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ctxsync.core.Payload;
import io.ctxsync.core.SourceSystem;

import java.time.Instant;

/**
 * JSON form of a {@link CacheEntry}, shared by the Redis and file tiers.
 *
 * <pre>
 * {
 *   "key": "ctx-1", "id": "ctx-1", "version": 7, "source": "MERGED",
 *   "updatedAt": "2024-01-01T00:00:00Z", "tier": "L2",
 *   "expiresAt": "2024-01-01T01:00:00Z", "payload": { ... }
 * }
 * </pre>
 */
final class CacheEntryCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CacheEntryCodec() {}

    static String encode(CacheEntry e) {
        CachedContext v = e.value();
        EntryDto dto = new EntryDto(e.key(), v.id(), v.version(), v.source().name(), v.updatedAt().toString(),
                e.tier().name(), e.expiresAt().toString(), v.payload().toObjectNode());
        try {
            return MAPPER.writeValueAsString(dto);
        } catch (JsonProcessingException ex) {
            throw new CacheLayerUnavailableException("cannot encode cache entry " + e.key(), ex);
        }
    }

    static CacheEntry decode(String json) {
        try {
            EntryDto dto = MAPPER.readValue(json, EntryDto.class);
            CachedContext value = new CachedContext(dto.id, dto.version, Payload.of(dto.payload),
                    SourceSystem.valueOf(dto.source), Instant.parse(dto.updatedAt));
            return new CacheEntry(dto.key, value, Tier.valueOf(dto.tier), Instant.parse(dto.expiresAt));
        } catch (JsonProcessingException | RuntimeException ex) {
            throw new CacheLayerUnavailableException("malformed cache entry", ex);
        }
    }

    // ---------- JSON DTO ----------

    static final class EntryDto {
        public final String key;
        public final String id;
        public final long version;
        public final String source;
        public final String updatedAt;
        public final String tier;
        public final String expiresAt;
        public final JsonNode payload;

        @JsonCreator
        EntryDto(
                @JsonProperty("key") String key,
                @JsonProperty("id") String id,
                @JsonProperty("version") long version,
                @JsonProperty("source") String source,
                @JsonProperty("updatedAt") String updatedAt,
                @JsonProperty("tier") String tier,
                @JsonProperty("expiresAt") String expiresAt,
                @JsonProperty("payload") JsonNode payload
        ) {
            this.key = key;
            this.id = id;
            this.version = version;
            this.source = source;
            this.updatedAt = updatedAt;
            this.tier = tier;
            this.expiresAt = expiresAt;
            this.payload = payload;
        }
    }
}
