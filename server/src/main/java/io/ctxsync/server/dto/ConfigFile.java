package io.ctxsync.server.dto;

import java.util.Map;

/**
 * JSON configuration file. Every field is optional; absent fields keep their defaults.
 * Durations are in milliseconds.
 * Example:
 *   {
 *     "dataDir": "/var/lib/ctxsync",
 *     "retention": 50,
 *     "syncIntervalMillis": 10000,
 *     "l2": { "url": "https://cache.example.com", "token": "...", "timeoutMillis": 300 },
 *     "fieldAuthority": { "title": "A", "crm_*": "B" }
 *   }
 */
public class ConfigFile {
    public String dataDir;
    public Integer adminPort;
    public String systemA;
    public String systemB;

    public Integer retention;
    public Integer maxPayloadBytes;
    public Integer snapshotEvery;

    public Long syncIntervalMillis;
    public Long fetchTimeoutMillis;

    public Long l1TtlMillis;
    public Long l2TtlMillis;
    public Long l3TtlMillis;
    public Long l1MaxSize;
    public L2 l2;
    public String populateTier;

    public Map<String, String> fieldAuthority;

    public Integer embeddingDimensions;
    public Integer indexBatchSize;
    public Integer workerThreads;
    public Long metricsIntervalMillis;

    public static class L2 {
        public String url;
        public String token;
        public Long timeoutMillis;
    }
}
