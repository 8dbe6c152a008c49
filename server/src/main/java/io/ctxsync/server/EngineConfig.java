// file: server/src/main/java/io/ctxsync/server/EngineConfig.java
package io.ctxsync.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.ctxsync.cache.Tier;
import io.ctxsync.index.HashingEmbeddingProvider;
import io.ctxsync.index.VectorIndexer;
import io.ctxsync.server.dto.ConfigFile;
import io.ctxsync.storage.StoreOptions;
import io.ctxsync.sync.SyncOptions;
import io.ctxsync.sync.SyncScheduler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Process configuration: CLI flags, optionally on top of a JSON file.
 *
 * Precedence: defaults < JSON file (--config) < explicit CLI flags.
 *
 * Supported flags:
 *   --config,     -c  <path>   JSON file (see {@link ConfigFile})
 *   --data-dir,   -d  <path>   WAL, snapshots and the L3 cache live below it
 *   --admin-port, -p  <port>   admin HTTP listener
 *   --system-a        <url>    base URL of producer A
 *   --system-b        <url>    base URL of producer B
 *   --help,       -h
 */
public record EngineConfig(
        Path dataDir,
        int adminPort,
        URI systemA,
        URI systemB,
        StoreOptions store,
        Duration syncInterval,
        Duration fetchTimeout,
        Map<Tier, Duration> tierTtls,
        long l1MaxSize,
        URI l2Url,
        String l2Token,
        Duration l2Timeout,
        Tier populateTier,
        Map<String, String> fieldAuthority,
        int embeddingDimensions,
        int indexBatchSize,
        int workerThreads,
        Duration metricsInterval
) {
    public static final int DEFAULT_ADMIN_PORT = 8090;

    public EngineConfig {
        Objects.requireNonNull(dataDir, "dataDir");
        Objects.requireNonNull(store, "store");
        if (adminPort < 0 || adminPort > 65535) throw new IllegalArgumentException("admin port out of range: " + adminPort);
        tierTtls = Map.copyOf(tierTtls);
        fieldAuthority = Map.copyOf(fieldAuthority);
        if (l2Url != null && (l2Token == null || l2Token.isBlank())) {
            throw new IllegalArgumentException("an L2 url needs an L2 token");
        }
        if (workerThreads <= 0) throw new IllegalArgumentException("workerThreads must be > 0");
    }

    public static EngineConfig defaults() {
        return new Builder().build();
    }

    public Duration ttl(Tier tier) {
        return tierTtls.get(tier);
    }

    public SyncOptions syncOptions() {
        return SyncOptions.defaults().withFetchTimeout(fetchTimeout);
    }

    /**
     * Parse CLI flags; a --config file is applied first and flags override it.
     *
     * @throws IllegalArgumentException for unknown flags, missing or malformed values
     */
    public static EngineConfig fromArgs(String[] args) {
        String configPath = null;
        String dataDir = null;
        Integer adminPort = null;
        String systemA = null;
        String systemB = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "-c" -> configPath = requireValue(args, i++);
                case "--data-dir", "-d" -> dataDir = requireValue(args, i++);
                case "--admin-port", "-p" -> adminPort = parseInt("admin-port", requireValue(args, i++));
                case "--system-a" -> systemA = requireValue(args, i++);
                case "--system-b" -> systemB = requireValue(args, i++);
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        Builder b = new Builder();
        if (configPath != null) b.apply(readFile(Path.of(configPath)));
        if (dataDir != null) b.dataDir = Path.of(dataDir);
        if (adminPort != null) b.adminPort = adminPort;
        if (systemA != null) b.systemA = parseUri("system-a", systemA);
        if (systemB != null) b.systemB = parseUri("system-b", systemB);
        return b.build();
    }

    public static boolean wantsHelp(String[] args) {
        for (String a : args) {
            if (a.equals("--help") || a.equals("-h")) return true;
        }
        return false;
    }

    public static String usage() {
        return """
            Usage: ctxsync [options]

            Options:
              --config,     -c   JSON configuration file (optional)
              --data-dir,   -d   Data directory (default: ./data)
              --admin-port, -p   Admin HTTP port (default: 8090)
              --system-a         Base URL of producer system A (optional)
              --system-b         Base URL of producer system B (optional)
              --help,       -h   Show this help message
            """;
    }

    static ConfigFile readFile(Path path) {
        try {
            return new ObjectMapper().readValue(path.toFile(), ConfigFile.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + path, e);
        }
    }

    // ---------- parsing helpers ----------

    private static String requireValue(String[] args, int i) {
        if (i + 1 >= args.length) throw new IllegalArgumentException("Missing value for option: " + args[i]);
        return args[i + 1];
    }

    private static int parseInt(String name, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + raw, e);
        }
    }

    private static URI parseUri(String name, String raw) {
        try {
            URI u = URI.create(raw);
            if (u.getScheme() == null || u.getHost() == null) throw new IllegalArgumentException("not absolute");
            return u;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + name + " URL: " + raw, e);
        }
    }

    private static Duration millis(String name, long ms) {
        if (ms <= 0) throw new IllegalArgumentException(name + " must be > 0 ms");
        return Duration.ofMillis(ms);
    }

    /** Mutable collector with every default in one place. */
    static final class Builder {
        Path dataDir = Path.of("./data");
        int adminPort = DEFAULT_ADMIN_PORT;
        URI systemA;
        URI systemB;
        StoreOptions store = StoreOptions.defaults();
        Duration syncInterval = SyncScheduler.DEFAULT_INTERVAL;
        Duration fetchTimeout = SyncOptions.DEFAULT_FETCH_TIMEOUT;
        Duration l1Ttl = Tier.L1.defaultTtl();
        Duration l2Ttl = Tier.L2.defaultTtl();
        Duration l3Ttl = Tier.L3.defaultTtl();
        long l1MaxSize = 10_000;
        URI l2Url;
        String l2Token;
        Duration l2Timeout = Duration.ofMillis(500);
        Tier populateTier = Tier.L3;
        Map<String, String> fieldAuthority = Map.of();
        int embeddingDimensions = HashingEmbeddingProvider.DEFAULT_DIMENSIONS;
        int indexBatchSize = VectorIndexer.DEFAULT_BATCH_SIZE;
        int workerThreads = 8;
        Duration metricsInterval = Duration.ofSeconds(60);

        void apply(ConfigFile f) {
            if (f.dataDir != null) dataDir = Path.of(f.dataDir);
            if (f.adminPort != null) adminPort = f.adminPort;
            if (f.systemA != null) systemA = parseUri("systemA", f.systemA);
            if (f.systemB != null) systemB = parseUri("systemB", f.systemB);
            if (f.retention != null) store = store.withRetention(f.retention);
            if (f.maxPayloadBytes != null) store = store.withMaxPayloadBytes(f.maxPayloadBytes);
            if (f.snapshotEvery != null) store = store.withSnapshotEvery(f.snapshotEvery);
            if (f.syncIntervalMillis != null) syncInterval = millis("syncIntervalMillis", f.syncIntervalMillis);
            if (f.fetchTimeoutMillis != null) fetchTimeout = millis("fetchTimeoutMillis", f.fetchTimeoutMillis);
            if (f.l1TtlMillis != null) l1Ttl = millis("l1TtlMillis", f.l1TtlMillis);
            if (f.l2TtlMillis != null) l2Ttl = millis("l2TtlMillis", f.l2TtlMillis);
            if (f.l3TtlMillis != null) l3Ttl = millis("l3TtlMillis", f.l3TtlMillis);
            if (f.l1MaxSize != null) l1MaxSize = f.l1MaxSize;
            if (f.l2 != null) {
                if (f.l2.url != null) l2Url = parseUri("l2.url", f.l2.url);
                if (f.l2.token != null) l2Token = f.l2.token;
                if (f.l2.timeoutMillis != null) l2Timeout = millis("l2.timeoutMillis", f.l2.timeoutMillis);
            }
            if (f.populateTier != null) populateTier = Tier.valueOf(f.populateTier.trim().toUpperCase(Locale.ROOT));
            if (f.fieldAuthority != null) fieldAuthority = f.fieldAuthority;
            if (f.embeddingDimensions != null) embeddingDimensions = f.embeddingDimensions;
            if (f.indexBatchSize != null) indexBatchSize = f.indexBatchSize;
            if (f.workerThreads != null) workerThreads = f.workerThreads;
            if (f.metricsIntervalMillis != null) metricsInterval = millis("metricsIntervalMillis", f.metricsIntervalMillis);
        }

        EngineConfig build() {
            return new EngineConfig(dataDir, adminPort, systemA, systemB, store, syncInterval, fetchTimeout,
                    Map.of(Tier.L1, l1Ttl, Tier.L2, l2Ttl, Tier.L3, l3Ttl), l1MaxSize,
                    l2Url, l2Token, l2Timeout, populateTier, fieldAuthority,
                    embeddingDimensions, indexBatchSize, workerThreads, metricsInterval);
        }
    }
}
