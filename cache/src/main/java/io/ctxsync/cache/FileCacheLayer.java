package io.ctxsync.cache;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * L3: durable cache tier, one JSON file per key.
 * <p>
 * File name is the SHA-256 of the key so arbitrary ids are safe on disk.
 * Writes go to a temp file and are moved into place, so readers never see a
 * half-written entry. A file that cannot be decoded is deleted and reported
 * as a miss.
 */
public final class FileCacheLayer implements CacheLayer {
    private static final Logger LOG = Logger.getLogger(FileCacheLayer.class.getName());
    private static final String SUFFIX = ".json";

    private final Path dir;

    public FileCacheLayer(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create cache directory " + dir, e);
        }
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        Path file = fileFor(key);
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CacheLayerUnavailableException("cannot read " + file, e);
        }
        try {
            return Optional.of(CacheEntryCodec.decode(json));
        } catch (CacheLayerUnavailableException e) {
            LOG.warning(() -> "Dropping unreadable cache file " + file.getFileName() + ": " + e.getMessage());
            remove(key);
            return Optional.empty();
        }
    }

    @Override
    public void put(CacheEntry entry, Duration ttl) {
        Path file = fileFor(entry.key());
        Path tmp = null;
        try {
            // one temp file per write; concurrent puts to a key each move their own
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            Files.writeString(tmp, CacheEntryCodec.encode(entry), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            CacheLayerUnavailableException failure = new CacheLayerUnavailableException("cannot write " + file, e);
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    @Override
    public void remove(String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new CacheLayerUnavailableException("cannot delete cache file for " + key, e);
        }
    }

    @Override
    public long size() {
        return files().size();
    }

    @Override
    public void flush() {
        // every put is already on disk
    }

    @Override
    public int purgeExpired(Instant now) {
        int purged = 0;
        for (Path file : files()) {
            try {
                CacheEntry e = CacheEntryCodec.decode(Files.readString(file, StandardCharsets.UTF_8));
                if (!e.isExpired(now)) continue;
            } catch (NoSuchFileException e) {
                continue;
            } catch (IOException | CacheLayerUnavailableException e) {
                LOG.fine(() -> "Purging unreadable cache file " + file.getFileName());
            }
            try {
                if (Files.deleteIfExists(file)) purged++;
            } catch (IOException e) {
                throw new CacheLayerUnavailableException("cannot delete " + file, e);
            }
        }
        return purged;
    }

    @Override
    public void close() {
        // nothing held open
    }

    // ---------- helpers ----------

    private Path fileFor(String key) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            return dir.resolve(HexFormat.of().formatHex(digest) + SUFFIX);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private List<Path> files() {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).collect(Collectors.toList());
        } catch (IOException e) {
            throw new CacheLayerUnavailableException("cannot list " + dir, e);
        }
    }
}
