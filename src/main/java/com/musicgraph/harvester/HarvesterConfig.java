package com.musicgraph.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;

/**
 * Immutable runtime configuration, built once at startup and passed to every component.
 * <p>
 * Values are read from environment variables first, then Java system properties of the same
 * name, then the defaults below. Command-line flags override individual values through the
 * {@code with...} copy methods.
 * <ul>
 *   <li>{@code STORAGE_DIR} ({@code ./storage}), {@code SONGS_CACHE_DIR}, {@code PROGRESS_DIR}</li>
 *   <li>{@code MAX_FILE_SIZE_MB} (100), {@code DOWNLOAD_CHUNK_SIZE} (8192)</li>
 *   <li>{@code SONGS_CACHE_TTL} (0 meaning ten years), {@code FAILED_TRACK_TTL} (300)</li>
 *   <li>{@code MAX_CONCURRENT_DOWNLOADS} (2), {@code DISCOVERY_BATCH_SIZE} (10),
 *       {@code SIMILAR_FETCH_CONCURRENCY} (3), {@code DISCOVERY_BATCH_PAUSE_MS} (500)</li>
 *   <li>{@code CACHE_BACKEND} ({@code memory}, {@code postgres} or {@code embedded}),
 *       {@code CACHE_SWEEP_INTERVAL_SECONDS} (300), {@code DB_URL}, {@code DB_USER}, {@code DB_PASS},
 *       {@code EMBEDDED_PG_PORT} (5432), {@code EMBEDDED_PG_DATA_DIR}</li>
 *   <li>{@code CATALOG_BASE_URL}, {@code CATALOG_TOKEN}, {@code CATALOG_TIMEOUT_SECONDS} (30)</li>
 * </ul>
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public final class HarvesterConfig {
    private static final Logger logger = LoggerFactory.getLogger(HarvesterConfig.class);

    static final long TEN_YEARS_SECONDS = Duration.ofDays(3650).toSeconds();

    private final Path storageDir;
    private final Path songsCacheDir;
    private final Path progressDir;
    private final long maxFileSizeMb;
    private final int downloadChunkSize;
    private final long songsCacheTtlSeconds;
    private final long failedTrackTtlSeconds;
    private final int maxConcurrentDownloads;
    private final int discoveryBatchSize;
    private final int similarFetchConcurrency;
    private final long discoveryBatchPauseMs;
    private final long cacheSweepIntervalSeconds;
    private final String cacheBackend;
    private final String dbUrl;
    private final String dbUser;
    private final String dbPass;
    private final int embeddedPgPort;
    private final String embeddedPgDataDir;
    private final String catalogBaseUrl;
    private final String catalogToken;
    private final int catalogTimeoutSeconds;

    private HarvesterConfig(Builder b) {
        this.storageDir = b.storageDir;
        this.songsCacheDir = b.songsCacheDir;
        this.progressDir = b.progressDir;
        this.maxFileSizeMb = b.maxFileSizeMb;
        this.downloadChunkSize = b.downloadChunkSize;
        this.songsCacheTtlSeconds = b.songsCacheTtlSeconds;
        this.failedTrackTtlSeconds = b.failedTrackTtlSeconds;
        this.maxConcurrentDownloads = b.maxConcurrentDownloads;
        this.discoveryBatchSize = b.discoveryBatchSize;
        this.similarFetchConcurrency = b.similarFetchConcurrency;
        this.discoveryBatchPauseMs = b.discoveryBatchPauseMs;
        this.cacheSweepIntervalSeconds = b.cacheSweepIntervalSeconds;
        this.cacheBackend = b.cacheBackend;
        this.dbUrl = b.dbUrl;
        this.dbUser = b.dbUser;
        this.dbPass = b.dbPass;
        this.embeddedPgPort = b.embeddedPgPort;
        this.embeddedPgDataDir = b.embeddedPgDataDir;
        this.catalogBaseUrl = b.catalogBaseUrl;
        this.catalogToken = b.catalogToken;
        this.catalogTimeoutSeconds = b.catalogTimeoutSeconds;
        if (maxConcurrentDownloads < 1) throw new IllegalArgumentException("MAX_CONCURRENT_DOWNLOADS must be >= 1");
        if (discoveryBatchSize < 1) throw new IllegalArgumentException("DISCOVERY_BATCH_SIZE must be >= 1");
        if (similarFetchConcurrency < 1) throw new IllegalArgumentException("SIMILAR_FETCH_CONCURRENCY must be >= 1");
        if (downloadChunkSize < 1) throw new IllegalArgumentException("DOWNLOAD_CHUNK_SIZE must be >= 1");
        if (failedTrackTtlSeconds < 1) throw new IllegalArgumentException("FAILED_TRACK_TTL must be >= 1");
    }

    /**
     * Reads the configuration from the environment and system properties.
     * @return configuration snapshot
     */
    public static HarvesterConfig fromEnvironment() {
        Builder b = builder();
        String storage = envOrProp("STORAGE_DIR", "./storage");
        b.storageDir(Paths.get(storage));
        b.songsCacheDir(Paths.get(envOrProp("SONGS_CACHE_DIR", Paths.get(storage, "downloads", "tracks").toString())));
        b.progressDir(Paths.get(envOrProp("PROGRESS_DIR", Paths.get(storage, "progress").toString())));
        b.maxFileSizeMb(longOrDefault("MAX_FILE_SIZE_MB", 100));
        b.downloadChunkSize((int) longOrDefault("DOWNLOAD_CHUNK_SIZE", 8192));
        b.songsCacheTtlSeconds(longOrDefault("SONGS_CACHE_TTL", 0));
        b.failedTrackTtlSeconds(longOrDefault("FAILED_TRACK_TTL", 300));
        b.maxConcurrentDownloads((int) longOrDefault("MAX_CONCURRENT_DOWNLOADS", 2));
        b.discoveryBatchSize((int) longOrDefault("DISCOVERY_BATCH_SIZE", 10));
        b.similarFetchConcurrency((int) longOrDefault("SIMILAR_FETCH_CONCURRENCY", 3));
        b.discoveryBatchPauseMs(longOrDefault("DISCOVERY_BATCH_PAUSE_MS", 500));
        b.cacheSweepIntervalSeconds(longOrDefault("CACHE_SWEEP_INTERVAL_SECONDS", 300));
        b.cacheBackend(envOrProp("CACHE_BACKEND", "memory"));
        b.dbUrl(envOrProp("DB_URL", ""));
        b.dbUser(envOrProp("DB_USER", "postgres"));
        b.dbPass(envOrProp("DB_PASS", ""));
        b.embeddedPgPort((int) longOrDefault("EMBEDDED_PG_PORT", 5432));
        b.embeddedPgDataDir(envOrProp("EMBEDDED_PG_DATA_DIR", Paths.get(storage, "pgdata").toString()));
        b.catalogBaseUrl(envOrProp("CATALOG_BASE_URL", "http://localhost:8080/api"));
        b.catalogToken(envOrProp("CATALOG_TOKEN", ""));
        b.catalogTimeoutSeconds((int) longOrDefault("CATALOG_TIMEOUT_SECONDS", 30));
        return b.build();
    }

    static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop : defaultVal;
    }

    private static long longOrDefault(String key, long defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null) return defaultVal;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}, using {}", raw, key, defaultVal);
            return defaultVal;
        }
    }

    public HarvesterConfig withMaxConcurrentDownloads(int value) {
        return toBuilder().maxConcurrentDownloads(value).build();
    }

    public Path storageDir() { return storageDir; }
    public Path songsCacheDir() { return songsCacheDir; }
    public Path progressDir() { return progressDir; }
    public long maxFileSizeMb() { return maxFileSizeMb; }
    public long maxFileSizeBytes() { return maxFileSizeMb * 1024L * 1024L; }
    public int downloadChunkSize() { return downloadChunkSize; }
    public long songsCacheTtlSeconds() { return songsCacheTtlSeconds; }
    public long failedTrackTtlSeconds() { return failedTrackTtlSeconds; }
    public int maxConcurrentDownloads() { return maxConcurrentDownloads; }
    public int discoveryBatchSize() { return discoveryBatchSize; }
    public int similarFetchConcurrency() { return similarFetchConcurrency; }
    public long discoveryBatchPauseMs() { return discoveryBatchPauseMs; }
    public long cacheSweepIntervalSeconds() { return cacheSweepIntervalSeconds; }
    public String cacheBackend() { return cacheBackend; }
    public String dbUrl() { return dbUrl; }
    public String dbUser() { return dbUser; }
    public String dbPass() { return dbPass; }
    public int embeddedPgPort() { return embeddedPgPort; }
    public String embeddedPgDataDir() { return embeddedPgDataDir; }
    public String catalogBaseUrl() { return catalogBaseUrl; }
    public String catalogToken() { return catalogToken; }
    public int catalogTimeoutSeconds() { return catalogTimeoutSeconds; }

    /**
     * @return positive-cache TTL for downloaded tracks; 0 is mapped to ten years
     */
    public long effectiveSongsCacheTtlSeconds() {
        return songsCacheTtlSeconds <= 0 ? TEN_YEARS_SECONDS : songsCacheTtlSeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .storageDir(storageDir)
            .songsCacheDir(songsCacheDir)
            .progressDir(progressDir)
            .maxFileSizeMb(maxFileSizeMb)
            .downloadChunkSize(downloadChunkSize)
            .songsCacheTtlSeconds(songsCacheTtlSeconds)
            .failedTrackTtlSeconds(failedTrackTtlSeconds)
            .maxConcurrentDownloads(maxConcurrentDownloads)
            .discoveryBatchSize(discoveryBatchSize)
            .similarFetchConcurrency(similarFetchConcurrency)
            .discoveryBatchPauseMs(discoveryBatchPauseMs)
            .cacheSweepIntervalSeconds(cacheSweepIntervalSeconds)
            .cacheBackend(cacheBackend)
            .dbUrl(dbUrl)
            .dbUser(dbUser)
            .dbPass(dbPass)
            .embeddedPgPort(embeddedPgPort)
            .embeddedPgDataDir(embeddedPgDataDir)
            .catalogBaseUrl(catalogBaseUrl)
            .catalogToken(catalogToken)
            .catalogTimeoutSeconds(catalogTimeoutSeconds);
    }

    /**
     * Builder initialised with the documented defaults. Used by tests and by {@link #fromEnvironment()}.
     */
    public static final class Builder {
        private Path storageDir = Paths.get("./storage");
        private Path songsCacheDir = Paths.get("./storage/downloads/tracks");
        private Path progressDir = Paths.get("./storage/progress");
        private long maxFileSizeMb = 100;
        private int downloadChunkSize = 8192;
        private long songsCacheTtlSeconds = 0;
        private long failedTrackTtlSeconds = 300;
        private int maxConcurrentDownloads = 2;
        private int discoveryBatchSize = 10;
        private int similarFetchConcurrency = 3;
        private long discoveryBatchPauseMs = 500;
        private long cacheSweepIntervalSeconds = 300;
        private String cacheBackend = "memory";
        private String dbUrl = "";
        private String dbUser = "postgres";
        private String dbPass = "";
        private int embeddedPgPort = 5432;
        private String embeddedPgDataDir = "./storage/pgdata";
        private String catalogBaseUrl = "http://localhost:8080/api";
        private String catalogToken = "";
        private int catalogTimeoutSeconds = 30;

        private Builder() {
        }

        public Builder storageDir(Path value) { this.storageDir = value; return this; }
        public Builder songsCacheDir(Path value) { this.songsCacheDir = value; return this; }
        public Builder progressDir(Path value) { this.progressDir = value; return this; }
        public Builder maxFileSizeMb(long value) { this.maxFileSizeMb = value; return this; }
        public Builder downloadChunkSize(int value) { this.downloadChunkSize = value; return this; }
        public Builder songsCacheTtlSeconds(long value) { this.songsCacheTtlSeconds = value; return this; }
        public Builder failedTrackTtlSeconds(long value) { this.failedTrackTtlSeconds = value; return this; }
        public Builder maxConcurrentDownloads(int value) { this.maxConcurrentDownloads = value; return this; }
        public Builder discoveryBatchSize(int value) { this.discoveryBatchSize = value; return this; }
        public Builder similarFetchConcurrency(int value) { this.similarFetchConcurrency = value; return this; }
        public Builder discoveryBatchPauseMs(long value) { this.discoveryBatchPauseMs = value; return this; }
        public Builder cacheSweepIntervalSeconds(long value) { this.cacheSweepIntervalSeconds = value; return this; }
        public Builder cacheBackend(String value) { this.cacheBackend = value == null ? "memory" : value.trim().toLowerCase(Locale.ROOT); return this; }
        public Builder dbUrl(String value) { this.dbUrl = value; return this; }
        public Builder dbUser(String value) { this.dbUser = value; return this; }
        public Builder dbPass(String value) { this.dbPass = value; return this; }
        public Builder embeddedPgPort(int value) { this.embeddedPgPort = value; return this; }
        public Builder embeddedPgDataDir(String value) { this.embeddedPgDataDir = value; return this; }
        public Builder catalogBaseUrl(String value) { this.catalogBaseUrl = value; return this; }
        public Builder catalogToken(String value) { this.catalogToken = value; return this; }
        public Builder catalogTimeoutSeconds(int value) { this.catalogTimeoutSeconds = value; return this; }

        public HarvesterConfig build() {
            return new HarvesterConfig(this);
        }
    }
}
