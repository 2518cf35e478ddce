package com.musicgraph.harvester.cache;

import com.musicgraph.harvester.error.CacheException;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Cache backend stored in a PostgreSQL table.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #createTables()} creates {@code cache_entries(key, value, created_at, expires_at)} if missing.</li>
 *   <li>Writes are upserts keyed by {@code key}; {@code expires_at} is computed from the TTL at write time.</li>
 *   <li>Reads only return rows whose {@code expires_at} is in the future; an expired row found on read is deleted.</li>
 *   <li>{@link #purgeExpired()} bulk-deletes expired rows and stands in for native TTL expiry.</li>
 * </ul>
 * <p>
 * Error Handling: every {@link SQLException} is logged and rethrown as {@link CacheException} so a
 * {@link FallbackCacheService} can switch to its in-process backend.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
@SuppressWarnings("SqlResolve")
public class PostgresCacheService implements CacheServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresCacheService.class);

    private final String url;
    private final String user;
    private final String password;
    private final Clock clock;
    private EmbeddedPostgres embedded;

    /**
     * Constructs a PostgresCacheService with the given connection parameters.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public PostgresCacheService(String url, String user, String password) {
        this(url, user, password, Clock.systemUTC());
    }

    public PostgresCacheService(String url, String user, String password, Clock clock) {
        this.url = url;
        this.user = user;
        this.password = password;
        this.clock = clock;
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    /**
     * Ensures the cache table and its expiry index exist.
     * @throws CacheException if the schema cannot be created
     */
    public void createTables() {
        String table = "CREATE TABLE IF NOT EXISTS cache_entries (" +
                "key TEXT PRIMARY KEY, " +
                "value TEXT, " +
                "created_at TIMESTAMPTZ NOT NULL, " +
                "expires_at TIMESTAMPTZ NOT NULL" +
                ")";
        String index = "CREATE INDEX IF NOT EXISTS cache_entries_expires_at_idx ON cache_entries (expires_at)";
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(table);
            stmt.execute(index);
            logger.info("Ensured cache_entries table exists.");
        } catch (SQLException e) {
            logger.error("Error creating cache table: {}", e.getMessage());
            throw new CacheException("Failed to create cache table", e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        String select = "SELECT value, expires_at FROM cache_entries WHERE key = ?";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(select)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                Instant expiresAt = rs.getTimestamp("expires_at").toInstant();
                if (!expiresAt.isAfter(clock.instant())) {
                    deleteExpired(conn, key);
                    return Optional.empty();
                }
                return Optional.ofNullable(rs.getString("value"));
            }
        } catch (SQLException e) {
            logger.error("Error reading cache key {}: {}", key, e.getMessage());
            throw new CacheException("Failed to read cache key " + key, e);
        }
    }

    private void deleteExpired(Connection conn, String key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM cache_entries WHERE key = ? AND expires_at <= ?")) {
            ps.setString(1, key);
            ps.setTimestamp(2, Timestamp.from(clock.instant()));
            ps.executeUpdate();
        }
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("TTL must be positive: " + ttlSeconds);
        }
        String sql = "INSERT INTO cache_entries (key, value, created_at, expires_at) VALUES (?, ?, ?, ?) " +
                "ON CONFLICT (key) DO UPDATE SET value = EXCLUDED.value, created_at = EXCLUDED.created_at, expires_at = EXCLUDED.expires_at";
        Instant now = clock.instant();
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.setTimestamp(3, Timestamp.from(now));
            ps.setTimestamp(4, Timestamp.from(now.plusSeconds(ttlSeconds)));
            ps.executeUpdate();
        } catch (SQLException e) {
            logger.error("Error writing cache key {}: {}", key, e.getMessage());
            throw new CacheException("Failed to write cache key " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement("DELETE FROM cache_entries WHERE key = ?")) {
            ps.setString(1, key);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            logger.error("Error deleting cache key {}: {}", key, e.getMessage());
            throw new CacheException("Failed to delete cache key " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    @Override
    public void clear() {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            int removed = stmt.executeUpdate("DELETE FROM cache_entries");
            logger.info("Cleared {} cache entries.", removed);
        } catch (SQLException e) {
            logger.error("Error clearing cache: {}", e.getMessage());
            throw new CacheException("Failed to clear cache", e);
        }
    }

    /**
     * Deletes every expired row.
     * @return number of rows removed
     */
    public int purgeExpired() {
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement("DELETE FROM cache_entries WHERE expires_at <= ?")) {
            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            int removed = ps.executeUpdate();
            if (removed > 0) logger.debug("Purged {} expired cache rows", removed);
            return removed;
        } catch (SQLException e) {
            logger.error("Error purging expired cache rows: {}", e.getMessage());
            throw new CacheException("Failed to purge expired cache rows", e);
        }
    }

    /**
     * Starts an embedded PostgreSQL instance on a specific port for local use and returns it.
     * @param dataDir directory under which to store DB data
     * @param port port number for the Postgres server
     * @return EmbeddedPostgres instance
     * @throws CacheException if the server cannot be started
     */
    public static EmbeddedPostgres startEmbedded(String dataDir, int port) {
        try {
            EmbeddedPostgres postgres = EmbeddedPostgres.builder()
                .setDataDirectory(Paths.get(dataDir))
                .setCleanDataDirectory(false)
                .setPort(port)
                .start();
            logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, port);
            return postgres;
        } catch (Exception e) {
            logger.error("Failed to start embedded PostgreSQL on port {}: {}", port, e.getMessage());
            throw new CacheException("Failed to start embedded PostgreSQL", e);
        }
    }

    /**
     * Builds a cache service pointing at a running embedded instance. The instance is stopped
     * when the returned service is closed.
     */
    public static PostgresCacheService forEmbedded(EmbeddedPostgres postgres) {
        PostgresCacheService service = new PostgresCacheService(
            "jdbc:postgresql://localhost:" + postgres.getPort() + "/postgres", "postgres", "postgres");
        service.embedded = postgres;
        return service;
    }

    @Override
    public synchronized void close() {
        if (embedded == null) return;
        try {
            embedded.close();
            logger.info("Embedded PostgreSQL stopped.");
        } catch (IOException e) {
            logger.warn("Failed to stop embedded PostgreSQL: {}", e.getMessage());
        }
        embedded = null;
    }
}
