package com.musicgraph.harvester.cache;

import java.util.Optional;

/**
 * Key-value cache with per-entry time-to-live.
 * <p>
 * Values are opaque strings; callers serialize structured values themselves (JSON through Jackson).
 * Implementations must be safe for concurrent use.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public interface CacheServiceInterface extends AutoCloseable {
    /**
     * Looks up a live entry.
     * @param key cache key
     * @return the value, or empty when absent or expired
     * @throws com.musicgraph.harvester.error.CacheException if the backend cannot be reached
     */
    Optional<String> get(String key);

    /**
     * Stores a value.
     * @param key cache key
     * @param value value to store
     * @param ttlSeconds time-to-live in seconds, must be positive
     * @throws com.musicgraph.harvester.error.CacheException if the write failed
     */
    void set(String key, String value, long ttlSeconds);

    /**
     * Removes an entry.
     * @param key cache key
     * @return true if an entry was removed
     */
    boolean delete(String key);

    /**
     * @param key cache key
     * @return true if a live entry exists
     */
    boolean exists(String key);

    /**
     * Removes every entry.
     */
    void clear();

    /**
     * Starts background maintenance owned by this cache, if any. Idempotent.
     */
    default void start() {
    }

    /**
     * Stops background maintenance and releases resources. Idempotent.
     */
    @Override
    default void close() {
    }
}
