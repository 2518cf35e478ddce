package com.musicgraph.harvester.cache;

import com.musicgraph.harvester.error.CacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Composite cache that prefers a primary backend and falls back to an in-process one.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Reads go to the primary; a primary failure is logged and the read is answered by the fallback.</li>
 *   <li>Writes go to the primary; on primary failure the value is written to the fallback instead.
 *       Only when both writes fail is a {@link CacheException} raised.</li>
 *   <li>{@code delete} and {@code clear} are applied to both backends.</li>
 *   <li>{@code start}/{@code close} drive the fallback's sweeper and close the primary.</li>
 * </ul>
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class FallbackCacheService implements CacheServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(FallbackCacheService.class);

    private final CacheServiceInterface primary;
    private final InMemoryCacheService fallback;

    public FallbackCacheService(CacheServiceInterface primary, InMemoryCacheService fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            Optional<String> value = primary.get(key);
            if (value.isPresent()) return value;
        } catch (RuntimeException e) {
            logger.warn("Primary cache read failed for {}, using fallback: {}", key, e.getMessage());
        }
        return fallback.get(key);
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        try {
            primary.set(key, value, ttlSeconds);
            return;
        } catch (RuntimeException e) {
            logger.warn("Primary cache write failed for {}, using fallback: {}", key, e.getMessage());
        }
        try {
            fallback.set(key, value, ttlSeconds);
        } catch (RuntimeException e) {
            logger.error("Fallback cache write failed for {}: {}", key, e.getMessage());
            throw new CacheException("All cache backends failed to store " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        boolean removed = false;
        try {
            removed = primary.delete(key);
        } catch (RuntimeException e) {
            logger.warn("Primary cache delete failed for {}: {}", key, e.getMessage());
        }
        return fallback.delete(key) || removed;
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    @Override
    public void clear() {
        try {
            primary.clear();
        } catch (RuntimeException e) {
            logger.warn("Primary cache clear failed: {}", e.getMessage());
        }
        fallback.clear();
    }

    @Override
    public void start() {
        primary.start();
        fallback.start();
    }

    @Override
    public void close() {
        fallback.close();
        try {
            primary.close();
        } catch (RuntimeException e) {
            logger.warn("Failed to close primary cache: {}", e.getMessage());
        }
    }
}
