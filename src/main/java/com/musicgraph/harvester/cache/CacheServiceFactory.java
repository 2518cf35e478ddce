package com.musicgraph.harvester.cache;

import com.musicgraph.harvester.HarvesterConfig;
import com.musicgraph.harvester.error.CacheException;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Builds the cache selected by {@code CACHE_BACKEND}.
 * <ul>
 *   <li>{@code memory}: a plain {@link InMemoryCacheService}.</li>
 *   <li>{@code postgres}: {@link PostgresCacheService} on {@code DB_URL} behind a {@link FallbackCacheService}.</li>
 *   <li>{@code embedded}: same, on an embedded PostgreSQL started under {@code EMBEDDED_PG_DATA_DIR}.</li>
 * </ul>
 * If the database cannot be prepared the in-process cache is used alone.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public final class CacheServiceFactory {
    private static final Logger logger = LoggerFactory.getLogger(CacheServiceFactory.class);

    private CacheServiceFactory() {
    }

    /**
     * @param config runtime configuration
     * @return a started cache; the caller owns it and must close it
     */
    public static CacheServiceInterface create(HarvesterConfig config) {
        InMemoryCacheService memory = new InMemoryCacheService(Clock.systemUTC(),
            Duration.ofSeconds(Math.max(1, config.cacheSweepIntervalSeconds())));
        CacheServiceInterface cache = memory;
        switch (config.cacheBackend()) {
            case "postgres":
                if (config.dbUrl() == null || config.dbUrl().isBlank()) {
                    logger.warn("CACHE_BACKEND=postgres but DB_URL is empty; using in-memory cache");
                    break;
                }
                cache = withDatabase(new PostgresCacheService(config.dbUrl(), config.dbUser(), config.dbPass()), memory);
                break;
            case "embedded":
                try {
                    EmbeddedPostgres postgres = PostgresCacheService.startEmbedded(config.embeddedPgDataDir(), config.embeddedPgPort());
                    cache = withDatabase(PostgresCacheService.forEmbedded(postgres), memory);
                } catch (CacheException e) {
                    logger.warn("Embedded PostgreSQL unavailable ({}); using in-memory cache", e.getMessage());
                }
                break;
            case "memory":
                break;
            default:
                logger.warn("Unknown CACHE_BACKEND '{}'; using in-memory cache", config.cacheBackend());
        }
        cache.start();
        logger.info("Cache backend: {}", cache.getClass().getSimpleName());
        return cache;
    }

    private static CacheServiceInterface withDatabase(PostgresCacheService database, InMemoryCacheService memory) {
        try {
            database.createTables();
            database.purgeExpired();
        } catch (CacheException e) {
            logger.warn("PostgreSQL cache unavailable ({}); using in-memory cache", e.getMessage());
            database.close();
            return memory;
        }
        return new FallbackCacheService(database, memory);
    }
}
