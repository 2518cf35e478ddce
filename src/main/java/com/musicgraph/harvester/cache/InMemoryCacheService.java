package com.musicgraph.harvester.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.musicgraph.harvester.model.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-process cache backed by a Caffeine {@link Cache} with per-entry expiry.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Each entry expires once more than its own TTL has elapsed since it was last written.</li>
 *   <li>Caffeine reads time through a ticker fed by the injected {@link Clock} so tests can move time forward.</li>
 *   <li>{@link #start()} schedules a periodic {@code cleanUp()} on a single daemon thread owned by this instance;
 *       {@link #close()} cancels it. Without {@code start()} expired entries are dropped during normal cache maintenance.</li>
 * </ul>
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class InMemoryCacheService implements CacheServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryCacheService.class);

    private final Cache<String, CacheEntry> entries;
    private final Clock clock;
    private final Duration sweepInterval;
    private ScheduledExecutorService sweeper;

    public InMemoryCacheService() {
        this(Clock.systemUTC(), Duration.ofMinutes(5));
    }

    /**
     * @param clock time source used for expiry
     * @param sweepInterval interval between background sweeps
     */
    public InMemoryCacheService(Clock clock, Duration sweepInterval) {
        this.clock = clock;
        this.sweepInterval = sweepInterval;
        Instant origin = clock.instant();
        Ticker ticker = () -> Duration.between(origin, clock.instant()).toNanos();
        this.entries = Caffeine.newBuilder()
            .ticker(ticker)
            .executor(Runnable::run)
            .expireAfter(new EntryExpiry())
            .build();
    }

    /**
     * Live for exactly the entry's TTL; one extra nanosecond keeps an entry readable at the boundary.
     */
    private static final class EntryExpiry implements Expiry<String, CacheEntry> {
        private static long lifetimeNanos(CacheEntry entry) {
            return TimeUnit.SECONDS.toNanos(entry.ttlSeconds()) + 1;
        }

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return lifetimeNanos(entry);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return lifetimeNanos(entry);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    @Override
    public Optional<String> get(String key) {
        CacheEntry entry = entries.getIfPresent(key);
        if (entry == null) return Optional.empty();
        return Optional.ofNullable(entry.value());
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Cache key cannot be null or empty");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("TTL must be positive: " + ttlSeconds);
        }
        entries.put(key, new CacheEntry(key, value, clock.instant(), ttlSeconds));
    }

    @Override
    public boolean delete(String key) {
        return entries.asMap().remove(key) != null;
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    @Override
    public void clear() {
        entries.invalidateAll();
    }

    /**
     * Runs Caffeine's pending maintenance, which drops every expired entry.
     * @return number of entries removed
     */
    public int sweepExpired() {
        long before = entries.estimatedSize();
        entries.cleanUp();
        int removed = (int) Math.max(0, before - entries.estimatedSize());
        if (removed > 0) {
            logger.debug("Swept {} expired cache entries", removed);
        }
        return removed;
    }

    public int size() {
        entries.cleanUp();
        return (int) entries.estimatedSize();
    }

    @Override
    public synchronized void start() {
        if (sweeper != null) return;
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-sweeper");
            t.setDaemon(true);
            return t;
        });
        long millis = sweepInterval.toMillis();
        sweeper.scheduleWithFixedDelay(this::safeSweep, millis, millis, TimeUnit.MILLISECONDS);
        logger.debug("Cache sweeper started (interval {}s)", sweepInterval.toSeconds());
    }

    public synchronized boolean isSweeping() {
        return sweeper != null && !sweeper.isShutdown();
    }

    private void safeSweep() {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            logger.error("Cache sweep failed: {}", e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        if (sweeper == null) return;
        sweeper.shutdownNow();
        sweeper = null;
        logger.debug("Cache sweeper stopped");
    }
}
