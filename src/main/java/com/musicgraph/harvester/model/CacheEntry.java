package com.musicgraph.harvester.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Cache entry with a time-to-live.
 *
 * @param key cache key
 * @param value stored value
 * @param createdAt creation time
 * @param ttlSeconds time-to-live in seconds
 */
public record CacheEntry(String key, String value, Instant createdAt, long ttlSeconds) {

    /**
     * @param now current time
     * @return true once more than {@code ttlSeconds} have elapsed since creation
     */
    public boolean isExpired(Instant now) {
        return Duration.between(createdAt, now).compareTo(Duration.ofSeconds(ttlSeconds)) > 0;
    }
}
