package com.musicgraph.harvester.error;

/**
 * Cache backend failure. Raised to callers only when every configured backend failed a write.
 */
public class CacheException extends HarvesterException {
    public CacheException(String message) {
        super(message, true);
    }

    public CacheException(String message, Throwable cause) {
        super(message, true, cause);
    }
}
