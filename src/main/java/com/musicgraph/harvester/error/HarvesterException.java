package com.musicgraph.harvester.error;

/**
 * Base class of every failure raised by the harvester.
 * <p>
 * Failures are unchecked: per-entity failures are caught and counted by the discovery and
 * download loops, and only seed resolution or sustained upstream failure reaches the command line.
 * The {@code retryable} flag tells callers whether an immediate retry may succeed.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class HarvesterException extends RuntimeException {
    private final boolean retryable;

    public HarvesterException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public HarvesterException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
