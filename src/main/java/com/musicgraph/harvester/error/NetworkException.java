package com.musicgraph.harvester.error;

/**
 * Transport failure talking to a remote host. Retryable; the downloader records a short-lived
 * negative cache entry for the item.
 */
public class NetworkException extends HarvesterException {
    public NetworkException(String message) {
        super(message, true);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, true, cause);
    }
}
