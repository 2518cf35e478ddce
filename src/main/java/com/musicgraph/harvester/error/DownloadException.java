package com.musicgraph.harvester.error;

/**
 * Business-rule rejection of a download (no media URL, oversize payload). Not retried.
 */
public class DownloadException extends HarvesterException {
    private final String trackId;

    public DownloadException(String message, String trackId) {
        super(message, false);
        this.trackId = trackId;
    }

    public String getTrackId() {
        return trackId;
    }
}
