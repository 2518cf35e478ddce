package com.musicgraph.harvester.model;

/**
 * Result of one download request.
 *
 * @param request originating request
 * @param success whether the output path now holds the track
 * @param track track augmented with file path and size on success, the requested track otherwise
 * @param error failure message, null on success
 */
public record DownloadOutcome(DownloadRequest request, boolean success, Track track, String error) {

    public static DownloadOutcome succeeded(DownloadRequest request, Track track) {
        return new DownloadOutcome(request, true, track, null);
    }

    public static DownloadOutcome failed(DownloadRequest request, String error) {
        return new DownloadOutcome(request, false, request.track(), error);
    }
}
