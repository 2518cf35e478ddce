package com.musicgraph.harvester.model;

import java.time.Duration;

/**
 * Totals reported at the end of (or on interruption of) a run.
 *
 * @param artistsProcessed artists whose tracks were handled in this run
 * @param artistsSkipped artists skipped because a resumed checkpoint already covered them
 * @param tracksDownloaded tracks materialized
 * @param tracksFailed tracks that failed
 * @param totalBytes bytes of materialized tracks
 * @param duration wall-clock run time
 */
public record RunStatistics(
    int artistsProcessed,
    int artistsSkipped,
    int tracksDownloaded,
    int tracksFailed,
    long totalBytes,
    Duration duration
) {
    public double totalMegabytes() {
        return totalBytes / (1024.0 * 1024.0);
    }

    /**
     * @return seconds per downloaded track, or 0 when nothing was downloaded
     */
    public double averageSecondsPerTrack() {
        if (tracksDownloaded == 0) return 0.0;
        return duration.toMillis() / 1000.0 / tracksDownloaded;
    }
}
