package com.musicgraph.harvester.model;

/**
 * Incremental progress report emitted by discovery and download.
 *
 * @param type phase that produced the update
 * @param progressPercent 0..100
 * @param currentItem artist or track currently handled (may be null)
 * @param itemsCompleted finished units
 * @param itemsTotal total units, 0 when unknown
 * @param currentDepth discovery level, null for downloads
 * @param maxDepth configured maximum depth, null for downloads
 * @param discoveredCount artists discovered so far, null for downloads
 * @param etaSeconds estimated seconds remaining, null when not estimated
 */
public record ProgressUpdate(
    ProgressType type,
    double progressPercent,
    String currentItem,
    int itemsCompleted,
    int itemsTotal,
    Integer currentDepth,
    Integer maxDepth,
    Integer discoveredCount,
    Long etaSeconds
) {
    public static ProgressUpdate discovery(int depth, int maxDepth, String currentArtist, int discovered, int target) {
        double percent = target <= 0 ? 0.0 : Math.min(100.0, discovered * 100.0 / target);
        return new ProgressUpdate(ProgressType.DISCOVERY, percent, currentArtist, discovered, target, depth, maxDepth, discovered, null);
    }

    public static ProgressUpdate download(String currentItem, int completed, int total, long etaSeconds) {
        double percent = total <= 0 ? 100.0 : completed * 100.0 / total;
        return new ProgressUpdate(ProgressType.DOWNLOAD, percent, currentItem, completed, total, null, null, null, etaSeconds);
    }

    public static ProgressUpdate complete(int completed, int total) {
        return new ProgressUpdate(ProgressType.COMPLETE, 100.0, null, completed, total, null, null, null, 0L);
    }

    public static ProgressUpdate error(String currentItem, int completed, int total) {
        double percent = total <= 0 ? 0.0 : completed * 100.0 / total;
        return new ProgressUpdate(ProgressType.ERROR, percent, currentItem, completed, total, null, null, null, null);
    }
}
