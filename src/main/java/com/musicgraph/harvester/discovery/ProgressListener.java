package com.musicgraph.harvester.discovery;

import com.musicgraph.harvester.model.ProgressUpdate;

/**
 * Receives progress updates from discovery and download. Implementations must be thread-safe;
 * download updates arrive from the batch coordinator in completion order.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = update -> { };

    void onProgress(ProgressUpdate update);
}
