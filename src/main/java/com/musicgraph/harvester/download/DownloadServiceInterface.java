package com.musicgraph.harvester.download;

import com.musicgraph.harvester.discovery.CancellationSignal;
import com.musicgraph.harvester.discovery.ProgressListener;
import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.DownloadOutcome;
import com.musicgraph.harvester.model.DownloadRequest;
import com.musicgraph.harvester.model.Track;

import java.nio.file.Path;
import java.util.List;

/**
 * Track materialization with a content-addressed local cache.
 */
public interface DownloadServiceInterface {
    /**
     * Makes {@code targetPath} hold the track's bytes.
     * @param track track to fetch
     * @param targetPath requested output location
     * @param artistHint requesting artist, used for the canonical name when the track lists no artist
     * @return true on success, false if the track failed recently and was skipped
     * @throws com.musicgraph.harvester.error.DownloadException on business-rule rejection
     * @throws com.musicgraph.harvester.error.NetworkException on transport failure
     * @throws com.musicgraph.harvester.error.FileStorageException on local filesystem failure
     */
    boolean fetch(Track track, Path targetPath, Artist artistHint);

    /**
     * Fetches many tracks under the configured concurrency ceiling. Failures are reported per
     * request, never thrown. Progress is emitted after every completion, in completion order.
     */
    List<DownloadOutcome> fetchAll(List<DownloadRequest> requests, ProgressListener listener, CancellationSignal cancellation);
}
