package com.musicgraph.harvester.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One track to materialize at a logical output location.
 *
 * @param track track to fetch
 * @param outputPath requested output location (becomes a hard link to the canonical file)
 * @param artist artist the track is fetched for, used to derive the canonical name (may be null)
 */
public record DownloadRequest(Track track, Path outputPath, Artist artist) {
    public DownloadRequest {
        Objects.requireNonNull(track, "track");
        Objects.requireNonNull(outputPath, "outputPath");
    }
}
