package com.musicgraph.harvester.discovery;

import com.musicgraph.harvester.model.DiscoveryOptions;
import com.musicgraph.harvester.model.DiscoveryResult;

import java.util.List;

/**
 * Similar-artist discovery operations.
 */
public interface DiscoveryServiceInterface {
    /**
     * Recursive discovery from one seed.
     * @throws com.musicgraph.harvester.error.NotFoundException if the seed does not resolve
     * @throws com.musicgraph.harvester.error.ServiceException if the catalog fails persistently
     */
    DiscoveryResult discover(String seedId, DiscoveryOptions options);

    /**
     * Recursive discovery from several seeds sharing one visited set. Every seed sits at depth 0.
     * @param seedIds seed artist ids, duplicates ignored
     * @param options run options
     * @param listener progress receiver
     * @param cancellation checked between levels and between frontier entities
     */
    DiscoveryResult discover(List<String> seedIds, DiscoveryOptions options, ProgressListener listener, CancellationSignal cancellation);

    /**
     * Single-level discovery: the seed plus up to {@code similarLimit} ranked similar artists,
     * without year probing.
     */
    DiscoveryResult discoverSimilar(String artistId, DiscoveryOptions options);
}
