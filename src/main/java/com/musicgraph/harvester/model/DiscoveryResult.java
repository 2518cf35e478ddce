package com.musicgraph.harvester.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of a discovery run.
 * <p>
 * {@code discoveredArtists} is de-duplicated and in discovery order (seeds first, then level by
 * level). {@code discoveryTree} maps every expanded parent id to the ids it admitted, in ranked
 * order. A seed without content in a filtered year range is absent from {@code discoveredArtists}
 * but still appears as a key of the tree. {@code filteredOutArtists} lists candidates rejected by
 * the year-content probe, each positioned at the parent that probed it.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public record DiscoveryResult(
    List<Artist> seedArtists,
    List<Artist> discoveredArtists,
    List<Artist> filteredOutArtists,
    Map<String, List<String>> discoveryTree,
    Set<String> countriesFound,
    int maxDepthReached,
    double discoveryTimeSeconds,
    Map<String, Object> discoveryParams,
    Instant createdAt
) {
    public DiscoveryResult {
        seedArtists = List.copyOf(seedArtists);
        discoveredArtists = List.copyOf(discoveredArtists);
        filteredOutArtists = List.copyOf(filteredOutArtists);
        Map<String, List<String>> tree = new LinkedHashMap<>();
        discoveryTree.forEach((parent, children) -> tree.put(parent, List.copyOf(children)));
        discoveryTree = Collections.unmodifiableMap(tree);
        countriesFound = Collections.unmodifiableSet(new LinkedHashSet<>(countriesFound));
        discoveryParams = Collections.unmodifiableMap(new LinkedHashMap<>(discoveryParams));
    }

    /**
     * @return the first seed artist
     */
    public Artist baseArtist() {
        return seedArtists.get(0);
    }

    public int totalDiscovered() {
        return discoveredArtists.size();
    }
}
