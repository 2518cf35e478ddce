package com.musicgraph.harvester.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable record representing an artist node of the similarity graph.
 * <p>
 * Lifecycle:
 * <ul>
 *   <li>Constructed from a catalog response when first observed (lookup or similar listing).</li>
 *   <li>{@code depth} and {@code discoveredFrom} are assigned once, at first discovery, through
 *       {@link #withDiscovery(int, String)}; the discovery engine never re-parents a node.</li>
 *   <li>{@code similarityScore} is rank-derived (0..1) and only comparable between siblings
 *       returned for the same parent.</li>
 * </ul>
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public record Artist(
    String id,
    String name,
    String country,
    List<String> genres,
    int trackCount,
    Double similarityScore,
    String discoveredFrom,
    int depth
) {
    public Artist {
        Objects.requireNonNull(id, "id");
        name = name == null ? "" : name;
        genres = genres == null ? List.of() : List.copyOf(genres);
    }

    /**
     * Convenience constructor for catalog lookups (no discovery position yet).
     */
    public Artist(String id, String name, String country, List<String> genres, int trackCount, Double similarityScore) {
        this(id, name, country, genres, trackCount, similarityScore, null, 0);
    }

    /**
     * Returns a copy positioned in the discovery tree.
     * @param depth traversal depth (parent depth + 1)
     * @param parentId id of the discovering parent
     * @return positioned copy
     */
    public Artist withDiscovery(int depth, String parentId) {
        return new Artist(id, name, country, genres, trackCount, similarityScore, parentId, depth);
    }

    public double scoreOrZero() {
        return similarityScore == null ? 0.0 : similarityScore;
    }
}
