package com.musicgraph.harvester.model;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary statistics over a list of discovered artists.
 *
 * @param totalArtists number of artists
 * @param countries artist count per region code (artists without a region are not counted)
 * @param depthDistribution artist count per discovery depth
 * @param averageTrackCount mean catalog size over artists reporting a non-zero size
 * @param totalTracks sum of catalog sizes
 * @param maxDepthReached deepest level present
 */
public record DiscoveryStats(
    int totalArtists,
    Map<String, Integer> countries,
    Map<Integer, Integer> depthDistribution,
    double averageTrackCount,
    long totalTracks,
    int maxDepthReached
) {
    public static DiscoveryStats of(List<Artist> artists) {
        Map<String, Integer> countries = new TreeMap<>();
        Map<Integer, Integer> depths = new TreeMap<>();
        long totalTracks = 0;
        int withTracks = 0;
        int maxDepth = 0;
        for (Artist artist : artists) {
            if (artist.country() != null && !artist.country().isBlank()) {
                countries.merge(artist.country(), 1, Integer::sum);
            }
            depths.merge(artist.depth(), 1, Integer::sum);
            if (artist.trackCount() > 0) {
                totalTracks += artist.trackCount();
                withTracks++;
            }
            maxDepth = Math.max(maxDepth, artist.depth());
        }
        double average = withTracks == 0 ? 0.0 : (double) totalTracks / withTracks;
        return new DiscoveryStats(artists.size(), countries, depths, average, totalTracks, maxDepth);
    }
}
