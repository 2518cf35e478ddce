package com.musicgraph.harvester.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable configuration snapshot for one discovery + download run.
 * <p>
 * Discovery bounds:
 * <ul>
 *   <li>{@code similarLimit} children admitted per parent, {@code maxDepth} levels,
 *       {@code maxTotalArtists} nodes overall (seeds included).</li>
 *   <li>{@code regions} is an allow-list of region codes for candidates; the single value
 *       {@value #SAME_REGION} restricts candidates to the seed's region. {@code priorityRegions}
 *       moves matching candidates to the front without dropping the others.</li>
 *   <li>{@code years} with {@code yearFilteringForDiscovery} probes candidates for content in the
 *       range; at most {@code maxSimilarArtistAttempts} candidates are probed per parent.</li>
 * </ul>
 * Track selection uses {@code songsPerArtist}, {@code years}, {@code excludeExplicit} and the
 * in-top popularity filter ({@code inTopN} or {@code inTopPercent}, only meaningful with a year range).
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public record DiscoveryOptions(
    int songsPerArtist,
    int similarLimit,
    int maxDepth,
    int maxTotalArtists,
    List<String> regions,
    List<String> priorityRegions,
    int minTracksPerArtist,
    Set<String> excludeArtists,
    YearRange years,
    boolean yearFilteringForDiscovery,
    int maxSimilarArtistAttempts,
    Integer inTopN,
    Double inTopPercent,
    boolean excludeExplicit,
    Quality quality
) {
    public static final String SAME_REGION = "SAME";

    public DiscoveryOptions {
        regions = normalizeRegions(regions);
        priorityRegions = normalizeRegions(priorityRegions);
        excludeArtists = excludeArtists == null ? Set.of() : Set.copyOf(excludeArtists);
        quality = quality == null ? Quality.HIGH : quality;
        if (songsPerArtist < 1) throw new IllegalArgumentException("songsPerArtist must be >= 1");
        if (similarLimit < 0) throw new IllegalArgumentException("similarLimit must be >= 0");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxTotalArtists < 1) throw new IllegalArgumentException("maxTotalArtists must be >= 1");
        if (maxSimilarArtistAttempts < 1) throw new IllegalArgumentException("maxSimilarArtistAttempts must be >= 1");
    }

    private static List<String> normalizeRegions(List<String> values) {
        if (values == null) return List.of();
        return values.stream()
            .filter(v -> v != null && !v.isBlank())
            .map(v -> v.trim().toUpperCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * @return true when candidates must be probed for content in the year range
     */
    public boolean probesYearContent() {
        return yearFilteringForDiscovery && years != null;
    }

    public boolean hasInTopFilter() {
        return years != null && (inTopN != null || inTopPercent != null);
    }

    /**
     * Parameters recorded on a {@link DiscoveryResult}.
     */
    public Map<String, Object> describe() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("similar_limit", similarLimit);
        params.put("max_depth", maxDepth);
        params.put("max_total_artists", maxTotalArtists);
        params.put("songs_per_artist", songsPerArtist);
        params.put("min_tracks_per_artist", minTracksPerArtist);
        params.put("regions", regions);
        params.put("priority_regions", priorityRegions);
        params.put("exclude_artists", excludeArtists.stream().sorted().collect(Collectors.toList()));
        params.put("years", years == null ? null : years.toString());
        params.put("year_filtering_for_discovery", yearFilteringForDiscovery);
        params.put("max_similar_artist_attempts", maxSimilarArtistAttempts);
        return params;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .songsPerArtist(songsPerArtist)
            .similarLimit(similarLimit)
            .maxDepth(maxDepth)
            .maxTotalArtists(maxTotalArtists)
            .regions(regions)
            .priorityRegions(priorityRegions)
            .minTracksPerArtist(minTracksPerArtist)
            .excludeArtists(excludeArtists)
            .years(years)
            .yearFilteringForDiscovery(yearFilteringForDiscovery)
            .maxSimilarArtistAttempts(maxSimilarArtistAttempts)
            .inTopN(inTopN)
            .inTopPercent(inTopPercent)
            .excludeExplicit(excludeExplicit)
            .quality(quality);
    }

    /**
     * Builder with the defaults used by the command line.
     */
    public static final class Builder {
        private int songsPerArtist = 10;
        private int similarLimit = 5;
        private int maxDepth = 2;
        private int maxTotalArtists = 50;
        private List<String> regions = List.of();
        private List<String> priorityRegions = List.of();
        private int minTracksPerArtist = 3;
        private Set<String> excludeArtists = Set.of();
        private YearRange years;
        private boolean yearFilteringForDiscovery;
        private int maxSimilarArtistAttempts = 20;
        private Integer inTopN;
        private Double inTopPercent;
        private boolean excludeExplicit;
        private Quality quality = Quality.HIGH;

        private Builder() {
        }

        public Builder songsPerArtist(int value) { this.songsPerArtist = value; return this; }
        public Builder similarLimit(int value) { this.similarLimit = value; return this; }
        public Builder maxDepth(int value) { this.maxDepth = value; return this; }
        public Builder maxTotalArtists(int value) { this.maxTotalArtists = value; return this; }
        public Builder regions(List<String> value) { this.regions = value; return this; }
        public Builder priorityRegions(List<String> value) { this.priorityRegions = value; return this; }
        public Builder minTracksPerArtist(int value) { this.minTracksPerArtist = value; return this; }
        public Builder excludeArtists(Set<String> value) { this.excludeArtists = value; return this; }
        public Builder years(YearRange value) { this.years = value; return this; }
        public Builder yearFilteringForDiscovery(boolean value) { this.yearFilteringForDiscovery = value; return this; }
        public Builder maxSimilarArtistAttempts(int value) { this.maxSimilarArtistAttempts = value; return this; }
        public Builder inTopN(Integer value) { this.inTopN = value; return this; }
        public Builder inTopPercent(Double value) { this.inTopPercent = value; return this; }
        public Builder excludeExplicit(boolean value) { this.excludeExplicit = value; return this; }
        public Builder quality(Quality value) { this.quality = value; return this; }

        public DiscoveryOptions build() {
            return new DiscoveryOptions(songsPerArtist, similarLimit, maxDepth, maxTotalArtists, regions,
                priorityRegions, minTracksPerArtist, excludeArtists, years, yearFilteringForDiscovery,
                maxSimilarArtistAttempts, inTopN, inTopPercent, excludeExplicit, quality);
        }
    }
}
