package com.musicgraph.harvester.discovery;

import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.DiscoveryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Filters and orders the similar artists returned for one parent.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Drops candidates already visited, explicitly excluded, below the minimum catalog size, or
 *       outside the region allow-list ({@code SAME} resolves to the seeds' regions).</li>
 *   <li>Sorts by similarity score, then catalog size, both descending. The sort is stable so ties
 *       keep the catalog's order.</li>
 *   <li>Moves candidates from priority regions to the front, keeping relative order on both sides.</li>
 * </ul>
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class CandidateRanker {
    private static final Logger logger = LoggerFactory.getLogger(CandidateRanker.class);

    static final Comparator<Artist> BY_SCORE_THEN_TRACKS = Comparator
        .comparingDouble(Artist::scoreOrZero)
        .thenComparingInt(Artist::trackCount)
        .reversed();

    /**
     * @param similar similar artists in catalog order
     * @param isVisited visited-set membership test
     * @param options run options
     * @param seedRegions regions of the seeds, used to resolve {@code SAME}
     * @return ranked candidates
     */
    public List<Artist> rank(List<Artist> similar, Predicate<String> isVisited, DiscoveryOptions options, Set<String> seedRegions) {
        Set<String> allowed = allowedRegions(options, seedRegions);
        Set<String> seen = new HashSet<>();
        List<Artist> candidates = new ArrayList<>();
        for (Artist artist : similar) {
            if (artist == null || !seen.add(artist.id())) continue;
            if (isVisited.test(artist.id()) || options.excludeArtists().contains(artist.id())) continue;
            if (artist.trackCount() < options.minTracksPerArtist()) {
                logger.debug("Skipping {}: {} tracks below minimum {}", artist.name(), artist.trackCount(), options.minTracksPerArtist());
                continue;
            }
            if (!allowed.isEmpty() && (artist.country() == null || !allowed.contains(artist.country()))) {
                logger.debug("Skipping {}: region {} not allowed", artist.name(), artist.country());
                continue;
            }
            candidates.add(artist);
        }
        candidates.sort(BY_SCORE_THEN_TRACKS);
        return prioritize(candidates, options.priorityRegions());
    }

    static Set<String> allowedRegions(DiscoveryOptions options, Set<String> seedRegions) {
        Set<String> allowed = new LinkedHashSet<>();
        for (String region : options.regions()) {
            if (DiscoveryOptions.SAME_REGION.equals(region)) {
                allowed.addAll(seedRegions);
            } else {
                allowed.add(region);
            }
        }
        return allowed;
    }

    /**
     * Stable partition: artists from {@code priorityRegions} first.
     */
    static List<Artist> prioritize(List<Artist> ranked, List<String> priorityRegions) {
        if (priorityRegions.isEmpty()) return ranked;
        Set<String> priority = new HashSet<>(priorityRegions);
        List<Artist> first = new ArrayList<>();
        List<Artist> rest = new ArrayList<>();
        for (Artist artist : ranked) {
            if (artist.country() != null && priority.contains(artist.country())) {
                first.add(artist);
            } else {
                rest.add(artist);
            }
        }
        first.addAll(rest);
        return first;
    }
}
