package com.musicgraph.harvester.discovery;

import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.DiscoveryOptions;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CandidateRankerTest {
    private final CandidateRanker ranker = new CandidateRanker();

    private static Artist artist(String id, String country, int tracks, Double score) {
        return new Artist(id, id, country, List.of(), tracks, score);
    }

    private static List<String> ids(List<Artist> artists) {
        return artists.stream().map(Artist::id).collect(Collectors.toList());
    }

    @Test
    void testSortsByScoreThenTrackCount() {
        List<Artist> similar = List.of(
            artist("low", null, 50, 0.2),
            artist("tie-small", null, 10, 0.9),
            artist("tie-big", null, 90, 0.9),
            artist("none", null, 99, null));
        List<Artist> ranked = ranker.rank(similar, id -> false, DiscoveryOptions.builder().minTracksPerArtist(0).build(), Set.of());
        assertEquals(List.of("tie-big", "tie-small", "low", "none"), ids(ranked));
    }

    @Test
    void testEqualKeysKeepCatalogOrder() {
        List<Artist> similar = new ArrayList<>();
        for (int i = 0; i < 6; i++) similar.add(artist("a" + i, null, 10, 0.5));
        List<Artist> ranked = ranker.rank(similar, id -> false, DiscoveryOptions.builder().build(), Set.of());
        assertEquals(ids(similar), ids(ranked));
    }

    @Test
    void testDropsVisitedExcludedDuplicatesAndNulls() {
        List<Artist> similar = new ArrayList<>();
        similar.add(artist("seen", null, 10, 0.9));
        similar.add(null);
        similar.add(artist("banned", null, 10, 0.8));
        similar.add(artist("ok", null, 10, 0.7));
        similar.add(artist("ok", null, 10, 0.7));
        DiscoveryOptions options = DiscoveryOptions.builder().excludeArtists(Set.of("banned")).build();
        List<Artist> ranked = ranker.rank(similar, "seen"::equals, options, Set.of());
        assertEquals(List.of("ok"), ids(ranked));
    }

    @Test
    void testRegionAllowListDropsUnknownRegions() {
        List<Artist> similar = List.of(artist("us", "US", 10, 0.9), artist("nowhere", null, 10, 0.8), artist("de", "DE", 10, 0.7));
        DiscoveryOptions options = DiscoveryOptions.builder().regions(List.of("de", " us ")).build();
        assertEquals(List.of("us", "de"), ids(ranker.rank(similar, id -> false, options, Set.of())));
    }

    @Test
    void testSameRegionResolvesToSeedRegions() {
        DiscoveryOptions options = DiscoveryOptions.builder().regions(List.of("SAME", "FR")).build();
        assertEquals(Set.of("GB", "IE", "FR"), CandidateRanker.allowedRegions(options, Set.of("GB", "IE")));
    }

    @Test
    void testPrioritizeIsStablePartition() {
        List<Artist> ranked = List.of(artist("a", "US", 1, 0.9), artist("b", "JP", 1, 0.8), artist("c", "US", 1, 0.7), artist("d", "JP", 1, 0.6));
        assertEquals(List.of("b", "d", "a", "c"), ids(CandidateRanker.prioritize(ranked, List.of("JP"))));
        assertSame(ranked, CandidateRanker.prioritize(ranked, List.of()));
    }
}
