package com.musicgraph.harvester.download;

import com.musicgraph.harvester.FakeCatalogService;
import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.DiscoveryOptions;
import com.musicgraph.harvester.model.Quality;
import com.musicgraph.harvester.model.Track;
import com.musicgraph.harvester.model.YearRange;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TrackSelectorTest {

    private final TrackSelector selector = new TrackSelector();
    private final Artist artist = FakeCatalogService.artist("a1", "GB", 20);

    private static List<Track> tracksByYear(int... years) {
        List<Track> tracks = new ArrayList<>();
        for (int i = 0; i < years.length; i++) {
            tracks.add(FakeCatalogService.track("t" + (i + 1), "a1", years[i]));
        }
        return tracks;
    }

    private static List<String> ids(List<Track> tracks) {
        return tracks.stream().map(Track::id).collect(Collectors.toList());
    }

    private static Track track(String id, boolean explicit, List<String> countries) {
        return new Track(id, "Song " + id, List.of("a1"), List.of("Artist a1"), null, null, 2000, 0, explicit, countries, Quality.HIGH);
    }

    @Test
    void testSelectsFirstSongsInPopularityOrder() {
        DiscoveryOptions options = DiscoveryOptions.builder().songsPerArtist(2).build();

        List<Track> selected = selector.select(tracksByYear(2001, 2002, 2003), artist, options);

        assertEquals(List.of("t1", "t2"), ids(selected));
    }

    @Test
    void testYearRangeFilter() {
        DiscoveryOptions options = DiscoveryOptions.builder()
            .songsPerArtist(5)
            .years(YearRange.parse("2000-2005"))
            .build();

        List<Track> selected = selector.select(tracksByYear(1999, 2001, 2010, 2005), artist, options);

        assertEquals(List.of("t2", "t4"), ids(selected));
    }

    @Test
    void testInTopCountIsAppliedBeforeYearFilter() {
        DiscoveryOptions options = DiscoveryOptions.builder()
            .songsPerArtist(5)
            .years(YearRange.parse("2000"))
            .inTopN(2)
            .build();

        List<Track> selected = selector.select(tracksByYear(1990, 2000, 2000, 2000), artist, options);

        assertEquals(List.of("t2"), ids(selected));
    }

    @Test
    void testInTopPercentRoundsUp() {
        DiscoveryOptions options = DiscoveryOptions.builder()
            .songsPerArtist(10)
            .years(YearRange.parse("2000"))
            .inTopPercent(25.0)
            .build();

        List<Track> selected = selector.select(tracksByYear(2000, 2000, 2000, 2000, 2000), artist, options);

        assertEquals(List.of("t1", "t2"), ids(selected));
    }

    @Test
    void testInTopWithoutYearsIsIgnored() {
        DiscoveryOptions options = DiscoveryOptions.builder().songsPerArtist(3).inTopN(1).build();

        assertEquals(3, selector.select(tracksByYear(1, 2, 3, 4), artist, options).size());
    }

    @Test
    void testExplicitFilter() {
        DiscoveryOptions options = DiscoveryOptions.builder().excludeExplicit(true).build();
        List<Track> tracks = List.of(track("clean", false, List.of()), track("dirty", true, List.of()));

        assertEquals(List.of("clean"), ids(selector.select(tracks, artist, options)));
    }

    @Test
    void testRegionFilterKeepsTracksWithoutRegionData() {
        DiscoveryOptions options = DiscoveryOptions.builder().regions(List.of("de")).build();
        List<Track> tracks = List.of(
            track("de", false, List.of("DE", "AT")),
            track("fr", false, List.of("FR")),
            track("any", false, List.of()));

        assertEquals(List.of("de", "any"), ids(selector.select(tracks, artist, options)));
    }

    @Test
    void testSameRegionUsesArtistCountry() {
        DiscoveryOptions options = DiscoveryOptions.builder().regions(List.of(DiscoveryOptions.SAME_REGION)).build();
        List<Track> tracks = List.of(track("us", false, List.of("us")), track("gb", false, List.of("gb")));

        assertEquals(List.of("gb"), ids(selector.select(tracks, artist, options)));
    }

    @Test
    void testMaxItems() {
        assertEquals(Integer.valueOf(10), selector.maxItems(DiscoveryOptions.builder().build()));
        assertNull(selector.maxItems(DiscoveryOptions.builder().years(YearRange.parse("2000")).build()));
        assertNull(selector.maxItems(DiscoveryOptions.builder().excludeExplicit(true).build()));
        assertEquals(Integer.valueOf(7), selector.maxItems(DiscoveryOptions.builder().years(YearRange.parse("2000")).inTopN(7).build()));
    }
}
