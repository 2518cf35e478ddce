package com.musicgraph.harvester.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.musicgraph.harvester.JsonMappers;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ModelTest {

    @Test
    void testYearRangeParse() {
        assertEquals(new YearRange(2020, 2020), YearRange.parse("2020"));
        assertEquals(new YearRange(2018, 2022), YearRange.parse(" 2018 - 2022 "));
        assertThrows(IllegalArgumentException.class, () -> YearRange.parse("2022-2018"));
        assertThrows(IllegalArgumentException.class, () -> YearRange.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> YearRange.parse(""));
    }

    @Test
    void testYearRangeContains() {
        YearRange range = YearRange.parse("2000-2005");
        assertTrue(range.contains(2000));
        assertTrue(range.contains(2005));
        assertFalse(range.contains(2006));
        assertFalse(range.contains(null));
        assertEquals("2000-2005", range.toString());
    }

    @Test
    void testDiscoveryOptionsNormalizesRegions() {
        DiscoveryOptions options = DiscoveryOptions.builder()
            .regions(List.of(" gb", "", "same"))
            .priorityRegions(null)
            .build();

        assertEquals(List.of("GB", DiscoveryOptions.SAME_REGION), options.regions());
        assertEquals(List.of(), options.priorityRegions());
        assertEquals(Quality.HIGH, options.quality());
    }

    @Test
    void testDiscoveryOptionsBounds() {
        assertThrows(IllegalArgumentException.class, () -> DiscoveryOptions.builder().songsPerArtist(0).build());
        assertThrows(IllegalArgumentException.class, () -> DiscoveryOptions.builder().maxDepth(-1).build());
        assertThrows(IllegalArgumentException.class, () -> DiscoveryOptions.builder().maxTotalArtists(0).build());
        assertThrows(IllegalArgumentException.class, () -> DiscoveryOptions.builder().maxSimilarArtistAttempts(0).build());
    }

    @Test
    void testYearProbingNeedsRange() {
        assertFalse(DiscoveryOptions.builder().yearFilteringForDiscovery(true).build().probesYearContent());
        assertTrue(DiscoveryOptions.builder().yearFilteringForDiscovery(true).years(YearRange.parse("2001")).build().probesYearContent());
        assertFalse(DiscoveryOptions.builder().inTopN(5).build().hasInTopFilter());
    }

    @Test
    void testDescribeListsExcludedArtistsSorted() {
        Map<String, Object> params = DiscoveryOptions.builder().excludeArtists(Set.of("b", "a")).build().describe();

        assertEquals(List.of("a", "b"), params.get("exclude_artists"));
        assertNull(params.get("years"));
    }

    @Test
    void testCacheEntryExpiry() {
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        CacheEntry entry = new CacheEntry("k", "v", created, 60);

        assertFalse(entry.isExpired(created.plusSeconds(60)));
        assertTrue(entry.isExpired(created.plusSeconds(61)));
    }

    @Test
    void testCheckpointJsonRoundTripKeepsFieldNames() throws Exception {
        ObjectMapper mapper = JsonMappers.shared();
        ProgressCheckpoint checkpoint = new ProgressCheckpoint("run", 3, "abc123", Instant.parse("2024-01-01T00:00:00Z"));
        checkpoint.recordArtist("A", 0, Instant.parse("2024-01-01T01:00:00Z"));
        checkpoint.addTrackCounts(4, -2);

        String json = mapper.writeValueAsString(checkpoint);
        ProgressCheckpoint read = mapper.readValue(json, ProgressCheckpoint.class);

        assertTrue(json.contains("\"is_complete\""));
        assertTrue(json.contains("\"last_artist_index\""));
        assertTrue(json.contains("\"2024-01-01T00:00:00Z\""));
        assertFalse(json.contains("progressPercent"));
        assertEquals(Set.of("A"), read.getProcessedArtistIds());
        assertEquals(4, read.getTracksDownloaded());
        assertEquals(0, read.getTracksFailed());
        assertEquals("abc123", read.getCommandHash());
    }

    @Test
    void testCheckpointIgnoresUnknownFields() throws Exception {
        ProgressCheckpoint read = JsonMappers.shared().readValue(
            "{\"session_name\":\"old\",\"total_artists\":2,\"future_field\":1}", ProgressCheckpoint.class);

        assertEquals("old", read.getSessionName());
        assertEquals(-1, read.getLastArtistIndex());
    }
}
