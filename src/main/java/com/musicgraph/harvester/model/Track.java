package com.musicgraph.harvester.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Immutable record representing a downloadable track.
 * <p>
 * Constructed transiently from catalog responses. {@code filePath} and {@code fileSize} stay
 * {@code null} until the track has been materialized, after which {@link #withFile(Path, long)}
 * produces the augmented copy.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public record Track(
    String id,
    String title,
    List<String> artistIds,
    List<String> artistNames,
    String albumId,
    String albumName,
    Integer year,
    long durationMs,
    boolean explicit,
    List<String> countries,
    Quality quality,
    Path filePath,
    Long fileSize
) {
    public Track {
        Objects.requireNonNull(id, "id");
        title = title == null ? "" : title;
        artistIds = artistIds == null ? List.of() : List.copyOf(artistIds);
        artistNames = artistNames == null ? List.of() : List.copyOf(artistNames);
        countries = countries == null ? List.of() : List.copyOf(countries);
        quality = quality == null ? Quality.HIGH : quality;
    }

    /**
     * Constructor for tracks that have not been materialized yet.
     */
    public Track(String id, String title, List<String> artistIds, List<String> artistNames,
                 String albumId, String albumName, Integer year, long durationMs, boolean explicit,
                 List<String> countries, Quality quality) {
        this(id, title, artistIds, artistNames, albumId, albumName, year, durationMs, explicit, countries, quality, null, null);
    }

    public Track withFile(Path path, long size) {
        return new Track(id, title, artistIds, artistNames, albumId, albumName, year, durationMs, explicit, countries, quality, path, size);
    }

    public Track withQuality(Quality tier) {
        return new Track(id, title, artistIds, artistNames, albumId, albumName, year, durationMs, explicit, countries, tier, filePath, fileSize);
    }

    /**
     * @return the first contributing artist id, or {@code null} when the catalog gave none
     */
    public String primaryArtistId() {
        return artistIds.isEmpty() ? null : artistIds.get(0);
    }
}
