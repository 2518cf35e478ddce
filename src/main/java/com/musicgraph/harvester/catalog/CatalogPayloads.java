package com.musicgraph.harvester.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.Quality;
import com.musicgraph.harvester.model.Track;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Response shapes of the catalog HTTP API.
 * <p>
 * Required fields are plain components; optional ones are boxed and may be null. Unknown fields
 * are ignored so the API can grow without breaking the client.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public final class CatalogPayloads {

    private CatalogPayloads() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ArtistPayload(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("countries") List<String> countries,
        @JsonProperty("genres") List<String> genres,
        @JsonProperty("track_count") Integer trackCount
    ) {
        public Artist toArtist(Double similarityScore) {
            String country = countries == null || countries.isEmpty() || countries.get(0) == null
                ? null : countries.get(0).toUpperCase(Locale.ROOT);
            return new Artist(id, name, country, genres, trackCount == null ? 0 : trackCount, similarityScore);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SimilarPayload(@JsonProperty("artists") List<ArtistPayload> artists) {
        public List<ArtistPayload> artistsOrEmpty() {
            return artists == null ? List.of() : artists;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ArtistRef(@JsonProperty("id") String id, @JsonProperty("name") String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AlbumPayload(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("year") Integer year
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AlbumsPayload(@JsonProperty("albums") List<AlbumPayload> albums) {
        public List<AlbumPayload> albumsOrEmpty() {
            return albums == null ? List.of() : albums;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TrackPayload(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("artists") List<ArtistRef> artists,
        @JsonProperty("album") AlbumPayload album,
        @JsonProperty("duration_ms") Long durationMs,
        @JsonProperty("explicit") Boolean explicit,
        @JsonProperty("countries") List<String> countries
    ) {
        public Track toTrack(Quality quality) {
            List<String> ids = new ArrayList<>();
            List<String> names = new ArrayList<>();
            if (artists != null) {
                for (ArtistRef ref : artists) {
                    if (ref == null || ref.id() == null) continue;
                    ids.add(ref.id());
                    names.add(ref.name() == null ? "" : ref.name());
                }
            }
            return new Track(id, title, ids, names,
                album == null ? null : album.id(),
                album == null ? null : album.title(),
                album == null ? null : album.year(),
                durationMs == null ? 0L : durationMs,
                Boolean.TRUE.equals(explicit),
                countries,
                quality);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TrackPagePayload(
        @JsonProperty("tracks") List<TrackPayload> tracks,
        @JsonProperty("page") Integer page,
        @JsonProperty("page_size") Integer pageSize,
        @JsonProperty("total") Integer total
    ) {
        public List<TrackPayload> tracksOrEmpty() {
            return tracks == null ? List.of() : tracks;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DownloadOptionPayload(
        @JsonProperty("codec") String codec,
        @JsonProperty("bitrate_kbps") int bitrateKbps,
        @JsonProperty("url") String url
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DownloadInfoPayload(@JsonProperty("options") List<DownloadOptionPayload> options) {
        public List<DownloadOptionPayload> optionsOrEmpty() {
            return options == null ? List.of() : options;
        }
    }
}
