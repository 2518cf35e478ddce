package com.musicgraph.harvester.catalog;

import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.Track;
import com.musicgraph.harvester.model.YearRange;

import java.util.List;
import java.util.Optional;

/**
 * Remote music catalog consumed by discovery and download.
 * <p>
 * Expected absence is reported through {@link Optional}; transport and upstream failures are
 * raised as {@link com.musicgraph.harvester.error.NetworkException} or
 * {@link com.musicgraph.harvester.error.ServiceException}.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public interface CatalogServiceInterface {
    /**
     * Looks up an artist.
     * @param artistId catalog artist id
     * @return the artist, or empty if the catalog does not know it
     */
    Optional<Artist> getArtist(String artistId);

    /**
     * Lists artists similar to the given one. Order is the catalog's; scores are rank-derived.
     * @param artistId catalog artist id
     * @param limit maximum number of artists returned
     * @return similar artists, possibly empty
     */
    List<Artist> getSimilarArtists(String artistId, int limit);

    /**
     * Lists an artist's tracks in the catalog's popularity order.
     * @param artistId catalog artist id
     * @param maxTracks stop paginating once this many tracks are collected, null for all
     * @return tracks, possibly empty
     */
    List<Track> getArtistTracks(String artistId, Integer maxTracks);

    /**
     * Cheap existence check for releases inside a year range.
     * @param artistId catalog artist id
     * @param years inclusive range
     * @return true if the artist released something in the range
     */
    boolean hasContentInYears(String artistId, YearRange years);

    /**
     * Resolves a short-lived media URL for the track's quality tier.
     * @param track track to resolve
     * @return the URL, or empty if the track cannot be downloaded
     */
    Optional<String> getTrackDownloadUrl(Track track);
}
