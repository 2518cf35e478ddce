package com.musicgraph.harvester.download;

import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.DiscoveryOptions;
import com.musicgraph.harvester.model.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Chooses which of an artist's tracks to download.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Tracks arrive in catalog popularity order.</li>
 *   <li>With the in-top filter only the first N tracks (or the first ceil(P%) of the listing) are
 *       considered before any other filter.</li>
 *   <li>Year range, region and explicit-content filters are applied; tracks without region data
 *       pass the region filter.</li>
 *   <li>The first {@code songsPerArtist} survivors are selected.</li>
 * </ul>
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class TrackSelector {
    private static final Logger logger = LoggerFactory.getLogger(TrackSelector.class);

    /**
     * Upper bound on tracks worth listing for an artist, so pagination can stop early.
     * @return the bound, or null when every track may be needed
     */
    public Integer maxItems(DiscoveryOptions options) {
        if (options.hasInTopFilter() && options.inTopN() != null) {
            return options.inTopN();
        }
        boolean filtering = options.years() != null || options.excludeExplicit() || !trackRegions(options, null).isEmpty();
        return filtering ? null : options.songsPerArtist();
    }

    public List<Track> select(List<Track> tracks, Artist artist, DiscoveryOptions options) {
        List<Track> pool = tracks;
        if (options.hasInTopFilter()) {
            int topCount = options.inTopN() != null
                ? Math.min(options.inTopN(), tracks.size())
                : (int) Math.ceil(tracks.size() * options.inTopPercent() / 100.0);
            pool = tracks.subList(0, Math.min(topCount, tracks.size()));
            logger.debug("In-top filter: checking top {} of {} tracks", pool.size(), tracks.size());
        }
        Set<String> regions = trackRegions(options, artist);
        List<Track> selected = new ArrayList<>();
        for (Track track : pool) {
            if (selected.size() >= options.songsPerArtist()) break;
            if (options.years() != null && !options.years().contains(track.year())) continue;
            if (options.excludeExplicit() && track.explicit()) continue;
            if (!regions.isEmpty() && !track.countries().isEmpty()
                && track.countries().stream().noneMatch(c -> regions.contains(c.toUpperCase(Locale.ROOT)))) continue;
            selected.add(track);
        }
        logger.debug("Selected {} of {} tracks for {}", selected.size(), tracks.size(), artist == null ? "?" : artist.name());
        return selected;
    }

    private static Set<String> trackRegions(DiscoveryOptions options, Artist artist) {
        Set<String> regions = new LinkedHashSet<>();
        for (String region : options.regions()) {
            if (DiscoveryOptions.SAME_REGION.equals(region)) {
                if (artist != null && artist.country() != null) regions.add(artist.country());
            } else {
                regions.add(region);
            }
        }
        return regions;
    }
}
