package com.musicgraph.harvester.download;

import com.musicgraph.harvester.Utils;
import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.Track;

import java.nio.file.Path;

/**
 * Derives the canonical cache location of a track from stable identifiers only:
 * {@code AID{artistId}-TID{trackId}[-Y{year}].mp3} under the songs cache directory.
 * The contributing artist is the track's first artist, or the requesting artist when the
 * catalog listed none. Output paths never influence the name, so every request for a track
 * shares one canonical file.
 */
public class CanonicalFileNamer {
    static final String EXTENSION = ".mp3";

    private final Path songsCacheDir;

    public CanonicalFileNamer(Path songsCacheDir) {
        this.songsCacheDir = songsCacheDir;
    }

    public Path canonicalPath(Track track, Artist artistHint) {
        return songsCacheDir.resolve(canonicalName(track, artistHint));
    }

    static String canonicalName(Track track, Artist artistHint) {
        String artistId = track.primaryArtistId();
        if (artistId == null && artistHint != null) artistId = artistHint.id();
        if (artistId == null) artistId = "unknown";
        StringBuilder name = new StringBuilder()
            .append("AID").append(Utils.sanitizeFilename(artistId))
            .append("-TID").append(Utils.sanitizeFilename(track.id()));
        if (track.year() != null) {
            name.append("-Y").append(track.year());
        }
        return name.append(EXTENSION).toString();
    }
}
