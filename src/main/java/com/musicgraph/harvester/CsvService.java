package com.musicgraph.harvester;

import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.DownloadOutcome;
import com.musicgraph.harvester.model.Track;
import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Service for exporting artist lists and download reports to CSV files using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Writes a fixed header row, then one row per record.</li>
 *   <li>Flattens list-valued fields (genres, artist names) into a single {@code ;}-joined cell.</li>
 *   <li>Strips line breaks so every record stays on one line.</li>
 * </ul>
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final String[] ARTIST_HEADER = {
        "ArtistId", "Name", "Country", "Genres", "TrackCount", "SimilarityScore", "Depth", "DiscoveredFrom"
    };

    static final String[] REPORT_HEADER = {
        "TrackId", "Title", "Artists", "Album", "Year", "Status", "File", "SizeBytes", "Error"
    };

    @Override
    public void writeArtistsToCSV(List<Artist> artists, Path target) throws IOException {
        if (artists == null) {
            logger.warn("Attempted to write null artist list to CSV: {}", target);
            throw new IllegalArgumentException("Artist list cannot be null");
        }
        createParent(target);
        try (CSVWriter writer = new CSVWriter(Files.newBufferedWriter(target, StandardCharsets.UTF_8))) {
            writer.writeNext(ARTIST_HEADER);
            for (Artist artist : artists) {
                writer.writeNext(new String[]{
                    safe(artist.id()),
                    safe(artist.name()),
                    safe(artist.country()),
                    safe(String.join(";", artist.genres())),
                    Integer.toString(artist.trackCount()),
                    artist.similarityScore() == null ? "" : String.format(Locale.ROOT, "%.3f", artist.similarityScore()),
                    Integer.toString(artist.depth()),
                    safe(artist.discoveredFrom())
                });
            }
        }
        logger.info("Wrote {} artists to CSV file: {}", artists.size(), target);
    }

    @Override
    public void writeDownloadReport(List<DownloadOutcome> outcomes, Path target) throws IOException {
        if (outcomes == null) {
            logger.warn("Attempted to write null download report: {}", target);
            throw new IllegalArgumentException("Outcome list cannot be null");
        }
        createParent(target);
        try (CSVWriter writer = new CSVWriter(Files.newBufferedWriter(target, StandardCharsets.UTF_8))) {
            writer.writeNext(REPORT_HEADER);
            for (DownloadOutcome outcome : outcomes) {
                Track track = outcome.track();
                writer.writeNext(new String[]{
                    safe(track.id()),
                    safe(track.title()),
                    safe(String.join(";", track.artistNames())),
                    safe(track.albumName()),
                    track.year() == null ? "" : track.year().toString(),
                    outcome.success() ? "OK" : "FAILED",
                    outcome.success() ? outcome.request().outputPath().toString() : "",
                    track.fileSize() == null ? "" : track.fileSize().toString(),
                    safe(outcome.error())
                });
            }
        }
        logger.info("Wrote download report with {} rows: {}", outcomes.size(), target);
    }

    private static void createParent(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    /**
     * Collapses line breaks into single spaces and trims.
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
