package com.musicgraph.harvester;

import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.DownloadOutcome;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for CSV exports of a harvest run.
 */
public interface CsvServiceInterface {
    /**
     * Writes the discovered artists, one row per artist in discovery order.
     * @param artists artists to export
     * @param target output CSV file; parent directories are created
     * @throws IOException if file writing fails
     */
    void writeArtistsToCSV(List<Artist> artists, Path target) throws IOException;

    /**
     * Writes one row per download request with its status and local file.
     * @param outcomes download outcomes
     * @param target output CSV file; parent directories are created
     * @throws IOException if file writing fails
     */
    void writeDownloadReport(List<DownloadOutcome> outcomes, Path target) throws IOException;
}
