package com.musicgraph.harvester;

import com.musicgraph.harvester.catalog.CatalogServiceInterface;
import com.musicgraph.harvester.discovery.CancellationSignal;
import com.musicgraph.harvester.discovery.DiscoveryExporter;
import com.musicgraph.harvester.discovery.DiscoveryServiceInterface;
import com.musicgraph.harvester.discovery.ProgressListener;
import com.musicgraph.harvester.download.DownloadServiceInterface;
import com.musicgraph.harvester.download.TrackSelector;
import com.musicgraph.harvester.error.FileStorageException;
import com.musicgraph.harvester.error.HarvesterException;
import com.musicgraph.harvester.error.OperationCancelledException;
import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.DiscoveryOptions;
import com.musicgraph.harvester.model.DiscoveryResult;
import com.musicgraph.harvester.model.DownloadOutcome;
import com.musicgraph.harvester.model.DownloadRequest;
import com.musicgraph.harvester.model.ProgressCheckpoint;
import com.musicgraph.harvester.model.ProgressUpdate;
import com.musicgraph.harvester.model.RunStatistics;
import com.musicgraph.harvester.model.Track;
import com.musicgraph.harvester.progress.ProgressService;
import com.musicgraph.harvester.progress.ProgressServiceInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives one harvest run from seed ids to files on disk.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Discovers artists (recursive, or flat when depth is 0) and exports the artist list.</li>
 *   <li>Creates, resumes or resets the checkpoint of the named session; a resumed checkpoint
 *       must carry the same command signature, and an existing one is never replaced without a reset.</li>
 *   <li>For every artist not yet processed: lists and selects tracks, downloads them in one
 *       batch, then saves the checkpoint.</li>
 *   <li>Marks the session complete, writes the download report, then shuffles and archives
 *       when asked.</li>
 * </ul>
 * On cancellation or a fatal error the last checkpoint stays the resume point and its summary is logged.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class HarvestRunner {
    private static final Logger logger = LoggerFactory.getLogger(HarvestRunner.class);

    static final String ARTISTS_CSV = "artists.csv";
    static final String REPORT_CSV = "download-report.csv";
    private static final int MAX_FILENAME_LENGTH = 200;

    private final CatalogServiceInterface catalog;
    private final DiscoveryServiceInterface discovery;
    private final DownloadServiceInterface download;
    private final ProgressServiceInterface progress;
    private final CsvServiceInterface csvService;
    private final PostProcessor postProcessor;
    private final TrackSelector selector = new TrackSelector();
    private final DiscoveryExporter exporter = new DiscoveryExporter();

    public HarvestRunner(CatalogServiceInterface catalog, DiscoveryServiceInterface discovery, DownloadServiceInterface download,
                         ProgressServiceInterface progress, CsvServiceInterface csvService, PostProcessor postProcessor) {
        this.catalog = catalog;
        this.discovery = discovery;
        this.download = download;
        this.progress = progress;
        this.csvService = csvService;
        this.postProcessor = postProcessor;
    }

    /**
     * Runs the plan to completion.
     * @param plan run parameters
     * @param listener receives discovery, download and completion updates
     * @param cancellation checked between artists and between track downloads
     * @return run totals
     * @throws com.musicgraph.harvester.error.NotFoundException if a seed does not resolve
     * @throws OperationCancelledException if the run was cancelled
     * @throws IllegalStateException if a resumed checkpoint was created with different parameters, or the
     *         session already has progress and neither resume nor reset was asked for
     */
    public RunStatistics run(HarvestPlan plan, ProgressListener listener, CancellationSignal cancellation) {
        Instant started = Instant.now();
        Counters counters = new Counters();
        try {
            createDirectory(plan.outputDir());
            if (plan.resetProgress()) {
                boolean deleted = progress.resetSession(plan.sessionName());
                logger.info(deleted ? "Progress reset for session: {}" : "No stored progress for session: {}", plan.sessionName());
            } else if (plan.hasSession() && !plan.resume() && progress.loadCheckpoint(plan.sessionName()).isPresent()) {
                throw new IllegalStateException("Session '" + plan.sessionName()
                    + "' already has progress; use --resume to continue or --reset-progress to start over");
            }

            DiscoveryResult result = discoverArtists(plan, listener, cancellation);
            List<Artist> artists = result.discoveredArtists();
            logger.info("Processing {} artists...", artists.size());
            exportDiscovery(plan, result);

            List<Artist> pending = startSession(plan, artists);
            counters.skipped = artists.size() - pending.size();
            List<DownloadOutcome> report = new ArrayList<>();
            Map<String, Integer> positions = indexById(artists);

            for (Artist artist : pending) {
                cancellation.throwIfCancelled("downloads");
                List<DownloadOutcome> outcomes = downloadArtist(artist, plan, listener, cancellation);
                report.addAll(outcomes);
                int ok = (int) outcomes.stream().filter(DownloadOutcome::success).count();
                int failed = outcomes.size() - ok;
                counters.add(outcomes);
                // A partially downloaded artist stays pending.
                cancellation.throwIfCancelled("downloads for " + artist.name());
                counters.processed++;
                if (plan.hasSession()) {
                    progress.saveProgress(plan.sessionName(), artist.id(), positions.get(artist.id()), ok, failed);
                }
            }

            if (plan.hasSession()) progress.markComplete(plan.sessionName());
            writeReport(plan.outputDir().resolve(REPORT_CSV), report);
            postProcess(plan, counters);

            RunStatistics stats = counters.toStatistics(started);
            listener.onProgress(ProgressUpdate.complete(counters.processed, pending.size()));
            logStatistics(stats);
            return stats;
        } catch (OperationCancelledException e) {
            logger.warn("Process interrupted: {}", e.getMessage());
            reportResumePoint(plan, counters, started);
            throw e;
        } catch (RuntimeException e) {
            logger.error("Harvest failed: {}", e.getMessage());
            listener.onProgress(ProgressUpdate.error(null, counters.processed, 0));
            reportResumePoint(plan, counters, started);
            throw e;
        }
    }

    private DiscoveryResult discoverArtists(HarvestPlan plan, ProgressListener listener, CancellationSignal cancellation) {
        DiscoveryOptions options = plan.options();
        if (!plan.flatDiscovery()) {
            return discovery.discover(plan.seedIds(), options, listener, cancellation);
        }
        logger.info("Fetching {} similar artists per seed (flat mode)...", options.similarLimit());
        List<DiscoveryResult> results = new ArrayList<>();
        for (String seedId : new LinkedHashSet<>(plan.seedIds())) {
            cancellation.throwIfCancelled("discovery");
            results.add(discovery.discoverSimilar(seedId, options));
        }
        return results.size() == 1 ? results.get(0) : merge(results);
    }

    /**
     * Combines flat results of several seeds; an artist keeps the position of its first appearance.
     */
    static DiscoveryResult merge(List<DiscoveryResult> results) {
        List<Artist> seeds = new ArrayList<>();
        Map<String, Artist> discovered = new LinkedHashMap<>();
        Map<String, Artist> filteredOut = new LinkedHashMap<>();
        Map<String, List<String>> tree = new LinkedHashMap<>();
        Set<String> countries = new LinkedHashSet<>();
        int maxDepth = 0;
        double seconds = 0;
        for (DiscoveryResult result : results) {
            seeds.addAll(result.seedArtists());
            result.discoveredArtists().forEach(a -> discovered.putIfAbsent(a.id(), a));
            result.filteredOutArtists().forEach(a -> filteredOut.putIfAbsent(a.id(), a));
            result.discoveryTree().forEach(tree::putIfAbsent);
            countries.addAll(result.countriesFound());
            maxDepth = Math.max(maxDepth, result.maxDepthReached());
            seconds += result.discoveryTimeSeconds();
        }
        return new DiscoveryResult(seeds, new ArrayList<>(discovered.values()), new ArrayList<>(filteredOut.values()),
            tree, countries, maxDepth, seconds, results.get(0).discoveryParams(), Instant.now());
    }

    private void exportDiscovery(HarvestPlan plan, DiscoveryResult result) {
        try {
            csvService.writeArtistsToCSV(result.discoveredArtists(), plan.outputDir().resolve(ARTISTS_CSV));
            if (plan.treeExport() != null) {
                exporter.write(result, plan.treeExport());
            }
        } catch (IOException e) {
            logger.error("Failed to export discovery results: {}", e.getMessage());
        }
    }

    private List<Artist> startSession(HarvestPlan plan, List<Artist> artists) {
        if (!plan.hasSession()) return artists;
        DiscoveryOptions options = plan.options();
        String signature = ProgressService.commandSignature(plan.seedIds(), options.similarLimit(), options.maxDepth(), options.songsPerArtist());
        if (plan.resume()) {
            Optional<ProgressCheckpoint> existing = progress.loadCheckpoint(plan.sessionName());
            if (existing.isPresent()) {
                ProgressCheckpoint checkpoint = existing.get();
                if (!progress.isCompatible(checkpoint, signature)) {
                    throw new IllegalStateException("Session '" + plan.sessionName()
                        + "' was started with different parameters; use --reset-progress to start over");
                }
                progress.progressSummary().ifPresent(summary -> logger.info("Resuming session:\n{}", summary));
                if (checkpoint.isComplete()) {
                    logger.info("Session {} is already complete", plan.sessionName());
                }
                return progress.remaining(artists, checkpoint);
            }
            logger.info("No checkpoint to resume for session {}; starting fresh", plan.sessionName());
        }
        progress.createCheckpoint(plan.sessionName(), artists.size(), signature);
        return artists;
    }

    private List<DownloadOutcome> downloadArtist(Artist artist, HarvestPlan plan, ProgressListener listener, CancellationSignal cancellation) {
        DiscoveryOptions options = plan.options();
        List<Track> tracks;
        try {
            tracks = catalog.getArtistTracks(artist.id(), selector.maxItems(options));
        } catch (OperationCancelledException e) {
            throw e;
        } catch (HarvesterException e) {
            logger.error("Error listing tracks of {}: {}", artist.name(), e.getMessage());
            return List.of();
        }
        List<Track> selected = selector.select(tracks, artist, options);
        if (selected.isEmpty()) {
            logger.warn("No tracks found for artist: {}", artist.name());
            return List.of();
        }
        Path artistDir = plan.shuffle() ? plan.outputDir() : plan.outputDir().resolve(folderName(artist));
        List<DownloadRequest> requests = new ArrayList<>();
        for (Track track : selected) {
            requests.add(new DownloadRequest(track.withQuality(options.quality()), artistDir.resolve(trackFileName(track, artist)), artist));
        }
        logger.info("Downloading {} tracks from {}...", requests.size(), artist.name());
        List<DownloadOutcome> outcomes = download.fetchAll(requests, listener, cancellation);
        long ok = outcomes.stream().filter(DownloadOutcome::success).count();
        logger.info("Downloaded {}/{} tracks from {}", ok, requests.size(), artist.name());
        return outcomes;
    }

    static String folderName(Artist artist) {
        String name = Utils.sanitizeFilename(artist.name().trim());
        return name.isEmpty() ? Utils.sanitizeFilename(artist.id()) : name;
    }

    static String trackFileName(Track track, Artist artist) {
        String base = Utils.sanitizeFilename(artist.name().trim() + " - " + track.title().trim());
        if (base.length() > MAX_FILENAME_LENGTH) {
            base = base.substring(0, MAX_FILENAME_LENGTH);
        }
        // Titles can repeat within an artist, the track id keeps names unique.
        return base + "_" + Utils.sanitizeFilename(track.id()) + ".mp3";
    }

    private void writeReport(Path target, List<DownloadOutcome> report) {
        try {
            csvService.writeDownloadReport(report, target);
        } catch (IOException e) {
            logger.error("Failed to write download report {}: {}", target, e.getMessage());
        }
    }

    private void postProcess(HarvestPlan plan, Counters counters) {
        if (plan.shuffle() && counters.downloaded > 0) {
            postProcessor.shuffleAndRenumber(plan.outputDir());
        }
        if (plan.archive()) {
            Path outputDir = plan.outputDir().toAbsolutePath().normalize();
            postProcessor.archive(outputDir, outputDir.resolveSibling(outputDir.getFileName() + ".zip"));
        }
    }

    private void reportResumePoint(HarvestPlan plan, Counters counters, Instant started) {
        logStatistics(counters.toStatistics(started));
        if (plan.hasSession()) {
            progress.progressSummary().ifPresent(summary -> logger.info("Last checkpoint:\n{}", summary));
            logger.info("Resume with --session {} --resume", plan.sessionName());
        }
    }

    private static void createDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new FileStorageException("Cannot create output directory " + dir, dir, e);
        }
        logger.info("Output directory: {}", dir);
    }

    private static Map<String, Integer> indexById(List<Artist> artists) {
        Map<String, Integer> positions = new LinkedHashMap<>();
        for (int i = 0; i < artists.size(); i++) {
            positions.putIfAbsent(artists.get(i).id(), i);
        }
        return positions;
    }

    private static void logStatistics(RunStatistics stats) {
        logger.info("Artists processed: {} (skipped {})", stats.artistsProcessed(), stats.artistsSkipped());
        logger.info("Tracks downloaded: {}, failed: {}", stats.tracksDownloaded(), stats.tracksFailed());
        logger.info("Total size: {} MB, duration: {} s", String.format("%.2f", stats.totalMegabytes()),
            String.format("%.1f", stats.duration().toMillis() / 1000.0));
        if (stats.tracksDownloaded() > 0) {
            logger.info("Avg time per track: {} s", String.format("%.2f", stats.averageSecondsPerTrack()));
        }
    }

    private static final class Counters {
        int processed;
        int skipped;
        int downloaded;
        int failed;
        long bytes;

        void add(List<DownloadOutcome> outcomes) {
            for (DownloadOutcome outcome : outcomes) {
                if (outcome.success()) {
                    downloaded++;
                    Long size = outcome.track().fileSize();
                    if (size != null) bytes += size;
                } else {
                    failed++;
                }
            }
        }

        RunStatistics toStatistics(Instant started) {
            return new RunStatistics(processed, skipped, downloaded, failed, bytes, Duration.between(started, Instant.now()));
        }
    }
}
