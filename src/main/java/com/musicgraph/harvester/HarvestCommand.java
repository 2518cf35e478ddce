package com.musicgraph.harvester;

import com.musicgraph.harvester.cache.CacheServiceFactory;
import com.musicgraph.harvester.cache.CacheServiceInterface;
import com.musicgraph.harvester.catalog.CatalogServiceInterface;
import com.musicgraph.harvester.catalog.HttpCatalogService;
import com.musicgraph.harvester.discovery.CancellationSignal;
import com.musicgraph.harvester.discovery.DiscoveryService;
import com.musicgraph.harvester.discovery.YearContentProbe;
import com.musicgraph.harvester.download.DownloadService;
import com.musicgraph.harvester.download.HttpMediaTransport;
import com.musicgraph.harvester.error.HarvesterException;
import com.musicgraph.harvester.error.NotFoundException;
import com.musicgraph.harvester.error.OperationCancelledException;
import com.musicgraph.harvester.model.DiscoveryOptions;
import com.musicgraph.harvester.model.ProgressType;
import com.musicgraph.harvester.model.ProgressUpdate;
import com.musicgraph.harvester.model.Quality;
import com.musicgraph.harvester.model.YearRange;
import com.musicgraph.harvester.progress.ProgressService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command-line surface of the harvester.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Validates flag combinations; violations are usage errors (exit code 2).</li>
 *   <li>Builds the configuration from the environment and applies flag overrides.</li>
 *   <li>Wires the cache, catalog, discovery, download and progress services and runs a {@link HarvestRunner}.</li>
 *   <li>Maps the outcome to an exit code: 0 success, 1 fatal error, 130 interrupted.</li>
 * </ul>
 * A shutdown hook turns Ctrl+C into cooperative cancellation and waits briefly for the current
 * download to settle, so the last checkpoint stays valid.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
@Command(
    name = "harvest",
    mixinStandardHelpOptions = true,
    version = "similar-artist-harvester 1.0.0",
    description = "Discover similar artists recursively and download their top tracks.")
public class HarvestCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(HarvestCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_INTERRUPTED = 130;
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    @Spec
    CommandSpec spec;

    @Option(names = {"-a", "--artist-id"}, split = ",", paramLabel = "ID", description = "Seed artist id(s), comma-separated or repeated")
    List<String> artistIds = new ArrayList<>();

    @Option(names = "--artist-file", paramLabel = "FILE", description = "File with one seed artist id per line (# starts a comment)")
    Path artistFile;

    @Option(names = {"-o", "--output-dir"}, required = true, paramLabel = "DIR", description = "Output directory for downloaded tracks")
    Path outputDir;

    @Option(names = {"-n", "--tracks", "--songs-per-artist"}, defaultValue = "10", paramLabel = "N", description = "Top tracks per artist (default: ${DEFAULT-VALUE})")
    int tracks;

    @Option(names = {"-s", "--similar"}, defaultValue = "0", paramLabel = "N", description = "Similar artists per artist (default: ${DEFAULT-VALUE}, seed only)")
    int similar;

    @Option(names = {"-d", "--depth"}, defaultValue = "0", paramLabel = "N", description = "Recursive discovery depth (default: ${DEFAULT-VALUE}, flat)")
    int depth;

    @Option(names = "--max-artists", defaultValue = "999", paramLabel = "N", description = "Upper bound on discovered artists, seeds included (default: ${DEFAULT-VALUE})")
    int maxArtists;

    @Option(names = "--min-tracks", defaultValue = "0", paramLabel = "N", description = "Minimum catalog size of a similar artist (default: ${DEFAULT-VALUE})")
    int minTracks;

    @Option(names = "--exclude", split = ",", paramLabel = "IDS", description = "Artist ids to exclude")
    List<String> exclude = new ArrayList<>();

    @Option(names = {"-y", "--years"}, paramLabel = "RANGE", description = "Year filter, e.g. 2020 or 2020-2024")
    String years;

    @Option(names = "--year-filter-discovery", description = "Skip similar artists without tracks in the year range")
    boolean yearFilterDiscovery;

    @Option(names = "--max-attempts", defaultValue = "20", paramLabel = "N", description = "Candidates probed per artist when filtering discovery by year (default: ${DEFAULT-VALUE})")
    int maxAttempts;

    @Option(names = {"-c", "--countries"}, split = ",", paramLabel = "CODES", description = "Allowed region codes, or SAME for the seed's region")
    List<String> countries = new ArrayList<>();

    @Option(names = "--priority-countries", split = ",", paramLabel = "CODES", description = "Region codes ranked first")
    List<String> priorityCountries = new ArrayList<>();

    @Option(names = "--in-top", paramLabel = "N|P%", description = "Only consider the N (or P percent) most popular tracks; requires --years")
    String inTop;

    @Option(names = "--no-explicit", description = "Skip explicit tracks")
    boolean noExplicit;

    @Option(names = {"-q", "--quality"}, defaultValue = "high", paramLabel = "LEVEL", description = "low, medium or high (default: ${DEFAULT-VALUE})")
    String quality;

    @Option(names = {"-p", "--parallel"}, defaultValue = "2", paramLabel = "N", description = "Parallel downloads (default: ${DEFAULT-VALUE})")
    int parallel;

    @Option(names = "--shuffle", description = "Put all tracks in one folder with numeric prefixes (001_, 002_, ...)")
    boolean shuffle;

    @Option(names = "--zip", description = "Pack the output directory into a ZIP file next to it")
    boolean zip;

    @Option(names = "--export-tree", paramLabel = "FILE", description = "Write the discovery tree as JSON")
    Path exportTree;

    @Option(names = "--session", paramLabel = "NAME", description = "Checkpoint session name")
    String session;

    @Option(names = "--resume", description = "Resume the named session")
    boolean resume;

    @Option(names = "--reset-progress", description = "Delete the named session's progress before starting")
    boolean resetProgress;

    @Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    boolean verbose;

    @Override
    public Integer call() {
        HarvestPlan plan = buildPlan();
        if (verbose) Main.enableDebugLogging();
        HarvesterConfig config = HarvesterConfig.fromEnvironment().withMaxConcurrentDownloads(parallel);

        CancellationSignal cancellation = new CancellationSignal();
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            logger.warn("Interrupt received, stopping after the current downloads...");
            cancellation.cancel();
            try {
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "harvest-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return execute(plan, config, cancellation);
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    private int execute(HarvestPlan plan, HarvesterConfig config, CancellationSignal cancellation) {
        logger.info("Initializing services...");
        try (CacheServiceInterface cache = CacheServiceFactory.create(config)) {
            CatalogServiceInterface catalog = new HttpCatalogService(config, cache);
            try (YearContentProbe probe = new YearContentProbe(catalog)) {
                HarvestRunner runner = new HarvestRunner(
                    catalog,
                    new DiscoveryService(catalog, probe, config),
                    new DownloadService(catalog, cache, new HttpMediaTransport(Duration.ofSeconds(config.catalogTimeoutSeconds())), config),
                    new ProgressService(cache, config.progressDir()),
                    new CsvService(),
                    new PostProcessor());
                runner.run(plan, HarvestCommand::logProgress, cancellation);
                return EXIT_OK;
            }
        } catch (OperationCancelledException e) {
            logger.warn("Interrupted by user");
            return EXIT_INTERRUPTED;
        } catch (NotFoundException e) {
            logger.error("{}", e.getMessage());
            return EXIT_FATAL;
        } catch (HarvesterException | IllegalStateException e) {
            if (verbose) {
                logger.error("Fatal error: {}", e.getMessage(), e);
            } else {
                logger.error("Fatal error: {}", e.getMessage());
            }
            return EXIT_FATAL;
        }
    }

    /**
     * Validates the flags and turns them into a plan.
     * @throws ParameterException on an invalid combination
     */
    HarvestPlan buildPlan() {
        if (tracks < 1) throw usage("--tracks must be >= 1");
        if (similar < 0) throw usage("--similar must be >= 0");
        if (depth < 0) throw usage("--depth must be >= 0");
        if (parallel < 1) throw usage("--parallel must be >= 1");
        if (maxArtists < 1) throw usage("--max-artists must be >= 1");
        if (maxAttempts < 1) throw usage("--max-attempts must be >= 1");
        if (depth > 0 && similar == 0) throw usage("--depth > 0 requires --similar > 0 (recursive discovery needs similar artists)");
        boolean hasSession = session != null && !session.isBlank();
        if ((resume || resetProgress) && !hasSession) throw usage("--resume and --reset-progress require --session");
        if (resume && resetProgress) throw usage("--resume and --reset-progress are mutually exclusive");
        if (inTop != null && years == null) throw usage("--in-top requires --years");
        if (yearFilterDiscovery && years == null) throw usage("--year-filter-discovery requires --years");

        List<String> seeds = seedIds();
        if (seeds.isEmpty()) throw usage("Provide at least one seed with --artist-id or --artist-file");

        DiscoveryOptions.Builder options = DiscoveryOptions.builder()
            .songsPerArtist(tracks)
            .similarLimit(similar)
            .maxDepth(depth)
            .maxTotalArtists(maxArtists)
            .minTracksPerArtist(minTracks)
            .regions(countries)
            .priorityRegions(priorityCountries)
            .excludeArtists(Set.copyOf(exclude))
            .yearFilteringForDiscovery(yearFilterDiscovery)
            .maxSimilarArtistAttempts(maxAttempts)
            .excludeExplicit(noExplicit);
        try {
            options.quality(Quality.fromString(quality));
            if (years != null) options.years(YearRange.parse(years));
        } catch (IllegalArgumentException e) {
            throw usage(e.getMessage());
        }
        if (inTop != null) applyInTop(options, inTop.trim());
        return new HarvestPlan(seeds, outputDir, options.build(), hasSession ? session.trim() : null,
            resume, resetProgress, shuffle, zip, exportTree);
    }

    private void applyInTop(DiscoveryOptions.Builder options, String value) {
        try {
            if (value.endsWith("%")) {
                double percent = Double.parseDouble(value.substring(0, value.length() - 1).trim());
                if (percent <= 0 || percent > 100) throw usage("--in-top percentage must be in (0, 100]");
                options.inTopPercent(percent);
            } else {
                int n = Integer.parseInt(value);
                if (n < 1) throw usage("--in-top must be >= 1");
                options.inTopN(n);
            }
        } catch (NumberFormatException e) {
            throw usage("Invalid --in-top value: " + value);
        }
    }

    private List<String> seedIds() {
        Set<String> seeds = new LinkedHashSet<>();
        artistIds.stream().map(String::trim).filter(id -> !id.isEmpty()).forEach(seeds::add);
        if (artistFile != null) {
            try {
                for (String line : Files.readAllLines(artistFile)) {
                    String id = line.trim();
                    if (!id.isEmpty() && !id.startsWith("#")) seeds.add(id);
                }
            } catch (IOException e) {
                throw usage("Cannot read --artist-file " + artistFile + ": " + e.getMessage());
            }
        }
        return new ArrayList<>(seeds);
    }

    private ParameterException usage(String message) {
        return new ParameterException(spec.commandLine(), message);
    }

    private static void logProgress(ProgressUpdate update) {
        if (update.type() == ProgressType.DISCOVERY) {
            logger.debug("Discovery: depth {} | artist: {} | total: {}", update.currentDepth(), update.currentItem(), update.discoveredCount());
        } else if (update.type() == ProgressType.DOWNLOAD) {
            logger.debug("Download: {}/{} ({}%) {} | ETA {}s", update.itemsCompleted(), update.itemsTotal(),
                String.format("%.0f", update.progressPercent()), update.currentItem(), update.etaSeconds());
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("JVM is shutting down, shutdown hook stays registered");
        }
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new HarvestCommand());
    }
}
