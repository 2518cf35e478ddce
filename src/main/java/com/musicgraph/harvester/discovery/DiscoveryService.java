package com.musicgraph.harvester.discovery;

import com.musicgraph.harvester.HarvesterConfig;
import com.musicgraph.harvester.catalog.CatalogServiceInterface;
import com.musicgraph.harvester.error.HarvesterException;
import com.musicgraph.harvester.error.NotFoundException;
import com.musicgraph.harvester.error.OperationCancelledException;
import com.musicgraph.harvester.error.ServiceException;
import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.DiscoveryOptions;
import com.musicgraph.harvester.model.DiscoveryResult;
import com.musicgraph.harvester.model.ProgressUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Level-synchronous breadth-first discovery over the catalog's similar-artist relation.
 * <p>
 * Workflow per level:
 * <ul>
 *   <li>The frontier is cut into batches of {@code batchSize}; batches are separated by a short pause.</li>
 *   <li>Within a batch, similar lists are fetched and ranked concurrently on a pool of
 *       {@code fetchConcurrency} threads. With year filtering, the year probes of the best-ranked
 *       candidates are started on the same pool as soon as the lists are in.</li>
 *   <li>Admission then walks the batch in frontier order, and each parent's candidates in ranked
 *       order, through {@link DiscoveryState#tryAdmit}. The resulting tree does not depend on
 *       which fetch finished first.</li>
 *   <li>With year filtering a parent probes at most {@code maxSimilarArtistAttempts} unvisited
 *       candidates; quota left after that stays unfilled.</li>
 * </ul>
 * <p>
 * Error Handling: a parent whose similar list cannot be fetched contributes no children. If every
 * parent of a level fails the catalog is considered down and a {@link ServiceException} is raised.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class DiscoveryService implements DiscoveryServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(DiscoveryService.class);

    static final int MIN_SIMILAR_FETCH = 50;

    private final CatalogServiceInterface catalog;
    private final YearContentProbe probe;
    private final CandidateRanker ranker = new CandidateRanker();
    private final int batchSize;
    private final int fetchConcurrency;
    private final long batchPauseMs;

    public DiscoveryService(CatalogServiceInterface catalog, YearContentProbe probe, HarvesterConfig config) {
        this(catalog, probe, config.discoveryBatchSize(), config.similarFetchConcurrency(), config.discoveryBatchPauseMs());
    }

    /**
     * @param catalog catalog to traverse
     * @param probe year-content probe
     * @param batchSize frontier entities per batch
     * @param fetchConcurrency concurrent similar-list fetches within a batch
     * @param batchPauseMs pause between batches
     */
    public DiscoveryService(CatalogServiceInterface catalog, YearContentProbe probe, int batchSize, int fetchConcurrency, long batchPauseMs) {
        if (batchSize < 1 || fetchConcurrency < 1) {
            throw new IllegalArgumentException("batchSize and fetchConcurrency must be >= 1");
        }
        this.catalog = catalog;
        this.probe = probe;
        this.batchSize = batchSize;
        this.fetchConcurrency = fetchConcurrency;
        this.batchPauseMs = batchPauseMs;
    }

    @Override
    public DiscoveryResult discover(String seedId, DiscoveryOptions options) {
        return discover(List.of(seedId), options, ProgressListener.NONE, new CancellationSignal());
    }

    @Override
    public DiscoveryResult discover(List<String> seedIds, DiscoveryOptions options, ProgressListener listener, CancellationSignal cancellation) {
        if (seedIds == null || seedIds.isEmpty()) {
            throw new IllegalArgumentException("At least one seed artist is required");
        }
        long started = System.nanoTime();
        List<Artist> seeds = resolveSeeds(seedIds);
        logger.info("Starting discovery from {} (depth={}, similar={}, max_artists={})",
            describeSeeds(seeds), options.maxDepth(), options.similarLimit(), options.maxTotalArtists());

        ExecutorService pool = Executors.newFixedThreadPool(fetchConcurrency, daemonFactory());
        try {
            DiscoveryState state = new DiscoveryState();
            Set<String> seedRegions = new LinkedHashSet<>();
            List<String> frontier = new ArrayList<>();
            for (Artist seed : seeds) {
                boolean included = !options.probesYearContent() || probe.hasContent(seed.id(), options.years());
                if (!included) {
                    logger.info("Seed {} has no content in {}; traversing from it without including it", seed.name(), options.years());
                }
                if (state.addSeed(seed, included)) {
                    frontier.add(seed.id());
                    if (seed.country() != null) seedRegions.add(seed.country());
                }
            }

            for (int depth = 1; depth <= options.maxDepth(); depth++) {
                cancellation.throwIfCancelled("discovery level " + depth);
                if (state.atCapacity(options.maxTotalArtists())) {
                    logger.info("Reached maximum artist limit ({})", options.maxTotalArtists());
                    break;
                }
                if (frontier.isEmpty()) {
                    logger.info("No more artists to discover at depth {}", depth);
                    break;
                }
                if (options.similarLimit() == 0) break;
                logger.info("Processing level {}/{}: {} artists", depth, options.maxDepth(), frontier.size());
                frontier = expandLevel(frontier, depth, options, state, seedRegions, pool, listener, cancellation);
                logger.info("Level {} complete: {} total artists, {} for next level", depth, state.nodeCount(), frontier.size());
            }

            double seconds = (System.nanoTime() - started) / 1_000_000_000.0;
            List<Artist> discovered = state.discoveredArtists();
            logger.info("Discovery complete: {} artists (max depth {}) in {}s",
                discovered.size(), state.maxDepthReached(), String.format("%.2f", seconds));
            return new DiscoveryResult(seeds, discovered, state.filteredOutArtists(), state.tree(), state.countries(),
                state.maxDepthReached(), seconds, options.describe(), Instant.now());
        } finally {
            pool.shutdownNow();
        }
    }

    private List<String> expandLevel(List<String> frontier, int depth, DiscoveryOptions options, DiscoveryState state,
                                     Set<String> seedRegions, ExecutorService pool, ProgressListener listener,
                                     CancellationSignal cancellation) {
        List<String> next = new ArrayList<>();
        Map<String, Future<Boolean>> probes = new ConcurrentHashMap<>();
        int fetchLimit = Math.max(MIN_SIMILAR_FETCH, options.similarLimit());
        int processed = 0;
        int failed = 0;
        String lastError = null;

        for (int start = 0; start < frontier.size(); start += batchSize) {
            if (state.atCapacity(options.maxTotalArtists())) break;
            cancellation.throwIfCancelled("discovery level " + depth);
            List<String> batch = frontier.subList(start, Math.min(frontier.size(), start + batchSize));

            Map<String, Future<List<Artist>>> fetches = new LinkedHashMap<>();
            for (String parentId : batch) {
                fetches.put(parentId, pool.submit(() ->
                    ranker.rank(catalog.getSimilarArtists(parentId, fetchLimit), state::isVisited, options, seedRegions)));
            }
            Map<String, List<Artist>> ranked = new LinkedHashMap<>();
            for (Map.Entry<String, Future<List<Artist>>> fetch : fetches.entrySet()) {
                try {
                    ranked.put(fetch.getKey(), fetch.getValue().get());
                } catch (ExecutionException e) {
                    failed++;
                    lastError = e.getCause() == null ? e.getMessage() : e.getCause().getMessage();
                    logger.warn("Failed to get similar artists for {}: {}", nameOf(state, fetch.getKey()), lastError);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new OperationCancelledException("Interrupted during discovery level " + depth);
                }
                processed++;
            }

            if (options.probesYearContent()) {
                for (List<Artist> candidates : ranked.values()) {
                    prefetchProbes(candidates, options, state, probes, pool);
                }
            }

            for (String parentId : batch) {
                cancellation.throwIfCancelled("discovery level " + depth);
                state.openParent(parentId);
                List<Artist> candidates = ranked.get(parentId);
                if (candidates != null) {
                    next.addAll(admit(parentId, candidates, depth, options, state, probes));
                }
                listener.onProgress(ProgressUpdate.discovery(depth, options.maxDepth(), nameOf(state, parentId),
                    state.nodeCount(), options.maxTotalArtists()));
            }

            if (start + batchSize < frontier.size() && batchPauseMs > 0) {
                pause(depth);
            }
        }

        if (processed > 0 && failed == processed) {
            throw new ServiceException("Similar-artist lookups failed for all " + processed
                + " artists at depth " + depth + ": " + lastError, "catalog");
        }
        return next;
    }

    /**
     * Starts probes for the candidates a parent will need if every probe succeeds.
     */
    private void prefetchProbes(List<Artist> candidates, DiscoveryOptions options, DiscoveryState state,
                                Map<String, Future<Boolean>> probes, ExecutorService pool) {
        int wanted = Math.min(options.similarLimit(), options.maxSimilarArtistAttempts());
        int started = 0;
        for (Artist candidate : candidates) {
            if (started >= wanted) break;
            if (state.isVisited(candidate.id())) continue;
            probes.computeIfAbsent(candidate.id(), id -> pool.submit(() -> probe.hasContent(id, options.years())));
            started++;
        }
    }

    private List<String> admit(String parentId, List<Artist> candidates, int depth, DiscoveryOptions options,
                               DiscoveryState state, Map<String, Future<Boolean>> probes) {
        List<String> admitted = new ArrayList<>();
        int attempts = 0;
        int skipped = 0;
        for (Artist candidate : candidates) {
            if (admitted.size() >= options.similarLimit()) break;
            if (state.atCapacity(options.maxTotalArtists())) break;
            if (state.isVisited(candidate.id())) continue;
            if (options.probesYearContent()) {
                attempts++;
                if (attempts > options.maxSimilarArtistAttempts()) {
                    logger.debug("Reached max attempts ({}) for {}", options.maxSimilarArtistAttempts(), nameOf(state, parentId));
                    break;
                }
                if (!probeResult(candidate, options, probes)) {
                    logger.debug("Skipping {}: no content in {}", candidate.name(), options.years());
                    state.recordFilteredOut(candidate, parentId, depth);
                    skipped++;
                    continue;
                }
            }
            if (state.tryAdmit(candidate, parentId, depth, options.maxTotalArtists())) {
                admitted.add(candidate.id());
            }
        }
        if (options.probesYearContent()) {
            logger.info("  {}: added {} artists, skipped {} (checked {})", nameOf(state, parentId), admitted.size(), skipped,
                Math.min(attempts, options.maxSimilarArtistAttempts()));
        } else {
            logger.debug("  {}: added {} artists", nameOf(state, parentId), admitted.size());
        }
        return admitted;
    }

    private boolean probeResult(Artist candidate, DiscoveryOptions options, Map<String, Future<Boolean>> probes) {
        Future<Boolean> prefetched = probes.get(candidate.id());
        if (prefetched == null) {
            boolean result = probe.hasContent(candidate.id(), options.years());
            probes.put(candidate.id(), CompletableFuture.completedFuture(result));
            return result;
        }
        try {
            return prefetched.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof OperationCancelledException) {
                throw (OperationCancelledException) e.getCause();
            }
            logger.warn("Year probe for {} failed: {}; including it", candidate.name(), e.getMessage());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while probing " + candidate.id());
        }
    }

    @Override
    public DiscoveryResult discoverSimilar(String artistId, DiscoveryOptions options) {
        long started = System.nanoTime();
        Artist seed = resolveSeeds(List.of(artistId)).get(0);
        DiscoveryState state = new DiscoveryState();
        state.addSeed(seed, true);
        state.openParent(seed.id());
        Set<String> seedRegions = seed.country() == null ? Set.of() : Set.of(seed.country());
        List<Artist> ranked = ranker.rank(catalog.getSimilarArtists(seed.id(), options.similarLimit()), state::isVisited, options, seedRegions);
        int admitted = 0;
        for (Artist candidate : ranked) {
            if (admitted >= options.similarLimit()) break;
            if (state.tryAdmit(candidate, seed.id(), 1, options.maxTotalArtists())) admitted++;
        }
        double seconds = (System.nanoTime() - started) / 1_000_000_000.0;
        logger.info("Found {} similar artists for {}", admitted, seed.name());
        return new DiscoveryResult(List.of(seed), state.discoveredArtists(), List.of(), state.tree(), state.countries(),
            state.maxDepthReached(), seconds, options.describe(), Instant.now());
    }

    private List<Artist> resolveSeeds(List<String> seedIds) {
        List<Artist> seeds = new ArrayList<>();
        for (String seedId : new LinkedHashSet<>(seedIds)) {
            Artist seed;
            try {
                seed = catalog.getArtist(seedId)
                    .orElseThrow(() -> new NotFoundException("Artist " + seedId + " not found", "artist"));
            } catch (NotFoundException | OperationCancelledException e) {
                throw e;
            } catch (HarvesterException e) {
                throw new ServiceException("Could not resolve seed artist " + seedId + ": " + e.getMessage(), "catalog", e);
            }
            seeds.add(seed);
        }
        return seeds;
    }

    private void pause(int depth) {
        try {
            Thread.sleep(batchPauseMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted during discovery level " + depth);
        }
    }

    private static String nameOf(DiscoveryState state, String artistId) {
        Artist artist = state.node(artistId);
        return artist == null || artist.name().isBlank() ? artistId : artist.name();
    }

    private static String describeSeeds(List<Artist> seeds) {
        if (seeds.size() == 1) return seeds.get(0).name();
        return seeds.size() + " seeds";
    }

    private static ThreadFactory daemonFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "discovery-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
