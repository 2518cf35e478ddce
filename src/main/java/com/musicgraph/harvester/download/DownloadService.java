package com.musicgraph.harvester.download;

import com.musicgraph.harvester.HarvesterConfig;
import com.musicgraph.harvester.cache.CacheServiceInterface;
import com.musicgraph.harvester.catalog.CatalogServiceInterface;
import com.musicgraph.harvester.discovery.CancellationSignal;
import com.musicgraph.harvester.discovery.ProgressListener;
import com.musicgraph.harvester.error.CacheException;
import com.musicgraph.harvester.error.DownloadException;
import com.musicgraph.harvester.error.FileStorageException;
import com.musicgraph.harvester.error.HarvesterException;
import com.musicgraph.harvester.error.NetworkException;
import com.musicgraph.harvester.error.ServiceException;
import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.DownloadOutcome;
import com.musicgraph.harvester.model.DownloadRequest;
import com.musicgraph.harvester.model.ProgressUpdate;
import com.musicgraph.harvester.model.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Downloads tracks into a content-addressed cache directory and links them to requested outputs.
 * <p>
 * Workflow for one track:
 * <ul>
 *   <li>A {@code failed_track:{id}} entry in the cache means the track failed recently: skip it.</li>
 *   <li>A {@code track:{id}} entry pointing at an existing file is the fast path: hard-link it to
 *       the requested output.</li>
 *   <li>A non-empty canonical file already on disk is reused even when the cache lost its entry.</li>
 *   <li>Otherwise the media URL is resolved and the payload is streamed in chunks to
 *       {@code <canonical>.part}, then moved into place. The {@code .part} file is deleted on any failure.</li>
 *   <li>Network and business failures are recorded under {@code failed_track:{id}}; filesystem
 *       failures are not.</li>
 * </ul>
 * Fetches of the same track id are serialized so two requests never write the same canonical file.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class DownloadService implements DownloadServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(DownloadService.class);

    static final String TRACK_KEY_PREFIX = "track:";
    static final String FAILED_KEY_PREFIX = "failed_track:";

    private final CatalogServiceInterface catalog;
    private final CacheServiceInterface cache;
    private final MediaTransport transport;
    private final CanonicalFileNamer namer;
    private final long maxFileSizeBytes;
    private final int chunkSize;
    private final long trackTtlSeconds;
    private final long failedTtlSeconds;
    private final int maxConcurrentDownloads;
    private final Semaphore permits;
    private final ConcurrentHashMap<String, ReentrantLock> trackLocks = new ConcurrentHashMap<>();

    public DownloadService(CatalogServiceInterface catalog, CacheServiceInterface cache, MediaTransport transport, HarvesterConfig config) {
        this.catalog = catalog;
        this.cache = cache;
        this.transport = transport;
        this.namer = new CanonicalFileNamer(config.songsCacheDir());
        this.maxFileSizeBytes = config.maxFileSizeBytes();
        this.chunkSize = config.downloadChunkSize();
        this.trackTtlSeconds = config.effectiveSongsCacheTtlSeconds();
        this.failedTtlSeconds = config.failedTrackTtlSeconds();
        this.maxConcurrentDownloads = config.maxConcurrentDownloads();
        this.permits = new Semaphore(maxConcurrentDownloads);
    }

    @Override
    public boolean fetch(Track track, Path targetPath, Artist artistHint) {
        ReentrantLock lock = acquireTrackLock(track.id());
        try {
            return fetchLocked(track, targetPath, artistHint);
        } finally {
            releaseTrackLock(track.id(), lock);
        }
    }

    private ReentrantLock acquireTrackLock(String trackId) {
        while (true) {
            ReentrantLock lock = trackLocks.computeIfAbsent(trackId, id -> new ReentrantLock());
            lock.lock();
            if (trackLocks.get(trackId) == lock) return lock;
            // released and dropped by its last holder while this thread waited
            lock.unlock();
        }
    }

    private void releaseTrackLock(String trackId, ReentrantLock lock) {
        if (!lock.hasQueuedThreads()) {
            trackLocks.remove(trackId, lock);
        }
        lock.unlock();
    }

    int heldTrackLocks() {
        return trackLocks.size();
    }

    private boolean fetchLocked(Track track, Path targetPath, Artist artistHint) {
        String trackKey = TRACK_KEY_PREFIX + track.id();
        String failedKey = FAILED_KEY_PREFIX + track.id();

        Optional<String> recentFailure = cacheGet(failedKey);
        if (recentFailure.isPresent()) {
            logger.debug("Skipping recently failed track {}: {}", track.id(), recentFailure.get());
            return false;
        }

        Optional<String> cachedPath = cacheGet(trackKey);
        if (cachedPath.isPresent()) {
            Path cached = Paths.get(cachedPath.get());
            if (isUsable(cached)) {
                link(cached, targetPath);
                logger.debug("Using cached track {} from {}", track.id(), cached);
                return true;
            }
            logger.debug("Cached file for track {} is gone, dropping cache entry", track.id());
            cacheDelete(trackKey);
        }

        Path canonical = namer.canonicalPath(track, artistHint);
        if (isUsable(canonical)) {
            logger.debug("Reusing canonical file {} for track {}", canonical, track.id());
        } else {
            try {
                String url = catalog.getTrackDownloadUrl(track)
                    .orElseThrow(() -> new DownloadException("No download URL for track " + track.id(), track.id()));
                streamToCanonical(track, url, canonical);
            } catch (NetworkException | DownloadException e) {
                recordFailure(failedKey, track, e);
                throw e;
            } catch (ServiceException e) {
                NetworkException wrapped = new NetworkException("Catalog failed resolving track " + track.id() + ": " + e.getMessage(), e);
                recordFailure(failedKey, track, wrapped);
                throw wrapped;
            }
            logger.info("Downloaded track {} to {}", track.id(), canonical);
        }
        link(canonical, targetPath);
        cacheSet(trackKey, canonical.toString(), trackTtlSeconds);
        return true;
    }

    private void streamToCanonical(Track track, String url, Path canonical) {
        Path part = canonical.resolveSibling(canonical.getFileName() + ".part");
        try {
            Files.createDirectories(canonical.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new FileStorageException("Cannot create cache directory for " + canonical, canonical, e);
        }
        boolean promoted = false;
        try (MediaTransport.MediaResponse response = openMedia(track, url)) {
            if (response.contentLength() > maxFileSizeBytes) {
                throw new DownloadException(String.format("File too large: %.1f MB", response.contentLength() / 1024.0 / 1024.0), track.id());
            }
            copyChunks(track, response.body(), part);
            try {
                Files.move(part, canonical, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new FileStorageException("Cannot finalize " + canonical, canonical, e);
            }
            promoted = true;
        } catch (IOException e) {
            // raised by closing the response body
            logger.debug("Error closing media stream for track {}: {}", track.id(), e.getMessage());
        } finally {
            if (!promoted) deletePartial(part);
        }
    }

    private MediaTransport.MediaResponse openMedia(Track track, String url) {
        try {
            return transport.open(url);
        } catch (IOException e) {
            throw new NetworkException("Network error downloading track " + track.id() + ": " + e.getMessage(), e);
        } catch (DownloadException e) {
            throw new DownloadException(e.getMessage() + " for track " + track.id(), track.id());
        }
    }

    private void copyChunks(Track track, InputStream in, Path part) {
        OutputStream out;
        try {
            out = Files.newOutputStream(part);
        } catch (IOException e) {
            throw new FileStorageException("Cannot write " + part, part, e);
        }
        try (out) {
            byte[] buffer = new byte[chunkSize];
            long written = 0;
            while (true) {
                int read;
                try {
                    read = in.read(buffer);
                } catch (IOException e) {
                    throw new NetworkException("Network error downloading track " + track.id() + ": " + e.getMessage(), e);
                }
                if (read < 0) break;
                written += read;
                if (written > maxFileSizeBytes) {
                    throw new DownloadException("File too large: exceeds " + maxFileSizeBytes / 1024 / 1024 + " MB", track.id());
                }
                out.write(buffer, 0, read);
            }
            if (written == 0) {
                throw new DownloadException("Empty payload for track " + track.id(), track.id());
            }
        } catch (IOException e) {
            throw new FileStorageException("Cannot write " + part, part, e);
        }
    }

    private void link(Path canonical, Path target) {
        try {
            FileLinker.linkOrCopy(canonical, target);
        } catch (IOException e) {
            throw new FileStorageException("Cannot materialize " + target, target, e);
        }
    }

    private static boolean isUsable(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    private static void deletePartial(Path part) {
        try {
            Files.deleteIfExists(part);
        } catch (IOException e) {
            logger.warn("Could not delete partial file {}: {}", part, e.getMessage());
        }
    }

    private void recordFailure(String failedKey, Track track, HarvesterException e) {
        logger.warn("Download of track {} failed: {}", track.id(), e.getMessage());
        cacheSet(failedKey, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), failedTtlSeconds);
    }

    private Optional<String> cacheGet(String key) {
        try {
            return cache.get(key);
        } catch (CacheException e) {
            logger.warn("Cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void cacheSet(String key, String value, long ttlSeconds) {
        try {
            cache.set(key, value, ttlSeconds);
        } catch (CacheException e) {
            logger.warn("Cache write failed for {}, continuing without it: {}", key, e.getMessage());
        }
    }

    private void cacheDelete(String key) {
        try {
            cache.delete(key);
        } catch (CacheException e) {
            logger.warn("Cache delete failed for {}: {}", key, e.getMessage());
        }
    }

    @Override
    public List<DownloadOutcome> fetchAll(List<DownloadRequest> requests, ProgressListener listener, CancellationSignal cancellation) {
        List<DownloadOutcome> outcomes = new ArrayList<>();
        if (requests.isEmpty()) return outcomes;
        logger.info("Starting download of {} tracks", requests.size());

        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(requests.size(), maxConcurrentDownloads), r -> {
            Thread t = new Thread(r, "download-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        CompletionService<DownloadOutcome> completions = new ExecutorCompletionService<>(pool);
        long started = System.nanoTime();
        try {
            for (DownloadRequest request : requests) {
                completions.submit(() -> fetchWithPermit(request, cancellation));
            }
            for (int completed = 1; completed <= requests.size(); completed++) {
                DownloadOutcome outcome = completions.take().get();
                outcomes.add(outcome);
                double elapsed = (System.nanoTime() - started) / 1_000_000_000.0;
                long eta = Math.round(elapsed / completed * (requests.size() - completed));
                listener.onProgress(ProgressUpdate.download(
                    outcome.success() ? outcome.track().title() : "Failed: " + outcome.track().title(),
                    completed, requests.size(), eta));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            logger.warn("Interrupted after {} of {} downloads", outcomes.size(), requests.size());
        } catch (ExecutionException e) {
            // fetchWithPermit reports failures as outcomes
            throw new IllegalStateException("Unexpected download task failure", e.getCause());
        } finally {
            pool.shutdownNow();
        }
        long succeeded = outcomes.stream().filter(DownloadOutcome::success).count();
        logger.info("Completed download of {}/{} tracks", succeeded, requests.size());
        return outcomes;
    }

    private DownloadOutcome fetchWithPermit(DownloadRequest request, CancellationSignal cancellation) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DownloadOutcome.failed(request, "Cancelled");
        }
        try {
            if (cancellation.isCancelled()) {
                return DownloadOutcome.failed(request, "Cancelled");
            }
            Track track = request.track();
            if (!fetch(track, request.outputPath(), request.artist())) {
                return DownloadOutcome.failed(request, "Skipped: failed recently");
            }
            return DownloadOutcome.succeeded(request, track.withFile(request.outputPath(), Files.size(request.outputPath())));
        } catch (HarvesterException | IOException e) {
            logger.error("Failed to download track {}: {}", request.track().id(), e.getMessage());
            return DownloadOutcome.failed(request, e.getMessage());
        } finally {
            permits.release();
        }
    }
}
