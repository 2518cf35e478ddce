package com.musicgraph.harvester.progress;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.musicgraph.harvester.JsonMappers;
import com.musicgraph.harvester.Utils;
import com.musicgraph.harvester.cache.CacheServiceInterface;
import com.musicgraph.harvester.error.CacheException;
import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.ProgressCheckpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Checkpoint store with a cache copy and a file copy per session.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Every save writes the whole current checkpoint to the cache under
 *       {@code harvester:progress:{session}} (30 days, 7 days once complete) and to
 *       {@code {progressDir}/{session}.json}.</li>
 *   <li>File writes go to a temporary sibling that is then moved over the target, so a crash
 *       leaves the previous checkpoint intact.</li>
 *   <li>Loads read both copies and keep the one updated last; on a tie the cache copy wins. A cache
 *       backend that missed writes while it was down therefore cannot roll a session back.</li>
 * </ul>
 * Session names are sanitized before they are used as file names or cache keys.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class ProgressService implements ProgressServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(ProgressService.class);

    static final String CACHE_KEY_PREFIX = "harvester:progress:";
    static final long ACTIVE_TTL_SECONDS = Duration.ofDays(30).toSeconds();
    static final long COMPLETE_TTL_SECONDS = Duration.ofDays(7).toSeconds();

    private final CacheServiceInterface cache;
    private final Path progressDir;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMappers.shared();
    private ProgressCheckpoint current;

    /**
     * @param cache cache copy, may be null for file-only storage
     * @param progressDir directory of the file copies
     */
    public ProgressService(CacheServiceInterface cache, Path progressDir) {
        this(cache, progressDir, Clock.systemUTC());
    }

    public ProgressService(CacheServiceInterface cache, Path progressDir, Clock clock) {
        this.cache = cache;
        this.progressDir = progressDir;
        this.clock = clock;
    }

    /**
     * Signature of the parameters that determine a run's artist set and order:
     * the first 12 hex digits of the MD5 of {@code sortedSeedIds_similar_depth_songs}.
     */
    public static String commandSignature(List<String> seedIds, int similarLimit, int maxDepth, int songsPerArtist) {
        List<String> sorted = new ArrayList<>(seedIds);
        sorted.sort(null);
        String content = String.join(",", sorted) + "_" + similarLimit + "_" + maxDepth + "_" + songsPerArtist;
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    @Override
    public synchronized ProgressCheckpoint createCheckpoint(String sessionName, int totalArtists, String commandSignature) {
        current = new ProgressCheckpoint(sessionName, totalArtists, commandSignature, clock.instant());
        persist(current, ACTIVE_TTL_SECONDS);
        logger.info("Created new progress checkpoint: {}", sessionName);
        return current.copy();
    }

    @Override
    public synchronized Optional<ProgressCheckpoint> loadCheckpoint(String sessionName) {
        Optional<ProgressCheckpoint> loaded = loadStored(sessionName);
        if (loaded.isEmpty()) {
            logger.info("No existing progress found for session: {}", sessionName);
            return Optional.empty();
        }
        current = loaded.get();
        return Optional.of(current.copy());
    }

    private Optional<ProgressCheckpoint> loadStored(String sessionName) {
        Optional<ProgressCheckpoint> cached = loadFromCache(sessionName);
        Optional<ProgressCheckpoint> filed = loadFromFile(sessionName);
        if (cached.isEmpty()) return filed;
        if (filed.isEmpty()) return cached;
        if (isNewer(filed.get(), cached.get())) {
            logger.info("Progress file for {} is newer than the cached copy, using the file", sessionName);
            return filed;
        }
        return cached;
    }

    private static boolean isNewer(ProgressCheckpoint candidate, ProgressCheckpoint reference) {
        Instant candidateTime = candidate.getLastUpdatedAt();
        Instant referenceTime = reference.getLastUpdatedAt();
        if (candidateTime == null) return false;
        return referenceTime == null || candidateTime.isAfter(referenceTime);
    }

    private Optional<ProgressCheckpoint> loadFromCache(String sessionName) {
        if (cache == null) return Optional.empty();
        try {
            Optional<String> json = cache.get(cacheKey(sessionName));
            if (json.isEmpty()) return Optional.empty();
            ProgressCheckpoint checkpoint = mapper.readValue(json.get(), ProgressCheckpoint.class);
            logger.debug("Loaded progress from cache: {}", sessionName);
            return Optional.of(checkpoint);
        } catch (CacheException | IOException e) {
            logger.warn("Could not load progress for {} from cache: {}", sessionName, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ProgressCheckpoint> loadFromFile(String sessionName) {
        Path file = progressFile(sessionName);
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            ProgressCheckpoint checkpoint = mapper.readValue(file.toFile(), ProgressCheckpoint.class);
            logger.debug("Loaded progress from file: {}", file);
            return Optional.of(checkpoint);
        } catch (IOException e) {
            logger.error("Failed to read progress file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void saveProgress(String sessionName, String artistId, int artistIndex) {
        saveProgress(sessionName, artistId, artistIndex, 0, 0);
    }

    @Override
    public synchronized void saveProgress(String sessionName, String artistId, int artistIndex, int tracksDownloaded, int tracksFailed) {
        if (current == null || !current.getSessionName().equals(sessionName)) {
            current = new ProgressCheckpoint(sessionName, 0, "", clock.instant());
        }
        current.recordArtist(artistId, artistIndex, clock.instant());
        current.addTrackCounts(tracksDownloaded, tracksFailed);
        persist(current, ACTIVE_TTL_SECONDS);
        logger.debug("Saved progress for {} (artist #{})", sessionName, artistIndex);
    }

    @Override
    public synchronized void markComplete(String sessionName) {
        if (current == null || !current.getSessionName().equals(sessionName)) {
            Optional<ProgressCheckpoint> loaded = loadStored(sessionName);
            if (loaded.isEmpty()) {
                logger.warn("Cannot mark unknown session {} complete", sessionName);
                return;
            }
            current = loaded.get();
        }
        current.setComplete(true);
        current.setLastUpdatedAt(clock.instant());
        persist(current, COMPLETE_TTL_SECONDS);
        logger.info("Marked session as complete: {}", sessionName);
    }

    @Override
    public synchronized boolean resetSession(String sessionName) {
        boolean deleted = false;
        if (cache != null) {
            try {
                if (cache.delete(cacheKey(sessionName))) {
                    logger.info("Deleted progress from cache: {}", sessionName);
                    deleted = true;
                }
            } catch (CacheException e) {
                logger.warn("Could not delete cached progress for {}: {}", sessionName, e.getMessage());
            }
        }
        Path file = progressFile(sessionName);
        try {
            if (Files.deleteIfExists(file)) {
                logger.info("Deleted progress file: {}", file);
                deleted = true;
            }
        } catch (IOException e) {
            logger.error("Failed to delete progress file {}: {}", file, e.getMessage());
        }
        if (current != null && current.getSessionName().equals(sessionName)) {
            current = null;
        }
        return deleted;
    }

    @Override
    public boolean isCompatible(ProgressCheckpoint checkpoint, String commandSignature) {
        if (!checkpoint.getCommandHash().equals(commandSignature)) {
            logger.warn("Checkpoint command hash mismatch! Checkpoint: {}, Current: {}", checkpoint.getCommandHash(), commandSignature);
            logger.warn("Resuming requires the same seeds, similar limit, depth and songs per artist. Use --reset-progress to start fresh.");
            return false;
        }
        return true;
    }

    @Override
    public List<Artist> remaining(List<Artist> artists, ProgressCheckpoint checkpoint) {
        if (checkpoint == null) return new ArrayList<>(artists);
        Set<String> processed = checkpoint.getProcessedArtistIds();
        List<Artist> remaining = new ArrayList<>();
        for (Artist artist : artists) {
            if (!processed.contains(artist.id())) remaining.add(artist);
        }
        logger.info("Filtered {} already-processed artists ({} remaining)", artists.size() - remaining.size(), remaining.size());
        return remaining;
    }

    @Override
    public synchronized Optional<ProgressCheckpoint> currentCheckpoint() {
        return current == null ? Optional.empty() : Optional.of(current.copy());
    }

    @Override
    public synchronized Optional<String> progressSummary() {
        if (current == null) return Optional.empty();
        int processed = current.getProcessedArtistIds().size();
        Instant started = current.getStartedAt();
        Instant updated = current.getLastUpdatedAt();
        double hours = started == null || updated == null ? 0.0 : Duration.between(started, updated).toSeconds() / 3600.0;
        return Optional.of(String.format(Locale.ROOT,
            "Session: %s%nProgress: %d/%d (%.1f%%)%nLast artist: %s%nElapsed: %.1f hours%nTracks: %d downloaded, %d failed",
            current.getSessionName(), processed, current.getTotalArtists(), current.getProgressPercent(),
            current.getLastArtistId() == null ? "-" : current.getLastArtistId(), hours,
            current.getTracksDownloaded(), current.getTracksFailed()));
    }

    Path progressFile(String sessionName) {
        return progressDir.resolve(Utils.sanitizeFilename(sessionName) + ".json");
    }

    private static String cacheKey(String sessionName) {
        return CACHE_KEY_PREFIX + Utils.sanitizeFilename(sessionName);
    }

    private void persist(ProgressCheckpoint checkpoint, long cacheTtlSeconds) {
        String json;
        try {
            json = mapper.writeValueAsString(checkpoint);
        } catch (IOException e) {
            logger.error("Failed to serialize checkpoint {}: {}", checkpoint.getSessionName(), e.getMessage());
            return;
        }
        if (cache != null) {
            try {
                cache.set(cacheKey(checkpoint.getSessionName()), json, cacheTtlSeconds);
            } catch (CacheException e) {
                logger.error("Failed to save progress to cache: {}", e.getMessage());
            }
        }
        Path file = progressFile(checkpoint.getSessionName());
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(progressDir);
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            logger.error("Failed to save progress file {}: {}", file, e.getMessage());
        }
    }
}
