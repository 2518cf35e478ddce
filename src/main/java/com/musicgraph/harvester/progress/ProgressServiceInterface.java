package com.musicgraph.harvester.progress;

import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.ProgressCheckpoint;

import java.util.List;
import java.util.Optional;

/**
 * Durable per-session progress for resumable runs.
 * <p>
 * Save operations are best-effort: failures are logged and never interrupt the caller.
 */
public interface ProgressServiceInterface {
    /**
     * Starts a fresh checkpoint for a session and persists it.
     * @param sessionName user-chosen session name
     * @param totalArtists number of artists the run will process
     * @param commandSignature signature of the parameters that shape the run
     * @return the new checkpoint, now the current one
     */
    ProgressCheckpoint createCheckpoint(String sessionName, int totalArtists, String commandSignature);

    /**
     * Loads a checkpoint, preferring the cache copy over the file copy.
     * @return the checkpoint, now the current one, or empty if none is stored
     */
    Optional<ProgressCheckpoint> loadCheckpoint(String sessionName);

    /**
     * Records one finished artist and persists the full checkpoint.
     */
    void saveProgress(String sessionName, String artistId, int artistIndex);

    /**
     * Same as {@link #saveProgress(String, String, int)}, also adding the artist's track counts.
     */
    void saveProgress(String sessionName, String artistId, int artistIndex, int tracksDownloaded, int tracksFailed);

    void markComplete(String sessionName);

    /**
     * Deletes every stored copy of a session.
     * @return true if anything was deleted
     */
    boolean resetSession(String sessionName);

    /**
     * @return true if the checkpoint was created with the same command signature
     */
    boolean isCompatible(ProgressCheckpoint checkpoint, String commandSignature);

    /**
     * Artists not yet processed according to the checkpoint, in input order.
     */
    List<Artist> remaining(List<Artist> artists, ProgressCheckpoint checkpoint);

    Optional<ProgressCheckpoint> currentCheckpoint();

    /**
     * @return human-readable summary of the current checkpoint, empty if there is none
     */
    Optional<String> progressSummary();
}
