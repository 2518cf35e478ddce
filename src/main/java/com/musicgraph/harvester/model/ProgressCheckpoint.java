package com.musicgraph.harvester.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Durable progress record of one named session.
 * <p>
 * Persisted as a flat JSON document; the snake_case field names are part of the on-disk format
 * and must stay stable. Unknown fields are ignored so older binaries can read newer documents.
 * <p>
 * Invariants:
 * <ul>
 *   <li>{@code processedArtistIds} only grows until the session is reset.</li>
 *   <li>{@code lastArtistIndex} never decreases within a session.</li>
 * </ul>
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProgressCheckpoint {

    @JsonProperty("session_name")
    private String sessionName;

    @JsonProperty("total_artists")
    private int totalArtists;

    @JsonProperty("processed_artist_ids")
    private Set<String> processedArtistIds = new LinkedHashSet<>();

    @JsonProperty("last_artist_index")
    private int lastArtistIndex = -1;

    @JsonProperty("last_artist_id")
    private String lastArtistId;

    @JsonProperty("command_hash")
    private String commandHash = "";

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("last_updated_at")
    private Instant lastUpdatedAt;

    @JsonProperty("is_complete")
    private boolean complete;

    @JsonProperty("tracks_downloaded")
    private int tracksDownloaded;

    @JsonProperty("tracks_failed")
    private int tracksFailed;

    public ProgressCheckpoint() {
    }

    public ProgressCheckpoint(String sessionName, int totalArtists, String commandHash, Instant now) {
        this.sessionName = sessionName;
        this.totalArtists = totalArtists;
        this.commandHash = commandHash == null ? "" : commandHash;
        this.startedAt = now;
        this.lastUpdatedAt = now;
    }

    /**
     * Records one finished artist. The index only moves forward.
     */
    public void recordArtist(String artistId, int index, Instant now) {
        processedArtistIds.add(artistId);
        lastArtistId = artistId;
        lastArtistIndex = Math.max(lastArtistIndex, index);
        lastUpdatedAt = now;
    }

    public void addTrackCounts(int downloaded, int failed) {
        tracksDownloaded += Math.max(0, downloaded);
        tracksFailed += Math.max(0, failed);
    }

    public boolean isArtistProcessed(String artistId) {
        return processedArtistIds.contains(artistId);
    }

    /**
     * @return deep copy safe to hand to another thread or serializer
     */
    public ProgressCheckpoint copy() {
        ProgressCheckpoint copy = new ProgressCheckpoint(sessionName, totalArtists, commandHash, startedAt);
        copy.processedArtistIds = new LinkedHashSet<>(processedArtistIds);
        copy.lastArtistIndex = lastArtistIndex;
        copy.lastArtistId = lastArtistId;
        copy.lastUpdatedAt = lastUpdatedAt;
        copy.complete = complete;
        copy.tracksDownloaded = tracksDownloaded;
        copy.tracksFailed = tracksFailed;
        return copy;
    }

    @JsonIgnore
    public double getProgressPercent() {
        if (totalArtists <= 0) return 0.0;
        return processedArtistIds.size() * 100.0 / totalArtists;
    }

    public String getSessionName() { return sessionName; }
    public void setSessionName(String sessionName) { this.sessionName = sessionName; }

    public int getTotalArtists() { return totalArtists; }
    public void setTotalArtists(int totalArtists) { this.totalArtists = totalArtists; }

    public Set<String> getProcessedArtistIds() { return processedArtistIds; }
    public void setProcessedArtistIds(Set<String> ids) { this.processedArtistIds = ids == null ? new LinkedHashSet<>() : new LinkedHashSet<>(ids); }

    public int getLastArtistIndex() { return lastArtistIndex; }
    public void setLastArtistIndex(int lastArtistIndex) { this.lastArtistIndex = lastArtistIndex; }

    public String getLastArtistId() { return lastArtistId; }
    public void setLastArtistId(String lastArtistId) { this.lastArtistId = lastArtistId; }

    public String getCommandHash() { return commandHash; }
    public void setCommandHash(String commandHash) { this.commandHash = commandHash; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getLastUpdatedAt() { return lastUpdatedAt; }
    public void setLastUpdatedAt(Instant lastUpdatedAt) { this.lastUpdatedAt = lastUpdatedAt; }

    public boolean isComplete() { return complete; }
    public void setComplete(boolean complete) { this.complete = complete; }

    public int getTracksDownloaded() { return tracksDownloaded; }
    public void setTracksDownloaded(int tracksDownloaded) { this.tracksDownloaded = tracksDownloaded; }

    public int getTracksFailed() { return tracksFailed; }
    public void setTracksFailed(int tracksFailed) { this.tracksFailed = tracksFailed; }
}
