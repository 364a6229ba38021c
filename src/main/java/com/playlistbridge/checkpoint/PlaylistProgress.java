package com.playlistbridge.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Progress of one source playlist within a transfer run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlaylistProgress {

    private final String sourcePlaylistId;
    private final String name;
    private String targetPlaylistId;
    private int totalTracks;
    private int processedTrackCount;
    private int tracksFound;
    private int tracksNotFound;
    private PlaylistStatus status;
    private String failureReason;

    public PlaylistProgress(String sourcePlaylistId, String name, int totalTracks) {
        this(sourcePlaylistId, name, null, totalTracks, 0, 0, 0, PlaylistStatus.PENDING, null);
    }

    @JsonCreator
    public PlaylistProgress(
            @JsonProperty("sourcePlaylistId") String sourcePlaylistId,
            @JsonProperty("name") String name,
            @JsonProperty("targetPlaylistId") String targetPlaylistId,
            @JsonProperty("totalTracks") int totalTracks,
            @JsonProperty("processedTrackCount") int processedTrackCount,
            @JsonProperty("tracksFound") int tracksFound,
            @JsonProperty("tracksNotFound") int tracksNotFound,
            @JsonProperty("status") PlaylistStatus status,
            @JsonProperty("failureReason") String failureReason) {
        if (sourcePlaylistId == null || sourcePlaylistId.isBlank()) {
            throw new IllegalArgumentException("sourcePlaylistId is required");
        }
        this.sourcePlaylistId = sourcePlaylistId;
        this.name = name != null ? name : "";
        this.targetPlaylistId = blankToNull(targetPlaylistId);
        this.processedTrackCount = Math.max(0, processedTrackCount);
        this.totalTracks = Math.max(totalTracks, this.processedTrackCount);
        this.tracksFound = Math.max(0, tracksFound);
        this.tracksNotFound = Math.max(0, tracksNotFound);
        this.status = status != null ? status : PlaylistStatus.PENDING;
        this.failureReason = failureReason;
    }

    public String getSourcePlaylistId() {
        return sourcePlaylistId;
    }

    public String getName() {
        return name;
    }

    public String getTargetPlaylistId() {
        return targetPlaylistId;
    }

    public int getTotalTracks() {
        return totalTracks;
    }

    public int getProcessedTrackCount() {
        return processedTrackCount;
    }

    public int getTracksFound() {
        return tracksFound;
    }

    public int getTracksNotFound() {
        return tracksNotFound;
    }

    public PlaylistStatus getStatus() {
        return status;
    }

    public String getFailureReason() {
        return failureReason;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == PlaylistStatus.COMPLETED;
    }

    /**
     * Records the target playlist as soon as it is known, before any track is written.
     */
    public void assignTarget(String targetPlaylistId) {
        if (targetPlaylistId == null || targetPlaylistId.isBlank()) {
            throw new IllegalArgumentException("targetPlaylistId must not be blank");
        }
        if (this.targetPlaylistId != null && !this.targetPlaylistId.equals(targetPlaylistId)) {
            throw new IllegalStateException("Playlist " + sourcePlaylistId + " already targets " + this.targetPlaylistId);
        }
        this.targetPlaylistId = targetPlaylistId;
    }

    /**
     * The source listing may have changed since the checkpoint was written. The total never
     * drops below what has already been processed.
     */
    public void updateTotalTracks(int totalTracks) {
        this.totalTracks = Math.max(totalTracks, processedTrackCount);
    }

    /**
     * Advances the processed offset after a committed batch.
     */
    public void advance(int processedTrackCount, int found, int notFound) {
        if (processedTrackCount < this.processedTrackCount) {
            throw new IllegalStateException("Processed count of " + sourcePlaylistId + " cannot go back from "
                    + this.processedTrackCount + " to " + processedTrackCount);
        }
        if (processedTrackCount > totalTracks) {
            throw new IllegalStateException("Processed count " + processedTrackCount + " exceeds total "
                    + totalTracks + " for " + sourcePlaylistId);
        }
        this.processedTrackCount = processedTrackCount;
        this.tracksFound += Math.max(0, found);
        this.tracksNotFound += Math.max(0, notFound);
    }

    void markInProgress() {
        this.status = PlaylistStatus.IN_PROGRESS;
        this.failureReason = null;
    }

    public void markCompleted() {
        if (totalTracks > 0 && targetPlaylistId == null) {
            throw new IllegalStateException("Playlist " + sourcePlaylistId + " has tracks but no target playlist");
        }
        this.processedTrackCount = totalTracks;
        this.status = PlaylistStatus.COMPLETED;
        this.failureReason = null;
    }

    public void markFailed(String reason) {
        this.status = PlaylistStatus.FAILED;
        this.failureReason = reason;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }

    @Override
    public String toString() {
        return "PlaylistProgress{" +
                "sourcePlaylistId='" + sourcePlaylistId + '\'' +
                ", name='" + name + '\'' +
                ", targetPlaylistId='" + targetPlaylistId + '\'' +
                ", processed=" + processedTrackCount + "/" + totalTracks +
                ", status=" + status +
                '}';
    }
}
