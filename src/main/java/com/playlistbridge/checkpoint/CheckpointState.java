package com.playlistbridge.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.playlistbridge.platform.SourcePlaylist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Durable progress of one transfer run across all of the user's playlists.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CheckpointState {

    public static final String CURRENT_VERSION = "1.0";

    private final String version;
    private final String createdAt;
    private String updatedAt;
    private final String sourceUserId;
    private final List<PlaylistProgress> playlists;

    @JsonCreator
    public CheckpointState(
            @JsonProperty("version") String version,
            @JsonProperty("createdAt") String createdAt,
            @JsonProperty("updatedAt") String updatedAt,
            @JsonProperty("sourceUserId") String sourceUserId,
            @JsonProperty("playlists") List<PlaylistProgress> playlists) {
        this.version = version;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.sourceUserId = sourceUserId;
        this.playlists = playlists != null ? new ArrayList<>(playlists) : new ArrayList<>();
    }

    static CheckpointState fresh(String sourceUserId, List<SourcePlaylist> sources, String now) {
        List<PlaylistProgress> playlists = new ArrayList<>();
        for (SourcePlaylist source : sources) {
            playlists.add(new PlaylistProgress(source.id(), source.name(), source.totalTracks()));
        }
        return new CheckpointState(CURRENT_VERSION, now, now, sourceUserId, playlists);
    }

    public String getVersion() {
        return version;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }

    void setUpdatedAt(String updatedAt) {
        this.updatedAt = updatedAt;
    }

    public String getSourceUserId() {
        return sourceUserId;
    }

    public int getTotalPlaylists() {
        return playlists.size();
    }

    public List<PlaylistProgress> getPlaylists() {
        return Collections.unmodifiableList(playlists);
    }

    public Optional<PlaylistProgress> find(String sourcePlaylistId) {
        for (PlaylistProgress progress : playlists) {
            if (progress.getSourcePlaylistId().equals(sourcePlaylistId)) {
                return Optional.of(progress);
            }
        }
        return Optional.empty();
    }

    @JsonIgnore
    public Optional<PlaylistProgress> getInProgress() {
        for (PlaylistProgress progress : playlists) {
            if (progress.getStatus() == PlaylistStatus.IN_PROGRESS) {
                return Optional.of(progress);
            }
        }
        return Optional.empty();
    }

    /**
     * Moves a playlist to in_progress. Only one playlist may be in progress at a time; the
     * current one has to complete or fail first.
     */
    public PlaylistProgress markInProgress(String sourcePlaylistId) {
        PlaylistProgress target = find(sourcePlaylistId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown playlist in checkpoint: " + sourcePlaylistId));
        Optional<PlaylistProgress> current = getInProgress();
        if (current.isPresent() && current.get() != target) {
            throw new IllegalStateException("Playlist " + current.get().getSourcePlaylistId()
                    + " is already in progress");
        }
        target.markInProgress();
        return target;
    }

    /**
     * Appends source playlists created since the checkpoint was written and refreshes track
     * totals of the known ones.
     *
     * @return number of playlists appended
     */
    public int reconcile(List<SourcePlaylist> sources) {
        int added = 0;
        for (SourcePlaylist source : sources) {
            Optional<PlaylistProgress> existing = find(source.id());
            if (existing.isPresent()) {
                if (!existing.get().isCompleted()) {
                    existing.get().updateTotalTracks(source.totalTracks());
                }
            } else {
                playlists.add(new PlaylistProgress(source.id(), source.name(), source.totalTracks()));
                added++;
            }
        }
        return added;
    }

    /**
     * Playlists still to work on, with the one interrupted mid-way first.
     */
    @JsonIgnore
    public List<PlaylistProgress> getRemaining() {
        List<PlaylistProgress> remaining = new ArrayList<>();
        getInProgress().ifPresent(remaining::add);
        for (PlaylistProgress progress : playlists) {
            if (!progress.isCompleted() && progress.getStatus() != PlaylistStatus.IN_PROGRESS) {
                remaining.add(progress);
            }
        }
        return remaining;
    }

    @JsonIgnore
    public boolean isComplete() {
        for (PlaylistProgress progress : playlists) {
            if (!progress.isCompleted()) {
                return false;
            }
        }
        return true;
    }

    public int count(PlaylistStatus status) {
        int n = 0;
        for (PlaylistProgress progress : playlists) {
            if (progress.getStatus() == status) {
                n++;
            }
        }
        return n;
    }
}
