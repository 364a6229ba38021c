package com.playlistbridge.library;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * One row of the track library: a source track and everything known about it on other
 * platforms. Instances are owned and mutated by {@link TrackLibrary} only.
 */
public final class TrackRecord {

    private final String sourceId;
    private String targetId;
    private final Map<String, String> platformIds = new LinkedHashMap<>();
    private String trackName;
    private String artistName;
    private String albumName;
    private final Set<String> playlistIds = new TreeSet<>();
    private boolean sourceAvailable = true;
    private Boolean targetAvailable;
    private final Map<String, Boolean> platformAvailability = new LinkedHashMap<>();
    private Instant lastSyncedAt;
    private String notes = "";

    TrackRecord(String sourceId, String trackName, String artistName, String albumName) {
        this.sourceId = sourceId;
        this.trackName = trackName;
        this.artistName = artistName;
        this.albumName = albumName != null ? albumName : "";
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getPlatformId(String platform) {
        return platformIds.get(platform);
    }

    public String getTrackName() {
        return trackName;
    }

    public String getArtistName() {
        return artistName;
    }

    public String getAlbumName() {
        return albumName;
    }

    public Set<String> getPlaylistIds() {
        return Collections.unmodifiableSet(playlistIds);
    }

    public boolean isSourceAvailable() {
        return sourceAvailable;
    }

    /**
     * {@code null} until the track has been searched on the target platform.
     */
    public Boolean getTargetAvailable() {
        return targetAvailable;
    }

    public Boolean getPlatformAvailable(String platform) {
        return platformAvailability.get(platform);
    }

    public Instant getLastSyncedAt() {
        return lastSyncedAt;
    }

    public String getNotes() {
        return notes;
    }

    public boolean belongsTo(String playlistId) {
        return playlistIds.contains(playlistId);
    }

    public boolean isMatched() {
        return targetId != null;
    }

    /**
     * Searched on the target platform and not found. Such tracks are only searched again
     * when the caller asks for a recheck.
     */
    public boolean isConfirmedAbsent() {
        return targetId == null && Boolean.FALSE.equals(targetAvailable) && lastSyncedAt != null;
    }

    public boolean isPending() {
        return !isMatched() && !isConfirmedAbsent();
    }

    void addPlaylist(String playlistId) {
        if (playlistId != null && !playlistId.isBlank()) {
            playlistIds.add(playlistId);
        }
    }

    void removePlaylist(String playlistId) {
        playlistIds.remove(playlistId);
    }

    void updateMetadata(String trackName, String artistName, String albumName) {
        if (trackName != null && !trackName.isBlank()) {
            this.trackName = trackName;
        }
        if (artistName != null && !artistName.isBlank()) {
            this.artistName = artistName;
        }
        if (albumName != null && !albumName.isBlank()) {
            this.albumName = albumName;
        }
    }

    void setTargetMatch(String targetId, boolean found, Instant at) {
        this.targetId = found ? targetId : null;
        this.targetAvailable = found;
        this.lastSyncedAt = at;
    }

    void clearTargetMatch() {
        this.targetId = null;
        this.targetAvailable = null;
    }

    void setPlatformMatch(String platform, String id, boolean found, Instant at) {
        if (found) {
            platformIds.put(platform, id);
        } else {
            platformIds.remove(platform);
        }
        platformAvailability.put(platform, found);
        this.lastSyncedAt = at;
    }

    // Restoration from the CSV file bypasses the matching rules.
    void restore(String targetId, Boolean targetAvailable, boolean sourceAvailable, Instant lastSyncedAt, String notes) {
        this.targetId = (targetId != null && !targetId.isBlank()) ? targetId : null;
        this.targetAvailable = this.targetId != null ? Boolean.TRUE : targetAvailable;
        this.sourceAvailable = sourceAvailable;
        this.lastSyncedAt = lastSyncedAt;
        this.notes = notes != null ? notes : "";
    }

    void restorePlatform(String platform, String id, Boolean available) {
        if (id != null && !id.isBlank()) {
            platformIds.put(platform, id);
        }
        if (available != null) {
            platformAvailability.put(platform, available);
        }
    }

    void setNotes(String notes) {
        this.notes = notes != null ? notes : "";
    }

    @Override
    public String toString() {
        return "TrackRecord{" +
                "sourceId='" + sourceId + '\'' +
                ", targetId='" + targetId + '\'' +
                ", trackName='" + trackName + '\'' +
                ", artistName='" + artistName + '\'' +
                ", playlistIds=" + playlistIds +
                ", targetAvailable=" + targetAvailable +
                ", lastSyncedAt=" + lastSyncedAt +
                '}';
    }
}
