package com.playlistbridge.platform;

/**
 * A playlist owned by the user on the source platform.
 */
public record SourcePlaylist(String id, String name, String ownerId, int totalTracks) {

    public SourcePlaylist {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Source playlist id must not be blank");
        }
        name = (name != null && !name.isBlank()) ? name : "Untitled playlist";
        totalTracks = Math.max(0, totalTracks);
    }
}
