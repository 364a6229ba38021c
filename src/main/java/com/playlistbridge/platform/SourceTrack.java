package com.playlistbridge.platform;

import java.util.List;

/**
 * A track as listed by the source platform. {@code artists} keeps the platform's order,
 * the first entry being the primary artist.
 */
public record SourceTrack(String id, String name, List<String> artists, String album) {

    public SourceTrack {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Source track id must not be blank");
        }
        name = (name != null && !name.isBlank()) ? name : "Unknown";
        artists = (artists != null) ? List.copyOf(artists) : List.of();
        album = (album != null) ? album : "";
    }

    public String primaryArtist() {
        return artists.isEmpty() ? "Unknown" : artists.get(0);
    }

    /**
     * Query string used against the target platform's search.
     */
    public String searchQuery() {
        return primaryArtist() + " " + name;
    }
}
