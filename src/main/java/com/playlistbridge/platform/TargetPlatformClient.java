package com.playlistbridge.platform;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Write side of the migration: the platform playlists are copied to.
 */
public interface TargetPlatformClient {

    List<TargetPlaylist> listPlaylists() throws PlatformException, InterruptedException;

    String createPlaylist(String name, String description) throws PlatformException, InterruptedException;

    /**
     * Best candidate for the query, or empty when the platform has no match.
     * A miss is not an error.
     */
    Optional<String> searchTrack(String query) throws PlatformException, InterruptedException;

    AddTracksResult addTracks(String playlistId, List<String> trackIds) throws PlatformException, InterruptedException;

    Set<String> listPlaylistTrackIds(String playlistId) throws PlatformException, InterruptedException;
}
