package com.playlistbridge.platform;

import java.util.List;

/**
 * Read side of the migration: the platform playlists are copied from.
 */
public interface SourcePlatformClient {

    String currentUserId() throws PlatformException, InterruptedException;

    /**
     * Playlists owned by the current user, in the platform's listing order.
     */
    List<SourcePlaylist> listOwnedPlaylists() throws PlatformException, InterruptedException;

    /**
     * All tracks of a playlist in playlist order. Items that are not tracks are left out.
     */
    List<SourceTrack> listPlaylistTracks(String playlistId) throws PlatformException, InterruptedException;
}
