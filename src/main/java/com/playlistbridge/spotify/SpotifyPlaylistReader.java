package com.playlistbridge.spotify;

import org.apache.hc.core5.http.ParseException;
import se.michaelthelin.spotify.SpotifyApi;
import se.michaelthelin.spotify.exceptions.SpotifyWebApiException;
import se.michaelthelin.spotify.model_objects.specification.Paging;
import se.michaelthelin.spotify.model_objects.specification.PlaylistTrack;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Handles reading and paging through Spotify playlist items.
 */
public class SpotifyPlaylistReader {

    private static final int PAGE_SIZE = 100;

    private final SpotifyApi spotifyApi;

    public SpotifyPlaylistReader(SpotifyApi spotifyApi) {
        this.spotifyApi = spotifyApi;
    }

    /**
     * Fetches a page of playlist tracks.
     *
     * @param limit maximum items per page (max 100)
     */
    public Paging<PlaylistTrack> getPlaylistItems(String playlistId, int offset, int limit)
            throws IOException, SpotifyWebApiException, ParseException {
        return spotifyApi
                .getPlaylistsItems(playlistId)
                .limit(Math.min(limit, PAGE_SIZE))
                .offset(offset)
                .build()
                .execute();
    }

    /**
     * Fetches every item of the playlist, following pages until the API reports no next page.
     */
    public List<PlaylistTrack> getAllPlaylistItems(String playlistId)
            throws IOException, SpotifyWebApiException, ParseException {
        List<PlaylistTrack> allItems = new ArrayList<>();
        int offset = 0;
        while (true) {
            Paging<PlaylistTrack> page = getPlaylistItems(playlistId, offset, PAGE_SIZE);
            PlaylistTrack[] items = page.getItems();
            if (items == null || items.length == 0) {
                break;
            }
            Collections.addAll(allItems, items);
            offset += items.length;
            if (page.getNext() == null) {
                break;
            }
        }
        return allItems;
    }
}
