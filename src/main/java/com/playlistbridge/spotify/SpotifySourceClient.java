package com.playlistbridge.spotify;

import com.playlistbridge.auth.ManagedSession;
import com.playlistbridge.platform.PlatformException;
import com.playlistbridge.platform.SourcePlatformClient;
import com.playlistbridge.platform.SourcePlaylist;
import com.playlistbridge.platform.SourceTrack;
import org.apache.hc.core5.http.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.michaelthelin.spotify.SpotifyApi;
import se.michaelthelin.spotify.exceptions.SpotifyWebApiException;
import se.michaelthelin.spotify.exceptions.detailed.UnauthorizedException;
import se.michaelthelin.spotify.model_objects.specification.Paging;
import se.michaelthelin.spotify.model_objects.specification.PlaylistSimplified;
import se.michaelthelin.spotify.model_objects.specification.PlaylistTrack;
import se.michaelthelin.spotify.model_objects.specification.User;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the current user's own playlists and their tracks from the Spotify Web API.
 */
public class SpotifySourceClient implements SourcePlatformClient {

    private static final Logger log = LoggerFactory.getLogger(SpotifySourceClient.class);
    private static final int PLAYLIST_PAGE_SIZE = 50;

    @FunctionalInterface
    private interface SpotifyCall<T> {
        T execute() throws IOException, SpotifyWebApiException, ParseException;
    }

    private final SpotifyApi spotifyApi;
    private final ManagedSession session;
    private final SpotifyPlaylistReader reader;
    private final SpotifyTrackMapper mapper = new SpotifyTrackMapper();
    private String userId;

    public SpotifySourceClient(SpotifyApi spotifyApi, ManagedSession session) {
        this.spotifyApi = spotifyApi;
        this.session = session;
        this.reader = new SpotifyPlaylistReader(spotifyApi);
    }

    @Override
    public String currentUserId() throws PlatformException, InterruptedException {
        if (userId == null) {
            User user = call("profile lookup", () -> spotifyApi.getCurrentUsersProfile().build().execute());
            if (user == null || user.getId() == null) {
                throw new PlatformException("Spotify returned no profile for the current user");
            }
            userId = user.getId();
            log.info("Spotify user: {}", userId);
        }
        return userId;
    }

    @Override
    public List<SourcePlaylist> listOwnedPlaylists() throws PlatformException, InterruptedException {
        String owner = currentUserId();
        List<SourcePlaylist> owned = new ArrayList<>();
        int offset = 0;
        while (true) {
            int currentOffset = offset;
            Paging<PlaylistSimplified> page = call("playlist listing", () -> spotifyApi
                    .getListOfCurrentUsersPlaylists()
                    .limit(PLAYLIST_PAGE_SIZE)
                    .offset(currentOffset)
                    .build()
                    .execute());
            PlaylistSimplified[] items = page.getItems();
            if (items == null || items.length == 0) {
                break;
            }
            for (PlaylistSimplified playlist : items) {
                if (playlist == null || playlist.getOwner() == null || !owner.equals(playlist.getOwner().getId())) {
                    continue;
                }
                int total = playlist.getTracks() != null && playlist.getTracks().getTotal() != null
                        ? playlist.getTracks().getTotal() : 0;
                owned.add(new SourcePlaylist(playlist.getId(), playlist.getName(), owner, total));
            }
            offset += items.length;
            if (page.getNext() == null) {
                break;
            }
        }
        return owned;
    }

    @Override
    public List<SourceTrack> listPlaylistTracks(String playlistId) throws PlatformException, InterruptedException {
        List<PlaylistTrack> items = call("track listing of " + playlistId, () -> reader.getAllPlaylistItems(playlistId));
        return mapper.toSourceTracks(items);
    }

    private <T> T call(String operation, SpotifyCall<T> call) throws PlatformException, InterruptedException {
        spotifyApi.setAccessToken(session.accessToken());
        try {
            return call.execute();
        } catch (UnauthorizedException e) {
            if (!session.forceRefresh()) {
                throw SpotifyErrors.translate(operation, e);
            }
            spotifyApi.setAccessToken(session.accessToken());
            try {
                return call.execute();
            } catch (IOException | SpotifyWebApiException | ParseException retryError) {
                throw SpotifyErrors.translate(operation, retryError);
            }
        } catch (IOException | SpotifyWebApiException | ParseException e) {
            throw SpotifyErrors.translate(operation, e);
        }
    }
}
