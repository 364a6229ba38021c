package com.playlistbridge.spotify;

import com.playlistbridge.platform.SourceTrack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.michaelthelin.spotify.model_objects.IPlaylistItem;
import se.michaelthelin.spotify.model_objects.specification.ArtistSimplified;
import se.michaelthelin.spotify.model_objects.specification.Episode;
import se.michaelthelin.spotify.model_objects.specification.PlaylistTrack;
import se.michaelthelin.spotify.model_objects.specification.Track;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts Spotify playlist items into {@link SourceTrack}s. Podcast episodes and local files
 * have no catalogue identity and are skipped.
 */
public class SpotifyTrackMapper {

    private static final Logger log = LoggerFactory.getLogger(SpotifyTrackMapper.class);

    public List<SourceTrack> toSourceTracks(List<PlaylistTrack> playlistTracks) {
        List<SourceTrack> tracks = new ArrayList<>();
        for (PlaylistTrack playlistTrack : playlistTracks) {
            if (playlistTrack == null) {
                continue;
            }
            if (Boolean.TRUE.equals(playlistTrack.getIsLocal())) {
                log.debug("Skipping local file in playlist");
                continue;
            }
            IPlaylistItem item = playlistTrack.getTrack();
            if (item instanceof Track track) {
                SourceTrack converted = convert(track);
                if (converted != null) {
                    tracks.add(converted);
                }
            } else if (item instanceof Episode episode) {
                log.debug("Skipping podcast episode: {}", episode.getName());
            } else if (item != null) {
                log.debug("Skipping unknown playlist item type: {}", item.getClass().getName());
            }
        }
        return tracks;
    }

    SourceTrack convert(Track track) {
        if (track.getId() == null || track.getId().isBlank()) {
            log.debug("Skipping track without id: {}", track.getName());
            return null;
        }
        List<String> artists = new ArrayList<>();
        ArtistSimplified[] artistArray = track.getArtists();
        if (artistArray != null) {
            for (ArtistSimplified artist : artistArray) {
                if (artist != null && artist.getName() != null && !artist.getName().isBlank()) {
                    artists.add(artist.getName());
                }
            }
        }
        String album = track.getAlbum() != null ? track.getAlbum().getName() : null;
        return new SourceTrack(track.getId(), track.getName(), artists, album);
    }
}
