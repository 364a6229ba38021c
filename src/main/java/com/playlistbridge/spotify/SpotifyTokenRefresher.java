package com.playlistbridge.spotify;

import com.playlistbridge.auth.AuthSession;
import com.playlistbridge.auth.TokenRefresher;
import com.playlistbridge.platform.PlatformException;
import org.apache.hc.core5.http.ParseException;
import se.michaelthelin.spotify.SpotifyApi;
import se.michaelthelin.spotify.exceptions.SpotifyWebApiException;
import se.michaelthelin.spotify.model_objects.credentials.AuthorizationCodeCredentials;

import java.io.IOException;

/**
 * Refreshes a Spotify user token with the app's client credentials.
 */
public class SpotifyTokenRefresher implements TokenRefresher {

    private final String clientId;
    private final String clientSecret;

    public SpotifyTokenRefresher(String clientId, String clientSecret) {
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    @Override
    public RefreshedToken refresh(AuthSession session) throws PlatformException {
        if (clientId == null || clientId.isBlank()) {
            throw new PlatformException("SPOTIFY_CLIENT_ID is required to refresh the Spotify token");
        }
        SpotifyApi api = new SpotifyApi.Builder()
                .setClientId(clientId)
                .setClientSecret(clientSecret)
                .setRefreshToken(session.getRefreshToken())
                .build();
        try {
            AuthorizationCodeCredentials credentials = api.authorizationCodeRefresh().build().execute();
            Integer expiresIn = credentials.getExpiresIn();
            return new RefreshedToken(credentials.getAccessToken(), credentials.getRefreshToken(),
                    expiresIn != null ? expiresIn : 3600);
        } catch (IOException | SpotifyWebApiException | ParseException e) {
            throw SpotifyErrors.translate("token refresh", e);
        }
    }
}
