package com.playlistbridge.spotify;

import com.playlistbridge.platform.PlatformException;
import com.playlistbridge.platform.TransientPlatformException;
import se.michaelthelin.spotify.exceptions.detailed.BadGatewayException;
import se.michaelthelin.spotify.exceptions.detailed.InternalServerErrorException;
import se.michaelthelin.spotify.exceptions.detailed.ServiceUnavailableException;
import se.michaelthelin.spotify.exceptions.detailed.TooManyRequestsException;

import java.io.IOException;

/**
 * Maps spotify-web-api-java failures onto the platform error taxonomy.
 */
final class SpotifyErrors {

    private SpotifyErrors() {}

    static PlatformException translate(String operation, Exception e) {
        String message = "Spotify " + operation + " failed: " + e.getMessage();
        if (e instanceof TooManyRequestsException tooMany) {
            return new TransientPlatformException(message, e, tooMany.getRetryAfter() * 1000L);
        }
        if (e instanceof InternalServerErrorException
                || e instanceof BadGatewayException
                || e instanceof ServiceUnavailableException
                || e instanceof IOException) {
            return new TransientPlatformException(message, e);
        }
        // Remaining API errors (400, 403, 404) and unparsable responses do not improve on retry.
        return new PlatformException(message, e);
    }
}
