package com.playlistbridge.auth;

import com.playlistbridge.platform.PlatformException;

/**
 * Exchanges a session's refresh token for a new access token.
 */
@FunctionalInterface
public interface TokenRefresher {

    /**
     * @param accessToken  new access token
     * @param refreshToken rotated refresh token, or {@code null} when the platform keeps the old one
     * @param expiresInSeconds lifetime of the new access token
     */
    record RefreshedToken(String accessToken, String refreshToken, long expiresInSeconds) {}

    RefreshedToken refresh(AuthSession session) throws PlatformException, InterruptedException;
}
