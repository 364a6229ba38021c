package com.playlistbridge.auth;

import com.playlistbridge.platform.PlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * An {@link AuthSession} handed to a platform client together with the callback that refreshes
 * it. Refreshed tokens are written back to the token file when one is attached.
 */
public class ManagedSession {

    private static final Logger log = LoggerFactory.getLogger(ManagedSession.class);

    // Refresh a little before the platform says the token expires.
    private static final long EXPIRY_BUFFER_MILLIS = 30_000L;

    private final String platform;
    private final AuthSession session;
    private final TokenRefresher refresher;
    private final SessionFileStore store;
    private final Path file;
    private final Clock clock;

    public ManagedSession(String platform, AuthSession session, TokenRefresher refresher,
                          SessionFileStore store, Path file, Clock clock) {
        this.platform = platform;
        this.session = session;
        this.refresher = refresher;
        this.store = store;
        this.file = file;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Session without refresh support, mostly for tests and short-lived tokens.
     */
    public static ManagedSession fixed(String platform, AuthSession session) {
        return new ManagedSession(platform, session, null, null, null, null);
    }

    public AuthSession getSession() {
        return session;
    }

    public String getUserId() {
        return session.getUserId();
    }

    public String getCountryCode() {
        String country = session.getCountryCode();
        return (country == null || country.isBlank()) ? "US" : country;
    }

    /**
     * A valid access token, refreshing first when the current one has expired.
     */
    public synchronized String accessToken() throws PlatformException, InterruptedException {
        if (session.isTokenExpired(clock.millis()) && refresher != null && session.canRefresh()) {
            refresh();
        }
        if (!session.hasAccessToken()) {
            throw new PlatformException("No " + platform + " access token available; refresh the token file");
        }
        return session.getAccessToken();
    }

    /**
     * Refreshes unconditionally, used after the platform rejected the current token.
     *
     * @return whether a refresh took place
     */
    public synchronized boolean forceRefresh() throws PlatformException, InterruptedException {
        if (refresher == null || !session.canRefresh()) {
            return false;
        }
        refresh();
        return true;
    }

    private void refresh() throws PlatformException, InterruptedException {
        TokenRefresher.RefreshedToken token = refresher.refresh(session);
        if (token == null || token.accessToken() == null || token.accessToken().isBlank()) {
            throw new PlatformException(platform + " token refresh returned no access token");
        }
        long lifetime = Math.max(0L, token.expiresInSeconds() * 1000L - EXPIRY_BUFFER_MILLIS);
        session.update(token.accessToken(), token.refreshToken(), clock.millis() + lifetime);
        log.info("Refreshed {} access token", platform);
        if (store != null && file != null) {
            try {
                store.save(file, session);
            } catch (IOException e) {
                log.warn("Could not write refreshed {} tokens to {}: {}", platform, file, e.getMessage());
            }
        }
    }
}
