package com.playlistbridge.transfer;

import com.playlistbridge.TransferSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed delays between remote operations so the target platform does not throttle or ban
 * the account. Every wait goes through the injected {@link Sleeper}.
 */
public final class RequestPacer {

    private static final Logger log = LoggerFactory.getLogger(RequestPacer.class);

    private final Sleeper sleeper;
    private final long searchDelayMs;
    private final long batchDelayMs;
    private final long playlistDelayMs;

    public RequestPacer(Sleeper sleeper, long searchDelayMs, long batchDelayMs, long playlistDelayMs) {
        this.sleeper = sleeper != null ? sleeper : Sleeper.system();
        this.searchDelayMs = Math.max(0L, searchDelayMs);
        this.batchDelayMs = Math.max(0L, batchDelayMs);
        this.playlistDelayMs = Math.max(0L, playlistDelayMs);
    }

    public static RequestPacer fromSettings(TransferSettings settings, Sleeper sleeper) {
        return new RequestPacer(sleeper, settings.searchDelayMs(), settings.batchDelayMs(), settings.playlistDelayMs());
    }

    public void afterSearch() throws InterruptedException {
        sleeper.sleep(searchDelayMs);
    }

    public void afterBatch() throws InterruptedException {
        sleeper.sleep(batchDelayMs);
    }

    public void betweenPlaylists() throws InterruptedException {
        sleeper.sleep(playlistDelayMs);
    }

    public void backoff(long millis) throws InterruptedException {
        if (millis > 0) {
            log.info("Backing off for {} ms", millis);
        }
        sleeper.sleep(Math.max(0L, millis));
    }
}
