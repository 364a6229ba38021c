package com.playlistbridge.platform;

/**
 * A failure that may go away on its own, like a rate limit. Callers retry these with backoff.
 */
public class TransientPlatformException extends PlatformException {

    private final long retryAfterMillis;

    public TransientPlatformException(String message) {
        this(message, null, 0L);
    }

    public TransientPlatformException(String message, Throwable cause) {
        this(message, cause, 0L);
    }

    public TransientPlatformException(String message, Throwable cause, long retryAfterMillis) {
        super(message, cause);
        this.retryAfterMillis = Math.max(0L, retryAfterMillis);
    }

    /**
     * Server supplied wait hint (Retry-After), or 0 when none was sent.
     */
    public long getRetryAfterMillis() {
        return retryAfterMillis;
    }
}
