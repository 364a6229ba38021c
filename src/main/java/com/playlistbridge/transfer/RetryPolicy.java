package com.playlistbridge.transfer;

import com.playlistbridge.platform.PlatformException;
import com.playlistbridge.platform.TransientPlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry of transient remote failures with exponential backoff. A server supplied
 * Retry-After wins when it is longer than the computed delay.
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface RemoteCall<T> {
        T call() throws PlatformException, InterruptedException;
    }

    private final int maxAttempts;
    private final long baseBackoffMs;
    private final RequestPacer pacer;

    public RetryPolicy(int maxAttempts, long baseBackoffMs, RequestPacer pacer) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffMs = Math.max(0L, baseBackoffMs);
        this.pacer = pacer;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public <T> T call(String operation, RemoteCall<T> call) throws PlatformException, InterruptedException {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.call();
            } catch (TransientPlatformException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                long delay = delayFor(attempt, e.getRetryAfterMillis());
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, maxAttempts, delay, e.getMessage());
                pacer.backoff(delay);
            }
        }
    }

    /**
     * Delay before the attempt following {@code attempt}: base, 2x base, 4x base...
     */
    public long delayFor(int attempt, long retryAfterMillis) {
        int shift = Math.min(Math.max(0, attempt - 1), 20);
        long exponential = baseBackoffMs << shift;
        return Math.max(exponential, retryAfterMillis);
    }

    void backoff(int attempt, long retryAfterMillis) throws InterruptedException {
        pacer.backoff(delayFor(attempt, retryAfterMillis));
    }
}
