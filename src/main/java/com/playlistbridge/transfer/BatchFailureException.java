package com.playlistbridge.transfer;

/**
 * An add-tracks write exhausted its retries. The playlist is marked failed and the run moves on.
 */
public class BatchFailureException extends Exception {

    private final int attempts;

    public BatchFailureException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
