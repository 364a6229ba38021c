package com.playlistbridge.io;

/**
 * Writing or reading durable state (library, checkpoint) failed. Always fatal for the run:
 * continuing would risk losing match history or progress.
 */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
