package com.playlistbridge.platform;

/**
 * A remote platform call failed in a way that retrying will not fix, such as a rejected request.
 */
public class PlatformException extends Exception {
    public PlatformException(String message) {
        super(message);
    }

    public PlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
