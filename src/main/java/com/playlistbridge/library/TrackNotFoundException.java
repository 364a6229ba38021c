package com.playlistbridge.library;

/**
 * A match was reported for a track the library has never recorded. This is a programming
 * error in the caller (it must call {@code recordTrack} first), not a runtime condition.
 */
public class TrackNotFoundException extends RuntimeException {
    public TrackNotFoundException(String sourceId) {
        super("Track not recorded in library: " + sourceId);
    }
}
