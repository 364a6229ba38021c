package com.playlistbridge.library;

/**
 * Aggregate match counts over the whole library or one playlist.
 *
 * @param total       records in scope
 * @param matched     records with a target id
 * @param unavailable records searched on the target and confirmed absent
 * @param pending     records never searched (or searched without an id being stored)
 */
public record SyncStats(int total, int matched, int unavailable, int pending) {

    public static final SyncStats EMPTY = new SyncStats(0, 0, 0, 0);

    /**
     * Percentage of searched tracks that were found, 0 when nothing was searched yet.
     */
    public double matchRate() {
        int searched = matched + unavailable;
        return searched == 0 ? 0.0 : matched * 100.0 / searched;
    }
}
