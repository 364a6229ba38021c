package com.playlistbridge.platform;

import java.util.List;

/**
 * Outcome of one add-tracks call. A non-empty {@code rejectedIds} is a partial failure.
 */
public record AddTracksResult(int requested, List<String> rejectedIds) {

    public AddTracksResult {
        rejectedIds = (rejectedIds != null) ? List.copyOf(rejectedIds) : List.of();
    }

    public static AddTracksResult success(int requested) {
        return new AddTracksResult(requested, List.of());
    }

    public boolean isComplete() {
        return rejectedIds.isEmpty();
    }
}
