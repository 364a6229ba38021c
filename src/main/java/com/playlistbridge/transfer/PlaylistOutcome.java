package com.playlistbridge.transfer;

/**
 * What happened to one playlist during a run.
 */
public record PlaylistOutcome(
        String sourcePlaylistId,
        String name,
        Kind kind,
        String targetPlaylistId,
        int tracksFound,
        int tracksNotFound,
        int tracksAdded,
        String reason
) {

    public enum Kind {
        COMPLETED,
        FAILED,
        EMPTY,
        ALREADY_COMPLETED,
        ALREADY_SYNCED,
        NOTHING_TO_SYNC
    }

    public static PlaylistOutcome completed(String id, String name, String targetId, TrackPipeline.Result result) {
        return new PlaylistOutcome(id, name, Kind.COMPLETED, targetId,
                result.found(), result.notFound(), result.added(), null);
    }

    public static PlaylistOutcome failed(String id, String name, String targetId, String reason) {
        return new PlaylistOutcome(id, name, Kind.FAILED, targetId, 0, 0, 0, reason);
    }

    public static PlaylistOutcome of(Kind kind, String id, String name, String targetId) {
        return new PlaylistOutcome(id, name, kind, targetId, 0, 0, 0, null);
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }
}
