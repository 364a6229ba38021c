package com.playlistbridge.report;

import com.playlistbridge.checkpoint.CheckpointState;
import com.playlistbridge.checkpoint.PlaylistProgress;
import com.playlistbridge.checkpoint.PlaylistStatus;
import com.playlistbridge.library.SyncStats;
import com.playlistbridge.library.TrackLibrary;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Optional;

/**
 * Plain text views of the checkpoint and the library. Neither view changes any state.
 */
public class StatusReporter {

    private final PrintStream out;

    public StatusReporter(PrintStream out) {
        this.out = out;
    }

    public void printCheckpoint(Optional<CheckpointState> checkpoint) {
        if (checkpoint.isEmpty()) {
            out.println("No transfer in progress.");
            return;
        }
        CheckpointState state = checkpoint.get();
        out.println("Transfer started " + state.getCreatedAt() + ", last update " + state.getUpdatedAt());
        out.printf(Locale.ROOT, "Playlists: %d total, %d completed, %d in progress, %d pending, %d failed%n",
                state.getTotalPlaylists(),
                state.count(PlaylistStatus.COMPLETED),
                state.count(PlaylistStatus.IN_PROGRESS),
                state.count(PlaylistStatus.PENDING),
                state.count(PlaylistStatus.FAILED));

        state.getInProgress().ifPresent(p -> out.printf(Locale.ROOT, "In progress: %s (%d/%d tracks)%n",
                p.getName(), p.getProcessedTrackCount(), p.getTotalTracks()));

        if (state.count(PlaylistStatus.FAILED) > 0) {
            out.println("Failed:");
            for (PlaylistProgress p : state.getPlaylists()) {
                if (p.getStatus() == PlaylistStatus.FAILED) {
                    out.printf(Locale.ROOT, "  %s: %s%n", p.getName(),
                            p.getFailureReason() != null ? p.getFailureReason() : "unknown reason");
                }
            }
        }
        if (state.count(PlaylistStatus.PENDING) > 0) {
            out.println("Pending:");
            for (PlaylistProgress p : state.getPlaylists()) {
                if (p.getStatus() == PlaylistStatus.PENDING) {
                    out.printf(Locale.ROOT, "  %s (%d tracks)%n", p.getName(), p.getTotalTracks());
                }
            }
        }
    }

    public void printLibrary(TrackLibrary library) {
        SyncStats stats = library.getSyncStats();
        out.println("Track library: " + library.getFile());
        out.println("Total tracks: " + stats.total());
        out.println("TIDAL:");
        out.println("  Matched: " + stats.matched());
        out.println("  Unavailable: " + stats.unavailable());
        out.println("  Not searched: " + stats.pending());
        out.printf(Locale.ROOT, "  Match rate: %.1f%%%n", stats.matchRate());
    }
}
