package com.playlistbridge.report;

import com.playlistbridge.checkpoint.CheckpointState;
import com.playlistbridge.checkpoint.PlaylistProgress;
import com.playlistbridge.library.TrackLibrary;
import com.playlistbridge.platform.SourceTrack;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StatusReporterTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final StatusReporter reporter = new StatusReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noCheckpoint() {
        reporter.printCheckpoint(Optional.empty());

        assertEquals("No transfer in progress.", output().trim());
    }

    @Test
    void listsProgressFailuresAndPending() {
        PlaylistProgress done = new PlaylistProgress("p1", "Done", 2);
        done.assignTarget("tp-1");
        done.markCompleted();
        PlaylistProgress broken = new PlaylistProgress("p2", "Broken", 5);
        broken.markFailed("Adding 2 tracks failed after 3 attempts");
        PlaylistProgress waiting = new PlaylistProgress("p3", "Waiting", 7);
        PlaylistProgress running = new PlaylistProgress("p4", "Running", 10);
        CheckpointState state = new CheckpointState(CheckpointState.CURRENT_VERSION,
                "2024-05-01T10:00:00Z", "2024-05-01T10:05:00Z", "me",
                List.of(done, broken, waiting, running));
        state.markInProgress("p4").advance(4, 4, 0);

        reporter.printCheckpoint(Optional.of(state));

        String out = output();
        assertTrue(out.contains("Playlists: 4 total, 1 completed, 1 in progress, 1 pending, 1 failed"));
        assertTrue(out.contains("In progress: Running (4/10 tracks)"));
        assertTrue(out.contains("Broken: Adding 2 tracks failed after 3 attempts"));
        assertTrue(out.contains("Waiting (7 tracks)"));
        assertFalse(out.contains("Done ("));
    }

    @Test
    void libraryStatistics() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        TrackLibrary library = new TrackLibrary(tempDir.resolve("library.csv"), List.of(), clock);
        for (String id : List.of("a", "b", "c", "d")) {
            library.recordTrack(new SourceTrack(id, "Song " + id, List.of("Artist"), "Album"), "p1");
        }
        library.setTargetMatch("a", "t-a", true);
        library.setTargetMatch("b", "t-b", true);
        library.setTargetMatch("c", null, false);

        reporter.printLibrary(library);

        String out = output();
        assertTrue(out.contains("Total tracks: 4"));
        assertTrue(out.contains("Matched: 2"));
        assertTrue(out.contains("Unavailable: 1"));
        assertTrue(out.contains("Not searched: 1"));
        assertTrue(out.contains("Match rate: 66.7%"));
    }
}
