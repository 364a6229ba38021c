package com.playlistbridge.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.playlistbridge.platform.SourcePlaylist;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private Path file;
    private CheckpointStore store;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("transfer_checkpoint.json");
        store = new CheckpointStore(file, mapper, clock, true);
    }

    private static List<SourcePlaylist> playlists() {
        return List.of(
                new SourcePlaylist("p1", "Road Trip", "me", 3),
                new SourcePlaylist("p2", "Focus", "me", 0));
    }

    @Test
    void missingFileLoadsAsAbsent() {
        assertEquals(Optional.empty(), store.load());
        assertFalse(store.exists());
    }

    @Test
    void initStartsEveryPlaylistPending() {
        CheckpointState state = store.init("me", playlists());

        assertEquals(CheckpointState.CURRENT_VERSION, state.getVersion());
        assertEquals("me", state.getSourceUserId());
        assertEquals(2, state.getTotalPlaylists());
        assertEquals(2, state.count(PlaylistStatus.PENDING));
        assertEquals("2024-05-01T10:00:00Z", state.getCreatedAt());
    }

    @Test
    @DisplayName("Saved checkpoint loads back with progress and statuses as lowercase strings")
    void saveAndLoad() throws Exception {
        CheckpointState state = store.init("me", playlists());
        PlaylistProgress p1 = state.markInProgress("p1");
        p1.assignTarget("tp-1");
        p1.advance(2, 1, 1);
        store.save(state);

        JsonNode json = mapper.readTree(file.toFile());
        assertEquals("1.0", json.get("version").asText());
        assertEquals(2, json.get("totalPlaylists").asInt());
        assertEquals("in_progress", json.get("playlists").get(0).get("status").asText());
        assertEquals("pending", json.get("playlists").get(1).get("status").asText());

        CheckpointState loaded = store.load().orElseThrow();
        PlaylistProgress reloaded = loaded.find("p1").orElseThrow();
        assertEquals(PlaylistStatus.IN_PROGRESS, reloaded.getStatus());
        assertEquals("tp-1", reloaded.getTargetPlaylistId());
        assertEquals(2, reloaded.getProcessedTrackCount());
        assertEquals(1, reloaded.getTracksFound());
        assertEquals(1, reloaded.getTracksNotFound());
        assertEquals(3, reloaded.getTotalTracks());
        assertEquals(Optional.of(reloaded), loaded.getInProgress());
    }

    @Test
    @DisplayName("A truncated checkpoint is ignored rather than failing the run")
    void truncatedCheckpointIsAbsent() throws Exception {
        store.save(store.init("me", playlists()));
        String json = Files.readString(file, StandardCharsets.UTF_8);
        Files.writeString(file, json.substring(0, json.length() / 2), StandardCharsets.UTF_8);

        assertEquals(Optional.empty(), store.load());
    }

    @Test
    void unknownVersionIsAbsent() throws Exception {
        Files.writeString(file, """
                {"version":"9.9","createdAt":"x","updatedAt":"x","sourceUserId":"me",
                 "playlists":[{"sourcePlaylistId":"p1","name":"A","totalTracks":1,"status":"pending"}]}
                """, StandardCharsets.UTF_8);

        assertEquals(Optional.empty(), store.load());
    }

    @Test
    void completedCheckpointIsAbsent() {
        CheckpointState state = store.init("me", playlists());
        for (PlaylistProgress progress : state.getPlaylists()) {
            progress.assignTarget("tp-" + progress.getSourcePlaylistId());
            progress.markCompleted();
        }
        store.save(state);

        assertTrue(state.isComplete());
        assertEquals(Optional.empty(), store.load());
    }

    @Test
    void clearArchivesThenDeletes() {
        store.save(store.init("me", playlists()));

        store.clear();

        assertFalse(Files.exists(file));
        assertTrue(Files.exists(tempDir.resolve("transfer_checkpoint_completed_20240501_100000.json")));
    }

    @Test
    void clearWithoutArchiving() throws Exception {
        CheckpointStore plain = new CheckpointStore(file, mapper, clock, false);
        plain.save(plain.init("me", playlists()));

        plain.clear();

        try (var files = Files.list(tempDir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void resetDeletesWithoutArchive() throws Exception {
        store.save(store.init("me", playlists()));

        assertTrue(store.reset());
        assertFalse(store.reset());
        try (var files = Files.list(tempDir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void onlyOnePlaylistInProgress() {
        CheckpointState state = store.init("me", playlists());
        state.markInProgress("p1");

        assertThrows(IllegalStateException.class, () -> state.markInProgress("p2"));
        assertSame(state.find("p1").orElseThrow(), state.markInProgress("p1"));
        assertThrows(IllegalArgumentException.class, () -> state.markInProgress("unknown"));
    }

    @Test
    void processedCountNeverGoesBackOrPastTotal() {
        PlaylistProgress progress = new PlaylistProgress("p1", "A", 4);
        progress.advance(2, 2, 0);

        assertThrows(IllegalStateException.class, () -> progress.advance(1, 0, 0));
        assertThrows(IllegalStateException.class, () -> progress.advance(5, 0, 0));

        progress.updateTotalTracks(1);
        assertEquals(2, progress.getTotalTracks());
    }

    @Test
    void nonEmptyPlaylistNeedsTargetToComplete() {
        PlaylistProgress progress = new PlaylistProgress("p1", "A", 4);
        assertThrows(IllegalStateException.class, progress::markCompleted);

        PlaylistProgress empty = new PlaylistProgress("p2", "B", 0);
        empty.markCompleted();
        assertTrue(empty.isCompleted());
        assertNull(empty.getTargetPlaylistId());
    }

    @Test
    void targetCannotBeReassigned() {
        PlaylistProgress progress = new PlaylistProgress("p1", "A", 4);
        progress.assignTarget("tp-1");
        progress.assignTarget("tp-1");

        assertThrows(IllegalStateException.class, () -> progress.assignTarget("tp-2"));
    }

    @Test
    @DisplayName("Reconcile appends new playlists and puts the interrupted one first")
    void reconcileAndOrdering() {
        CheckpointState state = store.init("me", playlists());
        state.markInProgress("p2");

        int added = state.reconcile(List.of(
                new SourcePlaylist("p1", "Road Trip", "me", 5),
                new SourcePlaylist("p2", "Focus", "me", 0),
                new SourcePlaylist("p3", "New", "me", 2)));

        assertEquals(1, added);
        assertEquals(3, state.getTotalPlaylists());
        assertEquals(5, state.find("p1").orElseThrow().getTotalTracks());
        assertEquals(List.of("p2", "p1", "p3"),
                state.getRemaining().stream().map(PlaylistProgress::getSourcePlaylistId).toList());
    }

    @Test
    void failedPlaylistStaysRemainingWithReason() {
        CheckpointState state = store.init("me", playlists());
        state.markInProgress("p1").markFailed("boom");
        store.save(state);

        CheckpointState loaded = store.load().orElseThrow();
        PlaylistProgress p1 = loaded.find("p1").orElseThrow();
        assertEquals(PlaylistStatus.FAILED, p1.getStatus());
        assertEquals("boom", p1.getFailureReason());
        assertTrue(loaded.getInProgress().isEmpty());
        assertEquals(2, loaded.getRemaining().size());
    }
}
