package com.playlistbridge.transfer;

import com.playlistbridge.TransferSettings;
import com.playlistbridge.checkpoint.CheckpointState;
import com.playlistbridge.checkpoint.CheckpointStore;
import com.playlistbridge.checkpoint.PlaylistProgress;
import com.playlistbridge.checkpoint.PlaylistStatus;
import com.playlistbridge.library.TrackLibrary;
import com.playlistbridge.platform.PlatformException;
import com.playlistbridge.platform.SourcePlatformClient;
import com.playlistbridge.platform.SourcePlaylist;
import com.playlistbridge.platform.SourceTrack;
import com.playlistbridge.platform.TargetPlatformClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Full transfer of every owned source playlist, resumable through the checkpoint.
 * <p>
 * Per playlist: mark in progress, list the source tracks, resolve the target playlist and
 * checkpoint its id right away, then match and write the remaining tracks batch by batch,
 * checkpointing each committed batch. A failed playlist is recorded and the run moves on.
 */
public class TransferOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TransferOrchestrator.class);

    private final SourcePlatformClient source;
    private final TargetPlatformClient target;
    private final TrackLibrary library;
    private final CheckpointStore checkpoints;
    private final PlaylistResolver resolver;
    private final TrackPipeline pipeline;
    private final RequestPacer pacer;
    private final RetryPolicy retry;
    private final TransferSettings settings;
    private final Clock clock;

    public TransferOrchestrator(SourcePlatformClient source, TargetPlatformClient target, TrackLibrary library,
                                CheckpointStore checkpoints, TransferSettings settings, Sleeper sleeper, Clock clock) {
        this.source = source;
        this.target = target;
        this.library = library;
        this.checkpoints = checkpoints;
        this.settings = settings;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.pacer = RequestPacer.fromSettings(settings, sleeper);
        this.retry = new RetryPolicy(settings.maxBatchAttempts(), settings.retryBackoffMs(), pacer);
        this.resolver = new PlaylistResolver(target, retry);
        this.pipeline = new TrackPipeline(target, library, pacer, retry, settings.batchSize());
    }

    public TransferReport run() throws PlatformException, InterruptedException {
        Instant started = clock.instant();
        String userId = source.currentUserId();
        List<SourcePlaylist> playlists = source.listOwnedPlaylists();
        log.info("Found {} owned playlists for user {}", playlists.size(), userId);

        CheckpointState state = loadOrInit(userId, playlists);
        checkpoints.save(state);

        Map<String, SourcePlaylist> byId = new LinkedHashMap<>();
        for (SourcePlaylist playlist : playlists) {
            byId.put(playlist.id(), playlist);
        }

        List<PlaylistOutcome> outcomes = new ArrayList<>();
        for (PlaylistProgress progress : state.getPlaylists()) {
            if (progress.isCompleted()) {
                outcomes.add(PlaylistOutcome.of(PlaylistOutcome.Kind.ALREADY_COMPLETED,
                        progress.getSourcePlaylistId(), progress.getName(), progress.getTargetPlaylistId()));
            }
        }

        boolean first = true;
        for (PlaylistProgress progress : state.getRemaining()) {
            if (!first) {
                pacer.betweenPlaylists();
            }
            first = false;
            SourcePlaylist playlist = byId.get(progress.getSourcePlaylistId());
            if (playlist == null) {
                String reason = "Playlist no longer owned on the source platform";
                log.warn("Skipping '{}': {}", progress.getName(), reason);
                progress.markFailed(reason);
                checkpoints.save(state);
                outcomes.add(PlaylistOutcome.failed(progress.getSourcePlaylistId(), progress.getName(),
                        progress.getTargetPlaylistId(), reason));
                continue;
            }
            outcomes.add(transferPlaylist(state, progress, playlist));
        }

        if (state.isComplete()) {
            log.info("All {} playlists completed, clearing checkpoint", state.getTotalPlaylists());
            checkpoints.clear();
        } else {
            log.info("Checkpoint kept at {} for the next run", checkpoints.getFile());
        }

        TransferReport report = new TransferReport(outcomes, Duration.between(started, clock.instant()));
        report.logTo(log);
        return report;
    }

    private CheckpointState loadOrInit(String userId, List<SourcePlaylist> playlists) {
        Optional<CheckpointState> loaded = settings.fresh() ? Optional.empty() : checkpoints.load();
        if (settings.fresh()) {
            log.info("Fresh run requested, ignoring any existing checkpoint");
        }
        if (loaded.isPresent() && loaded.get().getSourceUserId() != null
                && !loaded.get().getSourceUserId().equals(userId)) {
            log.warn("Checkpoint belongs to user {}, not {}; starting over",
                    loaded.get().getSourceUserId(), userId);
            loaded = Optional.empty();
        }
        if (loaded.isEmpty()) {
            return checkpoints.init(userId, playlists);
        }
        CheckpointState state = loaded.get();
        int added = state.reconcile(playlists);
        log.info("Resuming checkpoint from {}: {}/{} playlists completed{}",
                state.getCreatedAt(), state.count(PlaylistStatus.COMPLETED),
                state.getTotalPlaylists(), added > 0 ? ", " + added + " new" : "");
        return state;
    }

    PlaylistOutcome transferPlaylist(CheckpointState state, PlaylistProgress progress, SourcePlaylist playlist)
            throws InterruptedException {
        String id = playlist.id();
        state.markInProgress(id);
        checkpoints.save(state);
        log.info("Transferring '{}' ({} tracks, resuming at {})",
                playlist.name(), playlist.totalTracks(), progress.getProcessedTrackCount());
        try {
            List<SourceTrack> tracks = retry.call("List tracks of " + playlist.name(), () -> source.listPlaylistTracks(id));
            progress.updateTotalTracks(tracks.size());
            if (tracks.isEmpty()) {
                progress.markCompleted();
                checkpoints.save(state);
                log.info("'{}' is empty, nothing to transfer", playlist.name());
                return PlaylistOutcome.of(PlaylistOutcome.Kind.EMPTY, id, playlist.name(), null);
            }
            for (SourceTrack track : tracks) {
                library.recordTrack(track, id);
            }

            String targetId = progress.getTargetPlaylistId();
            boolean reused = true;
            if (targetId == null) {
                PlaylistResolver.Resolution resolution =
                        resolver.resolveOrCreate(playlist.name(), PlaylistResolver.describe(tracks.size(), clock.instant()));
                targetId = resolution.targetPlaylistId();
                reused = !resolution.created();
                progress.assignTarget(targetId);
                checkpoints.save(state);
            }
            String targetPlaylistId = targetId;
            Set<String> present = reused
                    ? new HashSet<>(retry.call("List target tracks", () -> target.listPlaylistTrackIds(targetPlaylistId)))
                    : new HashSet<>();

            int offset = Math.min(progress.getProcessedTrackCount(), tracks.size());
            int[] processed = {offset};
            TrackPipeline.Result result = pipeline.transfer(id, targetPlaylistId, tracks.subList(offset, tracks.size()),
                    present, settings.recheck(), (count, found, notFound) -> {
                        processed[0] += count;
                        progress.advance(processed[0], found, notFound);
                        checkpoints.save(state);
                    });

            progress.markCompleted();
            checkpoints.save(state);
            log.info("Completed '{}': {} found, {} not found, {} added",
                    playlist.name(), result.found(), result.notFound(), result.added());
            return PlaylistOutcome.completed(id, playlist.name(), targetPlaylistId, result);
        } catch (PlatformException | BatchFailureException e) {
            log.error("Playlist '{}' failed: {}", playlist.name(), e.getMessage());
            progress.markFailed(e.getMessage());
            checkpoints.save(state);
            return PlaylistOutcome.failed(id, playlist.name(), progress.getTargetPlaylistId(), e.getMessage());
        }
    }
}
