package com.playlistbridge.transfer;

import com.playlistbridge.TransferSettings;
import com.playlistbridge.library.TrackLibrary;
import com.playlistbridge.library.TrackRecord;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Incremental sync: brings target playlists up to date with tracks added on the source since
 * the last run, without touching the checkpoint. Playlists the library already knows to be
 * fully matched cost no remote search or write.
 * <p>
 * A track that joined the playlist since the last run is written even when the library already
 * has its match from another playlist. Its membership is recorded once the batch carrying it
 * has landed.
 */
public class SyncDiffer {

    private static final Logger log = LoggerFactory.getLogger(SyncDiffer.class);

    private final SourcePlatformClient source;
    private final TargetPlatformClient target;
    private final TrackLibrary library;
    private final PlaylistResolver resolver;
    private final TrackPipeline pipeline;
    private final RequestPacer pacer;
    private final RetryPolicy retry;
    private final boolean recheck;
    private final Clock clock;

    public SyncDiffer(SourcePlatformClient source, TargetPlatformClient target, TrackLibrary library,
                      TransferSettings settings, Sleeper sleeper, Clock clock) {
        this.source = source;
        this.target = target;
        this.library = library;
        this.recheck = settings.recheck();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.pacer = RequestPacer.fromSettings(settings, sleeper);
        this.retry = new RetryPolicy(settings.maxBatchAttempts(), settings.retryBackoffMs(), pacer);
        this.resolver = new PlaylistResolver(target, retry);
        this.pipeline = new TrackPipeline(target, library, pacer, retry, settings.batchSize());
    }

    public TransferReport syncAll() throws PlatformException, InterruptedException {
        Instant started = clock.instant();
        List<SourcePlaylist> playlists = source.listOwnedPlaylists();
        log.info("Syncing {} owned playlists", playlists.size());
        List<PlaylistOutcome> outcomes = new ArrayList<>();
        boolean first = true;
        for (SourcePlaylist playlist : playlists) {
            if (!first) {
                pacer.betweenPlaylists();
            }
            first = false;
            outcomes.add(syncPlaylist(playlist));
        }
        TransferReport report = new TransferReport(outcomes, Duration.between(started, clock.instant()));
        report.logTo(log);
        return report;
    }

    public PlaylistOutcome syncPlaylist(SourcePlaylist playlist) throws InterruptedException {
        String id = playlist.id();
        String targetId = null;
        try {
            List<SourceTrack> tracks = retry.call("List tracks of " + playlist.name(), () -> source.listPlaylistTracks(id));
            if (tracks.isEmpty()) {
                return PlaylistOutcome.of(PlaylistOutcome.Kind.EMPTY, id, playlist.name(), null);
            }
            Set<String> joining = new LinkedHashSet<>();
            for (SourceTrack track : tracks) {
                Optional<TrackRecord> known = library.get(track.id());
                boolean member = known.isPresent() && known.get().belongsTo(id);
                boolean absent = known.isPresent() && known.get().isConfirmedAbsent() && !recheck;
                if (member || absent) {
                    library.recordTrack(track, id);
                } else {
                    joining.add(track.id());
                }
            }
            library.persist();

            if (joining.isEmpty() && library.isPlaylistSynced(id)) {
                log.info("'{}' is fully synced, skipping", playlist.name());
                return PlaylistOutcome.of(PlaylistOutcome.Kind.ALREADY_SYNCED, id, playlist.name(), null);
            }
            List<SourceTrack> missing = missingTracks(tracks, joining, library.getUnsyncedTracks(id, recheck));
            if (missing.isEmpty()) {
                log.info("'{}' has only tracks unavailable on the target, nothing to sync", playlist.name());
                return PlaylistOutcome.of(PlaylistOutcome.Kind.NOTHING_TO_SYNC, id, playlist.name(), null);
            }
            log.info("'{}': {} tracks to sync", playlist.name(), missing.size());

            PlaylistResolver.Resolution resolution = resolver.resolveOrCreate(
                    playlist.name(), PlaylistResolver.describe(tracks.size(), clock.instant()));
            targetId = resolution.targetPlaylistId();
            String targetPlaylistId = targetId;
            Set<String> present = resolution.created()
                    ? new HashSet<>()
                    : new HashSet<>(retry.call("List target tracks", () -> target.listPlaylistTrackIds(targetPlaylistId)));
            TrackPipeline.Result result = pipeline.transfer(id, targetPlaylistId, missing, present, recheck, null);
            log.info("Synced '{}': {} found, {} not found, {} added",
                    playlist.name(), result.found(), result.notFound(), result.added());
            return PlaylistOutcome.completed(id, playlist.name(), targetPlaylistId, result);
        } catch (PlatformException | BatchFailureException e) {
            log.error("Sync of '{}' failed: {}", playlist.name(), e.getMessage());
            return PlaylistOutcome.failed(id, playlist.name(), targetId, e.getMessage());
        }
    }

    /**
     * Source tracks that joined the playlist or whose records are unsynced, in source order and
     * without repeats.
     */
    static List<SourceTrack> missingTracks(List<SourceTrack> tracks, Set<String> joining, List<TrackRecord> unsynced) {
        Set<String> wanted = new HashSet<>(joining);
        for (TrackRecord record : unsynced) {
            wanted.add(record.getSourceId());
        }
        List<SourceTrack> missing = new ArrayList<>();
        for (SourceTrack track : tracks) {
            if (wanted.remove(track.id())) {
                missing.add(track);
            }
        }
        return missing;
    }
}
