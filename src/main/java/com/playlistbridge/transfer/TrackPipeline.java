package com.playlistbridge.transfer;

import com.playlistbridge.library.TrackLibrary;
import com.playlistbridge.library.TrackRecord;
import com.playlistbridge.platform.AddTracksResult;
import com.playlistbridge.platform.PlatformException;
import com.playlistbridge.platform.SourceTrack;
import com.playlistbridge.platform.TargetPlatformClient;
import com.playlistbridge.platform.TransientPlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Matching and writing of source tracks into one target playlist, batch by batch. Shared by the
 * full transfer and the incremental sync.
 * <p>
 * Each batch covers {@code batchSize} source tracks: they are looked up in the library, searched
 * on the target when needed, and the resulting ids not yet in the playlist are written in one
 * call. The library is persisted before the batch is reported as committed.
 */
public class TrackPipeline {

    private static final Logger log = LoggerFactory.getLogger(TrackPipeline.class);

    @FunctionalInterface
    public interface BatchListener {
        /**
         * Called after a batch was written and the library persisted.
         *
         * @param tracks   source tracks covered by the batch
         * @param found    tracks with a target match
         * @param notFound tracks without one
         */
        void committed(int tracks, int found, int notFound);
    }

    public record Result(int found, int notFound, int added) {}

    private final TargetPlatformClient target;
    private final TrackLibrary library;
    private final RequestPacer pacer;
    private final RetryPolicy retry;
    private final int batchSize;

    public TrackPipeline(TargetPlatformClient target, TrackLibrary library, RequestPacer pacer,
                         RetryPolicy retry, int batchSize) {
        this.target = target;
        this.library = library;
        this.pacer = pacer;
        this.retry = retry;
        this.batchSize = Math.max(1, batchSize);
    }

    /**
     * @param presentIds target track ids already in the playlist; updated as batches land
     */
    public Result transfer(String sourcePlaylistId, String targetPlaylistId, List<SourceTrack> tracks,
                           Set<String> presentIds, boolean recheck, BatchListener listener)
            throws PlatformException, BatchFailureException, InterruptedException {
        int found = 0;
        int notFound = 0;
        int added = 0;
        for (int start = 0; start < tracks.size(); start += batchSize) {
            List<SourceTrack> chunk = tracks.subList(start, Math.min(tracks.size(), start + batchSize));
            List<String> freshMatches = new ArrayList<>();
            List<String> joined = new ArrayList<>();
            Set<String> batchIds = new LinkedHashSet<>();
            int chunkFound = 0;
            int chunkNotFound = 0;
            try {
                for (SourceTrack track : chunk) {
                    Optional<String> targetId = match(track, sourcePlaylistId, recheck, freshMatches, joined);
                    if (targetId.isPresent()) {
                        chunkFound++;
                        if (!presentIds.contains(targetId.get())) {
                            batchIds.add(targetId.get());
                        }
                    } else {
                        chunkNotFound++;
                    }
                }
                if (!batchIds.isEmpty()) {
                    writeBatch(targetPlaylistId, new ArrayList<>(batchIds));
                }
            } catch (PlatformException | BatchFailureException | InterruptedException e) {
                rollback(sourcePlaylistId, freshMatches, joined);
                throw e;
            }
            presentIds.addAll(batchIds);
            library.persist();
            found += chunkFound;
            notFound += chunkNotFound;
            added += batchIds.size();
            log.info("Batch of {} tracks committed to {}: {} found, {} not found, {} added",
                    chunk.size(), targetPlaylistId, chunkFound, chunkNotFound, batchIds.size());
            if (listener != null) {
                listener.committed(chunk.size(), chunkFound, chunkNotFound);
            }
        }
        return new Result(found, notFound, added);
    }

    private Optional<String> match(SourceTrack track, String sourcePlaylistId, boolean recheck,
                                   List<String> freshMatches, List<String> joined)
            throws PlatformException, InterruptedException {
        boolean joining = library.get(track.id()).map(r -> !r.belongsTo(sourcePlaylistId)).orElse(true);
        TrackRecord record = library.recordTrack(track, sourcePlaylistId);
        if (joining) {
            joined.add(track.id());
        }
        if (record.isMatched()) {
            return Optional.of(record.getTargetId());
        }
        if (record.isConfirmedAbsent() && !recheck) {
            return Optional.empty();
        }
        String query = track.searchQuery();
        Optional<String> result;
        try {
            result = retry.call("Search '" + query + "'", () -> target.searchTrack(query));
        } finally {
            pacer.afterSearch();
        }
        if (result.isPresent()) {
            library.setTargetMatch(track.id(), result.get(), true);
            freshMatches.add(track.id());
            log.debug("Matched '{}' -> {}", query, result.get());
        } else {
            library.setTargetMatch(track.id(), null, false);
            log.info("Not found on target: {}", query);
        }
        return result;
    }

    /**
     * Writes one batch, retrying only the ids the platform rejected.
     */
    void writeBatch(String targetPlaylistId, List<String> ids) throws BatchFailureException, InterruptedException {
        List<String> remaining = ids;
        Exception lastError = null;
        int attempts = retry.getMaxAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            long retryAfter = 0L;
            try {
                AddTracksResult result = target.addTracks(targetPlaylistId, remaining);
                if (result.isComplete()) {
                    pacer.afterBatch();
                    return;
                }
                List<String> rejected = new ArrayList<>(result.rejectedIds());
                rejected.retainAll(remaining);
                if (rejected.isEmpty()) {
                    pacer.afterBatch();
                    return;
                }
                lastError = new PlatformException(rejected.size() + " of " + remaining.size() + " tracks rejected");
                remaining = rejected;
            } catch (TransientPlatformException e) {
                lastError = e;
                retryAfter = e.getRetryAfterMillis();
            } catch (PlatformException e) {
                pacer.afterBatch();
                throw new BatchFailureException("Adding tracks to " + targetPlaylistId + " failed: " + e.getMessage(), attempt, e);
            }
            pacer.afterBatch();
            if (attempt < attempts) {
                log.warn("Batch write to {} failed (attempt {}/{}): {}", targetPlaylistId, attempt, attempts, lastError.getMessage());
                retry.backoff(attempt, retryAfter);
            }
        }
        throw new BatchFailureException("Adding " + remaining.size() + " tracks to " + targetPlaylistId
                + " failed after " + attempts + " attempts: " + lastError.getMessage(), attempts, lastError);
    }

    private void rollback(String sourcePlaylistId, List<String> freshMatches, List<String> joined) {
        for (String sourceId : freshMatches) {
            library.rollbackTargetMatch(sourceId);
        }
        for (String sourceId : joined) {
            library.leavePlaylist(sourceId, sourcePlaylistId);
        }
        if (!freshMatches.isEmpty() || !joined.isEmpty()) {
            log.info("Rolled back {} matches and {} memberships of the failed batch", freshMatches.size(), joined.size());
        }
        library.persist();
    }
}
