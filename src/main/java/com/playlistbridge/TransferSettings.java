package com.playlistbridge;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable knobs of a transfer or sync run. Built from {@link Config} and command line flags;
 * the core receives it explicitly and never reads configuration itself.
 */
public record TransferSettings(
        Path libraryFile,
        Path checkpointFile,
        List<String> extraPlatforms,
        int batchSize,
        int maxBatchAttempts,
        long retryBackoffMs,
        long searchDelayMs,
        long batchDelayMs,
        long playlistDelayMs,
        boolean archiveCheckpoint,
        boolean recheck,
        boolean fresh
) {

    public static final int DEFAULT_BATCH_SIZE = 50;
    public static final int DEFAULT_MAX_BATCH_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_BACKOFF_MS = 5000L;
    public static final long DEFAULT_SEARCH_DELAY_MS = 1500L;
    public static final long DEFAULT_BATCH_DELAY_MS = 3000L;
    public static final long DEFAULT_PLAYLIST_DELAY_MS = 5000L;

    public TransferSettings {
        if (libraryFile == null) {
            libraryFile = Path.of("data", "library.csv");
        }
        if (checkpointFile == null) {
            checkpointFile = Path.of("transfer_checkpoint.json");
        }
        extraPlatforms = extraPlatforms != null ? List.copyOf(extraPlatforms) : List.of();
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, was " + batchSize);
        }
        if (maxBatchAttempts < 1) {
            throw new IllegalArgumentException("maxBatchAttempts must be at least 1, was " + maxBatchAttempts);
        }
        retryBackoffMs = Math.max(0L, retryBackoffMs);
        searchDelayMs = Math.max(0L, searchDelayMs);
        batchDelayMs = Math.max(0L, batchDelayMs);
        playlistDelayMs = Math.max(0L, playlistDelayMs);
    }

    public static TransferSettings defaults() {
        return new TransferSettings(null, null, List.of("soundcloud"),
                DEFAULT_BATCH_SIZE, DEFAULT_MAX_BATCH_ATTEMPTS, DEFAULT_RETRY_BACKOFF_MS,
                DEFAULT_SEARCH_DELAY_MS, DEFAULT_BATCH_DELAY_MS, DEFAULT_PLAYLIST_DELAY_MS,
                true, false, false);
    }

    public TransferSettings withRecheck(boolean recheck) {
        return new TransferSettings(libraryFile, checkpointFile, extraPlatforms, batchSize, maxBatchAttempts,
                retryBackoffMs, searchDelayMs, batchDelayMs, playlistDelayMs, archiveCheckpoint, recheck, fresh);
    }

    public TransferSettings withFresh(boolean fresh) {
        return new TransferSettings(libraryFile, checkpointFile, extraPlatforms, batchSize, maxBatchAttempts,
                retryBackoffMs, searchDelayMs, batchDelayMs, playlistDelayMs, archiveCheckpoint, recheck, fresh);
    }

    public TransferSettings withLibraryFile(Path libraryFile) {
        return new TransferSettings(libraryFile, checkpointFile, extraPlatforms, batchSize, maxBatchAttempts,
                retryBackoffMs, searchDelayMs, batchDelayMs, playlistDelayMs, archiveCheckpoint, recheck, fresh);
    }

    public TransferSettings withCheckpointFile(Path checkpointFile) {
        return new TransferSettings(libraryFile, checkpointFile, extraPlatforms, batchSize, maxBatchAttempts,
                retryBackoffMs, searchDelayMs, batchDelayMs, playlistDelayMs, archiveCheckpoint, recheck, fresh);
    }
}
