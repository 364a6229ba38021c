package com.playlistbridge.transfer;

import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Summary of a transfer or sync run, logged when the run ends.
 */
public final class TransferReport {

    private final List<PlaylistOutcome> outcomes;
    private final Duration elapsed;

    public TransferReport(List<PlaylistOutcome> outcomes, Duration elapsed) {
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
        this.elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    public List<PlaylistOutcome> getOutcomes() {
        return outcomes;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public List<PlaylistOutcome> getFailures() {
        List<PlaylistOutcome> failures = new ArrayList<>();
        for (PlaylistOutcome outcome : outcomes) {
            if (outcome.isFailed()) {
                failures.add(outcome);
            }
        }
        return failures;
    }

    public boolean hasFailures() {
        return !getFailures().isEmpty();
    }

    public int count(PlaylistOutcome.Kind kind) {
        int n = 0;
        for (PlaylistOutcome outcome : outcomes) {
            if (outcome.kind() == kind) {
                n++;
            }
        }
        return n;
    }

    public int totalFound() {
        return outcomes.stream().mapToInt(PlaylistOutcome::tracksFound).sum();
    }

    public int totalNotFound() {
        return outcomes.stream().mapToInt(PlaylistOutcome::tracksNotFound).sum();
    }

    public int totalAdded() {
        return outcomes.stream().mapToInt(PlaylistOutcome::tracksAdded).sum();
    }

    public void logTo(Logger log) {
        log.info("Run finished in {}s: {} playlists, {} completed, {} failed, {} empty, {} already done",
                elapsed.toSeconds(), outcomes.size(), count(PlaylistOutcome.Kind.COMPLETED),
                count(PlaylistOutcome.Kind.FAILED), count(PlaylistOutcome.Kind.EMPTY),
                count(PlaylistOutcome.Kind.ALREADY_COMPLETED) + count(PlaylistOutcome.Kind.ALREADY_SYNCED)
                        + count(PlaylistOutcome.Kind.NOTHING_TO_SYNC));
        log.info("Tracks found: {}, not found: {}, added: {}", totalFound(), totalNotFound(), totalAdded());
        for (PlaylistOutcome failure : getFailures()) {
            log.error("Playlist '{}' failed: {}", failure.name(), failure.reason());
        }
    }
}
