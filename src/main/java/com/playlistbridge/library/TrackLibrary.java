package com.playlistbridge.library;

import com.playlistbridge.io.AtomicFileWriter;
import com.playlistbridge.io.PersistenceException;
import com.playlistbridge.platform.SourceTrack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable ledger of every source track seen so far, keyed by source track id, together with
 * its match on the target platform and on any configured extra platforms.
 * <p>
 * The library lives in memory and is rewritten as a whole by {@link #persist()}. It is not
 * thread-safe; a single transfer run owns it.
 */
public class TrackLibrary {

    private static final Logger log = LoggerFactory.getLogger(TrackLibrary.class);

    private final Path file;
    private final List<String> extraPlatforms;
    private final LibraryCsvFormat format;
    private final Clock clock;
    private final Map<String, TrackRecord> records = new LinkedHashMap<>();

    public TrackLibrary(Path file, List<String> extraPlatforms, Clock clock) {
        this.file = Objects.requireNonNull(file, "file");
        this.extraPlatforms = extraPlatforms != null ? List.copyOf(extraPlatforms) : List.of();
        this.format = new LibraryCsvFormat(this.extraPlatforms);
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Creates a library backed by {@code file} and loads it if the file exists.
     */
    public static TrackLibrary open(Path file, List<String> extraPlatforms, Clock clock) {
        TrackLibrary library = new TrackLibrary(file, extraPlatforms, clock);
        library.load();
        return library;
    }

    public Path getFile() {
        return file;
    }

    public List<String> getExtraPlatforms() {
        return extraPlatforms;
    }

    /**
     * Replaces the in-memory index with the contents of the library file. A missing file
     * yields an empty library; a file that exists but cannot be read is fatal.
     */
    public void load() {
        records.clear();
        if (!Files.exists(file)) {
            log.info("No track library at {}, starting empty", file);
            return;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            for (TrackRecord record : format.read(reader)) {
                TrackRecord previous = records.put(record.getSourceId(), record);
                if (previous != null) {
                    log.warn("Duplicate library row for {}, keeping the last one", record.getSourceId());
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to read track library " + file, e);
        }
        List<String> retained = format.retainedPlatforms();
        if (!retained.isEmpty()) {
            log.warn("Library {} has columns for platforms not configured in EXTRA_PLATFORMS, keeping them unchanged: {}",
                    file, retained);
        }
        log.info("Loaded {} tracks from library {}", records.size(), file);
    }

    /**
     * Rewrites the whole library file atomically.
     */
    public void persist() {
        try {
            AtomicFileWriter.write(file, writer -> format.write(writer, records.values()));
        } catch (IOException e) {
            throw new PersistenceException("Failed to write track library " + file, e);
        }
        log.debug("Persisted {} tracks to {}", records.size(), file);
    }

    /**
     * Records that {@code track} is a member of {@code playlistId}. A known track keeps its
     * match and gains the playlist; its metadata is refreshed from the source listing.
     */
    public TrackRecord recordTrack(SourceTrack track, String playlistId) {
        Objects.requireNonNull(track, "track");
        TrackRecord record = records.get(track.id());
        if (record == null) {
            record = new TrackRecord(track.id(), track.name(), track.primaryArtist(), track.album());
            records.put(track.id(), record);
        } else {
            record.updateMetadata(track.name(), track.primaryArtist(), track.album());
        }
        record.addPlaylist(playlistId);
        return record;
    }

    public void setTargetMatch(String sourceId, String targetId, boolean found) {
        if (found && (targetId == null || targetId.isBlank())) {
            throw new IllegalArgumentException("A found track needs a target id: " + sourceId);
        }
        require(sourceId).setTargetMatch(targetId, found, clock.instant());
    }

    public void setPlatformMatch(String sourceId, String platform, String id, boolean found) {
        if (!extraPlatforms.contains(platform)) {
            throw new IllegalArgumentException("Platform is not configured for the library: " + platform);
        }
        if (found && (id == null || id.isBlank())) {
            throw new IllegalArgumentException("A found track needs an id on " + platform + ": " + sourceId);
        }
        require(sourceId).setPlatformMatch(platform, id, found, clock.instant());
    }

    /**
     * Forgets the target match of a track, returning it to the never-searched state. Used when
     * the write that would have delivered the match to the target playlist failed.
     */
    public void rollbackTargetMatch(String sourceId) {
        require(sourceId).clearTargetMatch();
    }

    /**
     * Drops the membership of a track in a playlist, so the playlist no longer counts it as
     * delivered. Used when the write that would have added a newly joined track failed.
     */
    public void leavePlaylist(String sourceId, String playlistId) {
        require(sourceId).removePlaylist(playlistId);
    }

    public void setNotes(String sourceId, String notes) {
        require(sourceId).setNotes(notes);
    }

    public Optional<TrackRecord> get(String sourceId) {
        return Optional.ofNullable(records.get(sourceId));
    }

    public int size() {
        return records.size();
    }

    public Collection<TrackRecord> getAll() {
        return Collections.unmodifiableCollection(records.values());
    }

    public List<TrackRecord> getTracksForPlaylist(String playlistId) {
        List<TrackRecord> result = new ArrayList<>();
        for (TrackRecord record : records.values()) {
            if (record.belongsTo(playlistId)) {
                result.add(record);
            }
        }
        return result;
    }

    public List<TrackRecord> getUnsyncedTracks(String playlistId) {
        return getUnsyncedTracks(playlistId, false);
    }

    /**
     * Tracks of the playlist that still have no target match. Tracks already searched and
     * not found are included only when {@code recheck} is set.
     */
    public List<TrackRecord> getUnsyncedTracks(String playlistId, boolean recheck) {
        List<TrackRecord> result = new ArrayList<>();
        for (TrackRecord record : records.values()) {
            if (!record.belongsTo(playlistId) || record.isMatched()) {
                continue;
            }
            if (recheck || !record.isConfirmedAbsent()) {
                result.add(record);
            }
        }
        return result;
    }

    /**
     * True when every member of the playlist has a target match.
     */
    public boolean isPlaylistSynced(String playlistId) {
        for (TrackRecord record : records.values()) {
            if (record.belongsTo(playlistId) && !record.isMatched()) {
                return false;
            }
        }
        return true;
    }

    public List<TrackRecord> getUnavailableTracks() {
        List<TrackRecord> result = new ArrayList<>();
        for (TrackRecord record : records.values()) {
            if (record.isConfirmedAbsent()) {
                result.add(record);
            }
        }
        return result;
    }

    public SyncStats getSyncStats() {
        return stats(records.values());
    }

    public SyncStats getSyncStats(String playlistId) {
        return stats(getTracksForPlaylist(playlistId));
    }

    private static SyncStats stats(Collection<TrackRecord> subset) {
        int matched = 0;
        int unavailable = 0;
        int pending = 0;
        for (TrackRecord record : subset) {
            if (record.isMatched()) {
                matched++;
            } else if (record.isConfirmedAbsent()) {
                unavailable++;
            } else {
                pending++;
            }
        }
        return new SyncStats(subset.size(), matched, unavailable, pending);
    }

    private TrackRecord require(String sourceId) {
        TrackRecord record = records.get(sourceId);
        if (record == null) {
            throw new TrackNotFoundException(sourceId);
        }
        return record;
    }
}
