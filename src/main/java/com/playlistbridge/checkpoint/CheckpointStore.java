package com.playlistbridge.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.playlistbridge.io.AtomicFileWriter;
import com.playlistbridge.io.PersistenceException;
import com.playlistbridge.platform.SourcePlaylist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes the checkpoint file of a transfer run. A checkpoint that cannot be read is
 * treated as absent; one that cannot be written aborts the run.
 */
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private static final DateTimeFormatter ARCHIVE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Path file;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final boolean archiveOnClear;

    public CheckpointStore(Path file, ObjectMapper mapper, Clock clock, boolean archiveOnClear) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = mapper;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.archiveOnClear = archiveOnClear;
    }

    public Path getFile() {
        return file;
    }

    public boolean exists() {
        return Files.exists(file);
    }

    public Optional<CheckpointState> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        CheckpointState state;
        try {
            state = mapper.readValue(file.toFile(), CheckpointState.class);
        } catch (IOException e) {
            log.warn("Ignoring unreadable checkpoint {}: {}", file, e.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring invalid checkpoint {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        if (state == null) {
            log.warn("Ignoring empty checkpoint {}", file);
            return Optional.empty();
        }
        if (!CheckpointState.CURRENT_VERSION.equals(state.getVersion())) {
            log.warn("Ignoring checkpoint {} with unsupported version {}", file, state.getVersion());
            return Optional.empty();
        }
        if (state.getPlaylists().isEmpty() || state.isComplete()) {
            log.info("Checkpoint {} describes a finished run, ignoring it", file);
            return Optional.empty();
        }
        return Optional.of(state);
    }

    public CheckpointState init(String sourceUserId, List<SourcePlaylist> playlists) {
        CheckpointState state = CheckpointState.fresh(sourceUserId, playlists, clock.instant().toString());
        log.info("Initialised checkpoint for {} playlists", state.getTotalPlaylists());
        return state;
    }

    public void save(CheckpointState state) {
        state.setUpdatedAt(clock.instant().toString());
        final byte[] json;
        try {
            json = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialise checkpoint", e);
        }
        try {
            AtomicFileWriter.write(file, writer -> writer.write(new String(json, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new PersistenceException("Failed to write checkpoint " + file, e);
        }
    }

    /**
     * Removes the checkpoint after a fully completed run, keeping a timestamped copy when
     * archiving is enabled.
     */
    public void clear() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            if (archiveOnClear) {
                Path archive = archivePath();
                Files.copy(file, archive, StandardCopyOption.REPLACE_EXISTING);
                log.info("Archived checkpoint to {}", archive);
            }
            Files.delete(file);
        } catch (IOException e) {
            throw new PersistenceException("Failed to clear checkpoint " + file, e);
        }
    }

    /**
     * Deletes the checkpoint without archiving it.
     *
     * @return whether a file was deleted
     */
    public boolean reset() {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new PersistenceException("Failed to delete checkpoint " + file, e);
        }
    }

    Path archivePath() {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String archived = base + "_completed_" + ARCHIVE_STAMP.format(clock.instant()) + ".json";
        Path parent = file.toAbsolutePath().getParent();
        return parent != null ? parent.resolve(archived) : Path.of(archived);
    }
}
