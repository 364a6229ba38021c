package com.playlistbridge.library;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Column layout of the library file. Extra platforms get an {@code <platform>Id} column after
 * {@code targetId} and an {@code <platform>Available} column after {@code targetAvailable}.
 * <p>
 * Platform columns found in a file whose platform is no longer configured are read into the
 * records and written back after the configured ones.
 */
final class LibraryCsvFormat {

    static final String SOURCE_ID = "sourceId";
    static final String TARGET_ID = "targetId";
    static final String TRACK_NAME = "trackName";
    static final String ARTIST_NAME = "artistName";
    static final String ALBUM_NAME = "albumName";
    static final String PLAYLIST_IDS = "playlistIds";
    static final String SOURCE_AVAILABLE = "sourceAvailable";
    static final String TARGET_AVAILABLE = "targetAvailable";
    static final String LAST_SYNCED = "lastSynced";
    static final String NOTES = "notes";

    private static final String PLAYLIST_SEPARATOR = ",";

    private final List<String> extraPlatforms;
    private final Set<String> retainedPlatforms = new LinkedHashSet<>();
    private List<String> columnPlatforms;
    private String[] header;

    LibraryCsvFormat(List<String> extraPlatforms) {
        this.extraPlatforms = List.copyOf(extraPlatforms);
        rebuildHeader();
    }

    String[] header() {
        return header.clone();
    }

    /**
     * Platforms that have columns in the last file read but are not configured.
     */
    List<String> retainedPlatforms() {
        return List.copyOf(retainedPlatforms);
    }

    private void rebuildHeader() {
        List<String> platforms = new ArrayList<>(extraPlatforms);
        platforms.addAll(retainedPlatforms);
        List<String> columns = new ArrayList<>();
        columns.add(SOURCE_ID);
        columns.add(TARGET_ID);
        for (String platform : platforms) {
            columns.add(idColumn(platform));
        }
        columns.addAll(List.of(TRACK_NAME, ARTIST_NAME, ALBUM_NAME, PLAYLIST_IDS, SOURCE_AVAILABLE, TARGET_AVAILABLE));
        for (String platform : platforms) {
            columns.add(availableColumn(platform));
        }
        columns.add(LAST_SYNCED);
        columns.add(NOTES);
        this.columnPlatforms = List.copyOf(platforms);
        this.header = columns.toArray(String[]::new);
    }

    void write(Writer out, Collection<TrackRecord> records) throws IOException {
        CSVWriter writer = new CSVWriter(out);
        writer.writeNext(header, false);
        for (TrackRecord record : records) {
            writer.writeNext(toRow(record), false);
        }
        writer.flush();
        if (writer.checkError()) {
            throw new IOException("CSV writer reported an error");
        }
    }

    List<TrackRecord> read(Reader in) throws IOException {
        List<TrackRecord> records = new ArrayList<>();
        try (CSVReader reader = new CSVReaderBuilder(in).build()) {
            String[] head = reader.readNext();
            if (head == null) {
                return records;
            }
            Map<String, Integer> index = new HashMap<>();
            for (int i = 0; i < head.length; i++) {
                index.put(head[i].trim(), i);
            }
            if (!index.containsKey(SOURCE_ID)) {
                throw new IOException("Library header has no " + SOURCE_ID + " column: " + Arrays.toString(head));
            }
            retainedPlatforms.clear();
            for (String column : index.keySet()) {
                String platform = platformOf(column);
                if (platform != null && !extraPlatforms.contains(platform)) {
                    retainedPlatforms.add(platform);
                }
            }
            rebuildHeader();
            String[] row;
            while ((row = reader.readNext()) != null) {
                String sourceId = cell(row, index, SOURCE_ID);
                if (sourceId.isBlank()) {
                    continue;
                }
                records.add(fromRow(row, index, sourceId));
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed library row: " + e.getMessage(), e);
        }
        return records;
    }

    private String[] toRow(TrackRecord record) {
        List<String> cells = new ArrayList<>(header.length);
        cells.add(record.getSourceId());
        cells.add(nullToEmpty(record.getTargetId()));
        for (String platform : columnPlatforms) {
            cells.add(nullToEmpty(record.getPlatformId(platform)));
        }
        cells.add(nullToEmpty(record.getTrackName()));
        cells.add(nullToEmpty(record.getArtistName()));
        cells.add(nullToEmpty(record.getAlbumName()));
        cells.add(String.join(PLAYLIST_SEPARATOR, record.getPlaylistIds()));
        cells.add(formatBoolean(record.isSourceAvailable()));
        cells.add(formatBoolean(record.getTargetAvailable()));
        for (String platform : columnPlatforms) {
            cells.add(formatBoolean(record.getPlatformAvailable(platform)));
        }
        cells.add(record.getLastSyncedAt() != null ? record.getLastSyncedAt().toString() : "");
        cells.add(nullToEmpty(record.getNotes()));
        return cells.toArray(String[]::new);
    }

    private TrackRecord fromRow(String[] row, Map<String, Integer> index, String sourceId) throws IOException {
        TrackRecord record = new TrackRecord(
                sourceId,
                cell(row, index, TRACK_NAME),
                cell(row, index, ARTIST_NAME),
                cell(row, index, ALBUM_NAME));
        String playlists = cell(row, index, PLAYLIST_IDS);
        if (!playlists.isBlank()) {
            for (String playlistId : playlists.split(PLAYLIST_SEPARATOR)) {
                record.addPlaylist(playlistId.trim());
            }
        }
        Boolean sourceAvailable = parseBoolean(cell(row, index, SOURCE_AVAILABLE));
        record.restore(
                cell(row, index, TARGET_ID),
                parseBoolean(cell(row, index, TARGET_AVAILABLE)),
                sourceAvailable == null || sourceAvailable,
                parseInstant(cell(row, index, LAST_SYNCED), sourceId),
                cell(row, index, NOTES));
        for (String platform : columnPlatforms) {
            record.restorePlatform(platform,
                    cell(row, index, idColumn(platform)),
                    parseBoolean(cell(row, index, availableColumn(platform))));
        }
        return record;
    }

    private static String cell(String[] row, Map<String, Integer> index, String column) {
        Integer i = index.get(column);
        if (i == null || i >= row.length || row[i] == null) {
            return "";
        }
        return row[i].trim();
    }

    static Boolean parseBoolean(String value) {
        if (value == null || value.isBlank() || "null".equalsIgnoreCase(value.trim())) {
            return null;
        }
        return "true".equals(value.trim().toLowerCase(Locale.ROOT));
    }

    private static String formatBoolean(Boolean value) {
        return value == null ? "" : value.toString();
    }

    private static Instant parseInstant(String value, String sourceId) throws IOException {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IOException("Invalid lastSynced value for " + sourceId + ": " + value, e);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    // Platform name of an <platform>Id or <platform>Available column, null for the fixed columns.
    private static String platformOf(String column) {
        String platform = null;
        if (column.endsWith("Id") && !column.equals(SOURCE_ID) && !column.equals(TARGET_ID)) {
            platform = column.substring(0, column.length() - "Id".length());
        } else if (column.endsWith("Available") && !column.equals(SOURCE_AVAILABLE) && !column.equals(TARGET_AVAILABLE)) {
            platform = column.substring(0, column.length() - "Available".length());
        }
        return platform == null || platform.isBlank() ? null : platform;
    }

    private static String idColumn(String platform) {
        return platform + "Id";
    }

    private static String availableColumn(String platform) {
        return platform + "Available";
    }
}
