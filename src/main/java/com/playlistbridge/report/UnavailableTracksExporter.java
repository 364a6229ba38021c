package com.playlistbridge.report;

import com.opencsv.CSVWriter;
import com.playlistbridge.io.AtomicFileWriter;
import com.playlistbridge.library.TrackLibrary;
import com.playlistbridge.library.TrackRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the tracks the target platform does not carry to a CSV file, for manual follow-up.
 */
public class UnavailableTracksExporter {

    private static final Logger log = LoggerFactory.getLogger(UnavailableTracksExporter.class);

    static final String[] HEADER = {"artistName", "trackName", "albumName", "sourceId", "playlistIds", "lastSynced", "notes"};

    public static final Path DEFAULT_FILE = Path.of("unavailable_on_tidal.csv");

    /**
     * @return number of tracks exported
     */
    public int export(TrackLibrary library, Path output) throws IOException {
        List<TrackRecord> unavailable = library.getUnavailableTracks();
        AtomicFileWriter.write(output, writer -> {
            CSVWriter csv = new CSVWriter(writer);
            csv.writeNext(HEADER, false);
            for (TrackRecord record : unavailable) {
                csv.writeNext(new String[]{
                        record.getArtistName(),
                        record.getTrackName(),
                        record.getAlbumName(),
                        record.getSourceId(),
                        String.join(",", record.getPlaylistIds()),
                        record.getLastSyncedAt() != null ? record.getLastSyncedAt().toString() : "",
                        record.getNotes()
                }, false);
            }
            csv.flush();
        });
        log.info("Exported {} unavailable tracks to {}", unavailable.size(), output);
        return unavailable.size();
    }
}
