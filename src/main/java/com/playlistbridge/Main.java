package com.playlistbridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.playlistbridge.auth.AuthSession;
import com.playlistbridge.auth.ManagedSession;
import com.playlistbridge.auth.SessionFileStore;
import com.playlistbridge.checkpoint.CheckpointStore;
import com.playlistbridge.io.PersistenceException;
import com.playlistbridge.library.TrackLibrary;
import com.playlistbridge.library.TrackNotFoundException;
import com.playlistbridge.platform.PlatformException;
import com.playlistbridge.platform.SourcePlatformClient;
import com.playlistbridge.platform.TargetPlatformClient;
import com.playlistbridge.report.StatusReporter;
import com.playlistbridge.report.UnavailableTracksExporter;
import com.playlistbridge.spotify.SpotifySourceClient;
import com.playlistbridge.spotify.SpotifyTokenRefresher;
import com.playlistbridge.tidal.TidalApiClient;
import com.playlistbridge.tidal.TidalTokenRefresher;
import com.playlistbridge.transfer.Sleeper;
import com.playlistbridge.transfer.SyncDiffer;
import com.playlistbridge.transfer.TransferOrchestrator;
import com.playlistbridge.transfer.TransferReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.michaelthelin.spotify.SpotifyApi;

import java.io.IOException;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_PLAYLIST_FAILED = 1;
    static final int EXIT_FATAL = 2;
    static final int EXIT_INTERRUPTED = 130;

    public static void main(String[] args) {
        AtomicBoolean finished = new AtomicBoolean(false);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (!finished.get()) {
                log.warn("Interrupted; the next run resumes from the last saved checkpoint");
            }
        }, "shutdown-notice"));
        int code;
        try {
            code = run(args, System.out);
        } finally {
            finished.set(true);
        }
        System.exit(code);
    }

    /**
     * Body of one CLI mode, returning its exit code.
     */
    @FunctionalInterface
    interface Action {
        int call() throws IOException, PlatformException, InterruptedException;
    }

    static int run(String[] args, PrintStream out) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(CommandLineOptions.USAGE);
            return EXIT_FATAL;
        }
        if (options.mode() == CommandLineOptions.Mode.HELP) {
            out.println(CommandLineOptions.USAGE);
            return EXIT_OK;
        }

        TransferSettings settings = options.applyTo(Config.toSettings());
        ObjectMapper mapper = new ObjectMapper();
        Clock clock = Clock.systemUTC();
        CheckpointStore checkpoints = new CheckpointStore(settings.checkpointFile(), mapper, clock, settings.archiveCheckpoint());
        StatusReporter reporter = new StatusReporter(out);

        return execute(() -> {
            switch (options.mode()) {
                case STATUS -> {
                    reporter.printCheckpoint(checkpoints.load());
                    return EXIT_OK;
                }
                case RESET -> {
                    boolean deleted = checkpoints.reset();
                    out.println(deleted ? "Checkpoint deleted: " + checkpoints.getFile() : "No checkpoint to delete.");
                    return EXIT_OK;
                }
                case LIBRARY -> {
                    reporter.printLibrary(openLibrary(settings, clock));
                    return EXIT_OK;
                }
                case EXPORT -> {
                    Path file = options.exportFile() != null ? options.exportFile() : UnavailableTracksExporter.DEFAULT_FILE;
                    int count = new UnavailableTracksExporter().export(openLibrary(settings, clock), file);
                    out.println("Exported " + count + " unavailable tracks to " + file);
                    return EXIT_OK;
                }
                default -> {
                    return transfer(options.mode(), settings, mapper, clock, checkpoints);
                }
            }
        });
    }

    /**
     * Runs {@code action} and maps the errors that end a run to exit codes.
     */
    static int execute(Action action) {
        try {
            return action.call();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted; the next run resumes from the last saved checkpoint");
            return EXIT_INTERRUPTED;
        } catch (PersistenceException e) {
            log.error("Aborting, could not persist state: {}", e.getMessage(), e);
            return EXIT_FATAL;
        } catch (PlatformException e) {
            log.error("Aborting: {}", e.getMessage(), e);
            return EXIT_FATAL;
        } catch (IOException e) {
            log.error("Aborting: {}", e.getMessage(), e);
            return EXIT_FATAL;
        } catch (TrackNotFoundException | IllegalStateException e) {
            log.error("Aborting, inconsistent transfer state: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    private static int transfer(CommandLineOptions.Mode mode, TransferSettings settings, ObjectMapper mapper,
                                Clock clock, CheckpointStore checkpoints)
            throws IOException, PlatformException, InterruptedException {
        TrackLibrary library = openLibrary(settings, clock);
        SessionFileStore sessions = new SessionFileStore(mapper);
        HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();

        Path spotifyFile = Config.getSpotifyTokenFile();
        AuthSession spotifySession = sessions.load(spotifyFile);
        ManagedSession spotify = new ManagedSession("Spotify", spotifySession,
                new SpotifyTokenRefresher(Config.getSpotifyClientId(), Config.getSpotifyClientSecret()),
                sessions, spotifyFile, clock);
        SpotifyApi spotifyApi = new SpotifyApi.Builder()
                .setClientId(Config.getSpotifyClientId())
                .setClientSecret(Config.getSpotifyClientSecret())
                .build();
        SourcePlatformClient source = new SpotifySourceClient(spotifyApi, spotify);

        Path tidalFile = Config.getTidalTokenFile();
        AuthSession tidalSession = sessions.load(tidalFile);
        ManagedSession tidal = new ManagedSession("TIDAL", tidalSession,
                new TidalTokenRefresher(http, mapper, Config.getTidalClientId(), Config.getTidalClientSecret()),
                sessions, tidalFile, clock);
        TargetPlatformClient target = new TidalApiClient(http, mapper, tidal, Config.getTidalApiBase());

        TransferReport report;
        if (mode == CommandLineOptions.Mode.SYNC) {
            report = new SyncDiffer(source, target, library, settings, Sleeper.system(), clock).syncAll();
        } else {
            report = new TransferOrchestrator(source, target, library, checkpoints, settings, Sleeper.system(), clock).run();
        }
        return report.hasFailures() ? EXIT_PLAYLIST_FAILED : EXIT_OK;
    }

    private static TrackLibrary openLibrary(TransferSettings settings, Clock clock) {
        return TrackLibrary.open(settings.libraryFile(), settings.extraPlatforms(), clock);
    }
}
