package com.playlistbridge;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Parsed command line. Exactly one mode is active; {@link Mode#TRANSFER} is the default.
 */
public record CommandLineOptions(
        Mode mode,
        boolean fresh,
        boolean recheck,
        Path exportFile,
        Path checkpointFile,
        Path libraryFile
) {

    public enum Mode {
        TRANSFER,
        SYNC,
        STATUS,
        LIBRARY,
        EXPORT,
        RESET,
        HELP
    }

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: playlist-bridge [mode] [options]",
            "",
            "Modes (default: full transfer of all owned playlists):",
            "  --sync                 add only tracks missing on TIDAL",
            "  --status               show checkpoint progress",
            "  --library              show track library statistics",
            "  --export [file]        write tracks unavailable on TIDAL to a CSV file",
            "  --reset                delete the checkpoint",
            "  --help                 show this help",
            "",
            "Options:",
            "  --fresh                ignore any existing checkpoint",
            "  --recheck              search again for tracks previously not found",
            "  --checkpoint-file <f>  checkpoint location",
            "  --library-file <f>     track library location");

    public static CommandLineOptions parse(String... args) {
        Mode mode = null;
        boolean fresh = false;
        boolean recheck = false;
        Path exportFile = null;
        Path checkpointFile = null;
        Path libraryFile = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--sync" -> mode = setMode(mode, Mode.SYNC, arg);
                case "--status" -> mode = setMode(mode, Mode.STATUS, arg);
                case "--library" -> mode = setMode(mode, Mode.LIBRARY, arg);
                case "--reset" -> mode = setMode(mode, Mode.RESET, arg);
                case "--help", "-h" -> mode = setMode(mode, Mode.HELP, arg);
                case "--export" -> {
                    mode = setMode(mode, Mode.EXPORT, arg);
                    if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                        exportFile = Path.of(args[++i]);
                    }
                }
                case "--fresh" -> fresh = true;
                case "--recheck" -> recheck = true;
                case "--checkpoint-file" -> checkpointFile = Path.of(requireValue(args, ++i, arg));
                case "--library-file" -> libraryFile = Path.of(requireValue(args, ++i, arg));
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }
        if (mode == null) {
            mode = Mode.TRANSFER;
        }
        if (fresh && mode != Mode.TRANSFER) {
            throw new IllegalArgumentException("--fresh only applies to a full transfer");
        }
        if (recheck && mode != Mode.TRANSFER && mode != Mode.SYNC) {
            throw new IllegalArgumentException("--recheck only applies to a transfer or --sync");
        }
        return new CommandLineOptions(mode, fresh, recheck, exportFile, checkpointFile, libraryFile);
    }

    /**
     * Overlays the command line onto configured settings.
     */
    public TransferSettings applyTo(TransferSettings settings) {
        TransferSettings result = settings.withFresh(fresh).withRecheck(recheck);
        if (checkpointFile != null) {
            result = result.withCheckpointFile(checkpointFile);
        }
        if (libraryFile != null) {
            result = result.withLibraryFile(libraryFile);
        }
        return result;
    }

    private static Mode setMode(Mode current, Mode requested, String flag) {
        if (current != null && current != requested) {
            throw new IllegalArgumentException(flag + " cannot be combined with --" + current.name().toLowerCase(Locale.ROOT));
        }
        return requested;
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[index];
    }
}
