package com.playlistbridge;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineOptionsTest {

    @Test
    void noArgumentsMeansFullTransfer() {
        CommandLineOptions options = CommandLineOptions.parse();

        assertEquals(CommandLineOptions.Mode.TRANSFER, options.mode());
        assertFalse(options.fresh());
        assertFalse(options.recheck());
    }

    @Test
    void syncWithRecheckAndFiles() {
        CommandLineOptions options = CommandLineOptions.parse(
                "--sync", "--recheck", "--library-file", "lib.csv", "--checkpoint-file", "cp.json");

        assertEquals(CommandLineOptions.Mode.SYNC, options.mode());
        assertTrue(options.recheck());
        assertEquals(Path.of("lib.csv"), options.libraryFile());
        assertEquals(Path.of("cp.json"), options.checkpointFile());
    }

    @Test
    void exportTakesOptionalFile() {
        assertNull(CommandLineOptions.parse("--export").exportFile());
        assertEquals(Path.of("missing.csv"), CommandLineOptions.parse("--export", "missing.csv").exportFile());
        assertNull(CommandLineOptions.parse("--export", "--library-file", "x.csv").exportFile());
    }

    @Test
    void rejectsBadCombinations() {
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse("--sync", "--status"));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse("--status", "--fresh"));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse("--sync", "--fresh"));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse("--library", "--recheck"));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse("--library-file"));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse("--verbose"));
    }

    @Test
    void repeatedModeIsAllowed() {
        assertEquals(CommandLineOptions.Mode.STATUS, CommandLineOptions.parse("--status", "--status").mode());
    }

    @Test
    void appliesFlagsToSettings() {
        TransferSettings settings = CommandLineOptions.parse("--fresh", "--recheck", "--checkpoint-file", "cp.json")
                .applyTo(TransferSettings.defaults());

        assertTrue(settings.fresh());
        assertTrue(settings.recheck());
        assertEquals(Path.of("cp.json"), settings.checkpointFile());
        assertEquals(Path.of("data", "library.csv"), settings.libraryFile());
    }
}
