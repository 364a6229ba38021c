package com.playlistbridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Application settings. Values come from {@code config.properties}, then {@code .env}, then the
 * process environment; later sources override earlier ones.
 */
public final class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    private static final Set<String> KNOWN_KEYS = Set.of(
            "SPOTIFY_CLIENT_ID",
            "SPOTIFY_CLIENT_SECRET",
            "SPOTIFY_TOKEN_FILE",
            "TIDAL_CLIENT_ID",
            "TIDAL_CLIENT_SECRET",
            "TIDAL_TOKEN_FILE",
            "TIDAL_API_BASE",
            "LIBRARY_FILE",
            "CHECKPOINT_FILE",
            "EXTRA_PLATFORMS",
            "BATCH_SIZE",
            "MAX_BATCH_ATTEMPTS",
            "RETRY_BACKOFF_MS",
            "SEARCH_DELAY_MS",
            "BATCH_DELAY_MS",
            "PLAYLIST_DELAY_MS",
            "ARCHIVE_CHECKPOINT"
    );

    private static final Map<String, String> cache = new HashMap<>();
    private static final List<String> loadedSources = new ArrayList<>();
    private static boolean initialized;

    private Config() {}

    private static synchronized void loadIfNeeded() {
        if (initialized) {
            return;
        }
        loadFromPropertiesIfPresent(Path.of("config.properties"));
        loadFromDotEnvIfPresent(Path.of(".env"));
        loadFromEnvironment();
        initialized = true;
        if (!loadedSources.isEmpty()) {
            log.debug("Configuration loaded from {}", loadedSources);
        }
    }

    private static void loadFromPropertiesIfPresent(Path file) {
        if (!Files.isRegularFile(file)) {
            return;
        }
        Properties props = new Properties();
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return;
        }
        for (String key : props.stringPropertyNames()) {
            put(key, props.getProperty(key));
        }
        loadedSources.add(file.toString());
    }

    private static void loadFromDotEnvIfPresent(Path file) {
        if (!Files.isRegularFile(file)) {
            return;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                if (trimmed.startsWith("export ")) {
                    trimmed = trimmed.substring("export ".length()).trim();
                }
                int eq = trimmed.indexOf('=');
                if (eq <= 0) {
                    continue;
                }
                put(trimmed.substring(0, eq).trim(), stripQuotes(trimmed.substring(eq + 1).trim()));
            }
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return;
        }
        loadedSources.add(file.toString());
    }

    private static void loadFromEnvironment() {
        boolean any = false;
        for (String key : KNOWN_KEYS) {
            String value = System.getenv(key);
            if (value != null && !value.isBlank()) {
                cache.put(key, value.trim());
                any = true;
            }
        }
        if (any) {
            loadedSources.add("environment");
        }
    }

    private static void put(String key, String value) {
        if (!KNOWN_KEYS.contains(key) || value == null) {
            return;
        }
        cache.put(key, value.trim());
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static String get(String key) {
        loadIfNeeded();
        String value = cache.get(key);
        return (value == null || value.isBlank()) ? null : value;
    }

    private static String get(String key, String def) {
        String value = get(key);
        return value != null ? value : def;
    }

    private static int getInt(String key, int def) {
        String value = get(key);
        if (value == null) {
            return def;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {}={}, using {}", key, value, def);
            return def;
        }
    }

    private static long getLong(String key, long def) {
        String value = get(key);
        if (value == null) {
            return def;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {}={}, using {}", key, value, def);
            return def;
        }
    }

    private static boolean getBoolean(String key, boolean def) {
        String value = get(key);
        if (value == null) {
            return def;
        }
        String v = value.toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("yes");
    }

    public static String getSpotifyClientId() {
        return get("SPOTIFY_CLIENT_ID");
    }

    public static String getSpotifyClientSecret() {
        return get("SPOTIFY_CLIENT_SECRET");
    }

    public static Path getSpotifyTokenFile() {
        return Path.of(get("SPOTIFY_TOKEN_FILE", "spotify_session.json"));
    }

    public static String getTidalClientId() {
        return get("TIDAL_CLIENT_ID");
    }

    public static String getTidalClientSecret() {
        return get("TIDAL_CLIENT_SECRET");
    }

    public static Path getTidalTokenFile() {
        return Path.of(get("TIDAL_TOKEN_FILE", "tidal_session.json"));
    }

    public static String getTidalApiBase() {
        return get("TIDAL_API_BASE");
    }

    public static Path getLibraryFile() {
        return Path.of(get("LIBRARY_FILE", "data/library.csv"));
    }

    public static Path getCheckpointFile() {
        return Path.of(get("CHECKPOINT_FILE", "transfer_checkpoint.json"));
    }

    public static List<String> getExtraPlatforms() {
        String value = get("EXTRA_PLATFORMS", "soundcloud");
        List<String> platforms = new ArrayList<>();
        for (String p : value.split(",")) {
            String trimmed = p.trim().toLowerCase(Locale.ROOT);
            if (!trimmed.isEmpty() && !trimmed.equals("none") && !platforms.contains(trimmed)) {
                platforms.add(trimmed);
            }
        }
        return platforms;
    }

    public static int getBatchSize() {
        return getInt("BATCH_SIZE", TransferSettings.DEFAULT_BATCH_SIZE);
    }

    public static int getMaxBatchAttempts() {
        return getInt("MAX_BATCH_ATTEMPTS", TransferSettings.DEFAULT_MAX_BATCH_ATTEMPTS);
    }

    public static long getRetryBackoffMs() {
        return getLong("RETRY_BACKOFF_MS", TransferSettings.DEFAULT_RETRY_BACKOFF_MS);
    }

    public static long getSearchDelayMs() {
        return getLong("SEARCH_DELAY_MS", TransferSettings.DEFAULT_SEARCH_DELAY_MS);
    }

    public static long getBatchDelayMs() {
        return getLong("BATCH_DELAY_MS", TransferSettings.DEFAULT_BATCH_DELAY_MS);
    }

    public static long getPlaylistDelayMs() {
        return getLong("PLAYLIST_DELAY_MS", TransferSettings.DEFAULT_PLAYLIST_DELAY_MS);
    }

    public static boolean isArchiveCheckpoint() {
        return getBoolean("ARCHIVE_CHECKPOINT", true);
    }

    public static TransferSettings toSettings() {
        return new TransferSettings(
                getLibraryFile(),
                getCheckpointFile(),
                getExtraPlatforms(),
                Math.max(1, getBatchSize()),
                Math.max(1, getMaxBatchAttempts()),
                getRetryBackoffMs(),
                getSearchDelayMs(),
                getBatchDelayMs(),
                getPlaylistDelayMs(),
                isArchiveCheckpoint(),
                false,
                false);
    }
}
