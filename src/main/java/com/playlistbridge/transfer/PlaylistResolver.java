package com.playlistbridge.transfer;

import com.playlistbridge.platform.PlatformException;
import com.playlistbridge.platform.TargetPlatformClient;
import com.playlistbridge.platform.TargetPlaylist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps source playlist names to target playlists. The target listing is fetched once per run;
 * names are matched exactly, so two source playlists with the same name share one target.
 */
public class PlaylistResolver {

    private static final Logger log = LoggerFactory.getLogger(PlaylistResolver.class);

    private static final DateTimeFormatter DESCRIPTION_DATE =
            DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    public record Resolution(String targetPlaylistId, boolean created) {}

    private final TargetPlatformClient target;
    private final RetryPolicy retry;
    private Map<String, String> byName;

    public PlaylistResolver(TargetPlatformClient target, RetryPolicy retry) {
        this.target = target;
        this.retry = retry;
    }

    public Optional<String> findExisting(String name) throws PlatformException, InterruptedException {
        return Optional.ofNullable(cache().get(name));
    }

    public Resolution resolveOrCreate(String name, String description) throws PlatformException, InterruptedException {
        Map<String, String> cache = cache();
        String existing = cache.get(name);
        if (existing != null) {
            log.info("Reusing target playlist '{}' ({})", name, existing);
            return new Resolution(existing, false);
        }
        // Not retried: a create that timed out may still have succeeded remotely.
        String created = target.createPlaylist(name, description);
        if (created == null || created.isBlank()) {
            throw new PlatformException("Target platform returned no id for new playlist '" + name + "'");
        }
        cache.put(name, created);
        log.info("Created target playlist '{}' ({})", name, created);
        return new Resolution(created, true);
    }

    /**
     * Description given to playlists created on the target.
     */
    public static String describe(int trackCount, Instant now) {
        return "Transferred from Spotify - " + trackCount + " tracks - " + DESCRIPTION_DATE.format(now);
    }

    private Map<String, String> cache() throws PlatformException, InterruptedException {
        if (byName == null) {
            List<TargetPlaylist> playlists = retry.call("List target playlists", target::listPlaylists);
            Map<String, String> index = new HashMap<>();
            for (TargetPlaylist playlist : playlists) {
                if (playlist.name() == null || playlist.id() == null) {
                    continue;
                }
                index.putIfAbsent(playlist.name(), playlist.id());
            }
            byName = index;
            log.debug("Cached {} target playlists", index.size());
        }
        return byName;
    }
}
