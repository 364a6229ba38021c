package com.playlistbridge.tidal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.playlistbridge.auth.ManagedSession;
import com.playlistbridge.platform.AddTracksResult;
import com.playlistbridge.platform.PlatformException;
import com.playlistbridge.platform.TargetPlatformClient;
import com.playlistbridge.platform.TargetPlaylist;
import com.playlistbridge.platform.TransientPlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * TIDAL v1 REST client covering what a playlist transfer needs: listing and creating the
 * user's playlists, track search and adding tracks.
 */
public class TidalApiClient implements TargetPlatformClient {

    private static final Logger log = LoggerFactory.getLogger(TidalApiClient.class);
    private static final String DEFAULT_API_BASE = "https://api.tidal.com/v1";
    private static final int PLAYLIST_PAGE_SIZE = 50;
    private static final int ITEM_PAGE_SIZE = 100;

    @FunctionalInterface
    private interface RequestFactory {
        HttpRequest.Builder create();
    }

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final ManagedSession session;
    private final String apiBase;

    public TidalApiClient(HttpClient http, ObjectMapper mapper, ManagedSession session) {
        this(http, mapper, session, DEFAULT_API_BASE);
    }

    public TidalApiClient(HttpClient http, ObjectMapper mapper, ManagedSession session, String apiBase) {
        this.http = http;
        this.mapper = mapper;
        this.session = session;
        String base = (apiBase == null || apiBase.isBlank()) ? DEFAULT_API_BASE : apiBase.trim();
        this.apiBase = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    @Override
    public List<TargetPlaylist> listPlaylists() throws PlatformException, InterruptedException {
        List<TargetPlaylist> playlists = new ArrayList<>();
        int offset = 0;
        while (true) {
            URI uri = URI.create(apiBase + "/users/" + urlEncode(userId()) + "/playlists?countryCode="
                    + urlEncode(session.getCountryCode()) + "&limit=" + PLAYLIST_PAGE_SIZE + "&offset=" + offset);
            JsonNode root = readJson(send("playlist listing", () -> baseRequest(uri).GET()));
            JsonNode items = root.path("items");
            if (!items.isArray() || items.size() == 0) {
                break;
            }
            for (JsonNode item : items) {
                String id = optText(item, "uuid");
                if (id == null) {
                    continue;
                }
                playlists.add(new TargetPlaylist(id, optText(item, "title"), item.path("numberOfTracks").asInt(0)));
            }
            offset += items.size();
            if (offset >= root.path("totalNumberOfItems").asInt(0)) {
                break;
            }
        }
        log.debug("TIDAL user {} has {} playlists", userId(), playlists.size());
        return playlists;
    }

    @Override
    public String createPlaylist(String name, String description) throws PlatformException, InterruptedException {
        String body = "title=" + urlEncode(name) + "&description=" + urlEncode(description != null ? description : "");
        URI uri = URI.create(apiBase + "/users/" + urlEncode(userId()) + "/playlists?countryCode="
                + urlEncode(session.getCountryCode()));
        JsonNode root = readJson(send("playlist creation", () -> baseRequest(uri)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(body))));
        String id = optText(root, "uuid");
        if (id == null) {
            throw new PlatformException("TIDAL playlist creation returned no uuid");
        }
        return id;
    }

    @Override
    public Optional<String> searchTrack(String query) throws PlatformException, InterruptedException {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        URI uri = URI.create(apiBase + "/search/tracks?query=" + urlEncode(query)
                + "&limit=1&countryCode=" + urlEncode(session.getCountryCode()));
        JsonNode items = readJson(send("track search", () -> baseRequest(uri).GET())).path("items");
        if (!items.isArray() || items.size() == 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(optText(items.get(0), "id"));
    }

    /**
     * Adds tracks in one call. TIDAL requires the playlist's current ETag, so the playlist is
     * read first; a concurrent modification answers 412 and is retried by the caller.
     */
    @Override
    public AddTracksResult addTracks(String playlistId, List<String> trackIds) throws PlatformException, InterruptedException {
        if (trackIds.isEmpty()) {
            return AddTracksResult.success(0);
        }
        String country = urlEncode(session.getCountryCode());
        URI playlistUri = URI.create(apiBase + "/playlists/" + urlEncode(playlistId) + "?countryCode=" + country);
        HttpResponse<String> playlist = send("playlist lookup", () -> baseRequest(playlistUri).GET());
        String etag = playlist.headers().firstValue("ETag").orElse(null);
        if (etag == null) {
            throw new PlatformException("TIDAL returned no ETag for playlist " + playlistId);
        }

        String body = "trackIds=" + urlEncode(String.join(",", trackIds)) + "&onArtifactNotFound=FAIL&onDupes=SKIP";
        URI itemsUri = URI.create(apiBase + "/playlists/" + urlEncode(playlistId) + "/items?countryCode=" + country);
        send("adding tracks", () -> baseRequest(itemsUri)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("If-None-Match", etag)
                .POST(HttpRequest.BodyPublishers.ofString(body)));
        return AddTracksResult.success(trackIds.size());
    }

    @Override
    public Set<String> listPlaylistTrackIds(String playlistId) throws PlatformException, InterruptedException {
        Set<String> ids = new LinkedHashSet<>();
        int offset = 0;
        while (true) {
            URI uri = URI.create(apiBase + "/playlists/" + urlEncode(playlistId) + "/items?countryCode="
                    + urlEncode(session.getCountryCode()) + "&limit=" + ITEM_PAGE_SIZE + "&offset=" + offset);
            JsonNode root = readJson(send("playlist items", () -> baseRequest(uri).GET()));
            JsonNode items = root.path("items");
            if (!items.isArray() || items.size() == 0) {
                break;
            }
            for (JsonNode entry : items) {
                String id = optText(entry.path("item"), "id");
                if (id != null) {
                    ids.add(id);
                }
            }
            offset += items.size();
            if (offset >= root.path("totalNumberOfItems").asInt(0)) {
                break;
            }
        }
        return ids;
    }

    private String userId() throws PlatformException {
        String userId = session.getUserId();
        if (userId == null || userId.isBlank()) {
            throw new PlatformException("TIDAL session has no user id");
        }
        return userId;
    }

    private HttpResponse<String> send(String operation, RequestFactory factory) throws PlatformException, InterruptedException {
        boolean refreshed = false;
        while (true) {
            HttpRequest request = factory.create()
                    .header("Authorization", "Bearer " + session.accessToken())
                    .build();
            HttpResponse<String> resp;
            try {
                resp = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new TransientPlatformException("TIDAL " + operation + " failed: " + e.getMessage(), e);
            }
            int status = resp.statusCode();
            if (status >= 200 && status < 300) {
                return resp;
            }
            if (status == 401 && !refreshed && session.forceRefresh()) {
                refreshed = true;
                continue;
            }
            String message = "TIDAL " + operation + " returned HTTP " + status + ": " + abbreviate(resp.body());
            if (status == 429) {
                throw new TransientPlatformException(message, null, retryAfterMillis(resp));
            }
            if (status >= 500 || status == 412) {
                throw new TransientPlatformException(message);
            }
            throw new PlatformException(message);
        }
    }

    private HttpRequest.Builder baseRequest(URI uri) {
        return HttpRequest.newBuilder(uri)
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(15));
    }

    private JsonNode readJson(HttpResponse<String> resp) throws PlatformException {
        try {
            return mapper.readTree(resp.body() == null || resp.body().isBlank() ? "{}" : resp.body());
        } catch (IOException e) {
            throw new PlatformException("TIDAL returned malformed JSON: " + e.getMessage(), e);
        }
    }

    static long retryAfterMillis(HttpResponse<?> resp) {
        Optional<String> header = resp.headers().firstValue("Retry-After");
        if (header.isEmpty()) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(header.get().trim()) * 1000L);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header: {}", header.get());
            return 0L;
        }
    }

    private static String optText(JsonNode node, String field) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        String text = v.asText();
        return text.isBlank() ? null : text;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    private static String urlEncode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
