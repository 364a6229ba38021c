package com.playlistbridge.tidal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.playlistbridge.auth.AuthSession;
import com.playlistbridge.auth.ManagedSession;
import com.playlistbridge.auth.TokenRefresher;
import com.playlistbridge.platform.AddTracksResult;
import com.playlistbridge.platform.PlatformException;
import com.playlistbridge.platform.TargetPlaylist;
import com.playlistbridge.platform.TransientPlatformException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TidalApiClientTest {

    private HttpServer server;
    private String baseUrl;
    private HttpClient http;
    private TidalApiClient client;

    private final List<String> addBodies = new CopyOnWriteArrayList<>();
    private final List<String> ifNoneMatch = new CopyOnWriteArrayList<>();
    private final List<String> createBodies = new CopyOnWriteArrayList<>();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();
    private final AtomicInteger searchCalls = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/users/u1/playlists", ex -> {
            if ("POST".equalsIgnoreCase(ex.getRequestMethod())) {
                createBodies.add(body(ex));
                Json.respond(ex, 201, "{\"uuid\":\"new-pl\",\"title\":\"Created\"}");
                return;
            }
            String query = ex.getRequestURI().getRawQuery();
            if (query.contains("offset=0")) {
                Json.respond(ex, 200, """
                        {"totalNumberOfItems":3,"items":[
                          {"uuid":"pl-1","title":"Road Trip","numberOfTracks":12},
                          {"uuid":"pl-2","title":"Focus","numberOfTracks":0}
                        ]}
                        """);
            } else {
                Json.respond(ex, 200, """
                        {"totalNumberOfItems":3,"items":[{"uuid":"pl-3","title":"Road Trip","numberOfTracks":1}]}
                        """);
            }
        });
        server.createContext("/search/tracks", ex -> {
            searchCalls.incrementAndGet();
            authHeaders.add(ex.getRequestHeaders().getFirst("Authorization"));
            String query = URLDecoder.decode(ex.getRequestURI().getRawQuery(), StandardCharsets.UTF_8);
            if (query.contains("Nobody")) {
                Json.respond(ex, 200, "{\"items\":[],\"totalNumberOfItems\":0}");
            } else if (query.contains("Busy")) {
                ex.getResponseHeaders().set("Retry-After", "7");
                Json.respond(ex, 429, "{\"userMessage\":\"slow down\"}");
            } else if (query.contains("Broken")) {
                Json.respond(ex, 503, "{}");
            } else if (query.contains("Forbidden")) {
                Json.respond(ex, 403, "{}");
            } else if ("Bearer stale".equals(ex.getRequestHeaders().getFirst("Authorization"))) {
                Json.respond(ex, 401, "{}");
            } else {
                Json.respond(ex, 200, "{\"items\":[{\"id\":123456,\"title\":\"Song\"}],\"totalNumberOfItems\":1}");
            }
        });
        server.createContext("/playlists/pl-1", ex -> {
            String path = ex.getRequestURI().getPath();
            if (path.equals("/playlists/pl-1")) {
                ex.getResponseHeaders().set("ETag", "\"etag-1\"");
                Json.respond(ex, 200, "{\"uuid\":\"pl-1\"}");
                return;
            }
            if ("POST".equalsIgnoreCase(ex.getRequestMethod())) {
                ifNoneMatch.add(ex.getRequestHeaders().getFirst("If-None-Match"));
                addBodies.add(body(ex));
                Json.respond(ex, 200, "{\"lastUpdated\":1}");
                return;
            }
            String query = ex.getRequestURI().getRawQuery();
            if (query.contains("offset=0")) {
                Json.respond(ex, 200, """
                        {"totalNumberOfItems":3,"items":[
                          {"item":{"id":11},"type":"track"},
                          {"item":{"id":22},"type":"track"}
                        ]}
                        """);
            } else {
                Json.respond(ex, 200, "{\"totalNumberOfItems\":3,\"items\":[{\"item\":{\"id\":33},\"type\":\"track\"}]}");
            }
        });
        server.createContext("/playlists/pl-locked", ex -> Json.respond(ex, 412, "{}"));
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort() + "/";
        http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(3)).build();
        client = new TidalApiClient(http, new ObjectMapper(),
                ManagedSession.fixed("TIDAL", new AuthSession("tok", "refresh", "u1", "DE", Long.MAX_VALUE)),
                baseUrl);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void listsAllPlaylistPages() throws Exception {
        List<TargetPlaylist> playlists = client.listPlaylists();

        assertEquals(List.of(
                new TargetPlaylist("pl-1", "Road Trip", 12),
                new TargetPlaylist("pl-2", "Focus", 0),
                new TargetPlaylist("pl-3", "Road Trip", 1)), playlists);
    }

    @Test
    void createsPlaylistWithTitleAndDescription() throws Exception {
        String id = client.createPlaylist("Road Trip & More", "Transferred from Spotify - 3 tracks - 2024-05-01");

        assertEquals("new-pl", id);
        String form = URLDecoder.decode(createBodies.get(0), StandardCharsets.UTF_8);
        assertTrue(form.contains("title=Road Trip & More"));
        assertTrue(form.contains("description=Transferred from Spotify - 3 tracks - 2024-05-01"));
    }

    @Test
    void searchReturnsFirstHitOrEmpty() throws Exception {
        assertEquals(Optional.of("123456"), client.searchTrack("Daft Punk One More Time"));
        assertEquals(Optional.empty(), client.searchTrack("Nobody Nothing"));
        assertEquals(Optional.empty(), client.searchTrack("  "));
        assertEquals(2, searchCalls.get());
        assertEquals("Bearer tok", authHeaders.get(0));
    }

    @Test
    void addTracksSendsEtagAndIds() throws Exception {
        AddTracksResult result = client.addTracks("pl-1", List.of("11", "22"));

        assertTrue(result.isComplete());
        assertEquals(List.of("\"etag-1\""), ifNoneMatch);
        String form = URLDecoder.decode(addBodies.get(0), StandardCharsets.UTF_8);
        assertTrue(form.contains("trackIds=11,22"));
        assertTrue(form.contains("onDupes=SKIP"));
    }

    @Test
    void addingNothingMakesNoCall() throws Exception {
        assertTrue(client.addTracks("pl-1", List.of()).isComplete());
        assertTrue(addBodies.isEmpty());
    }

    @Test
    void listsPlaylistTrackIdsAcrossPages() throws Exception {
        assertEquals(Set.of("11", "22", "33"), client.listPlaylistTrackIds("pl-1"));
    }

    @Test
    void rateLimitIsTransientWithRetryAfter() {
        TransientPlatformException e = assertThrows(TransientPlatformException.class,
                () -> client.searchTrack("Busy Artist"));
        assertEquals(7000L, e.getRetryAfterMillis());
    }

    @Test
    void serverErrorsAndConflictsAreTransient() {
        assertThrows(TransientPlatformException.class, () -> client.searchTrack("Broken Song"));
        assertThrows(TransientPlatformException.class, () -> client.addTracks("pl-locked", List.of("1")));
    }

    @Test
    void clientErrorsAreNotTransient() {
        PlatformException e = assertThrows(PlatformException.class, () -> client.searchTrack("Forbidden Song"));
        assertFalse(e instanceof TransientPlatformException);
        assertTrue(e.getMessage().contains("403"));
    }

    @Test
    void unauthorizedTriggersOneRefresh() throws Exception {
        AtomicInteger refreshes = new AtomicInteger();
        TokenRefresher refresher = session -> {
            refreshes.incrementAndGet();
            return new TokenRefresher.RefreshedToken("fresh", null, 3600);
        };
        AuthSession session = new AuthSession("stale", "refresh", "u1", "DE", Long.MAX_VALUE);
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        TidalApiClient refreshing = new TidalApiClient(http, new ObjectMapper(),
                new ManagedSession("TIDAL", session, refresher, null, null, clock), baseUrl);

        assertEquals(Optional.of("123456"), refreshing.searchTrack("Daft Punk One More Time"));
        assertEquals(1, refreshes.get());
        assertEquals(List.of("Bearer stale", "Bearer fresh"), authHeaders);
        assertEquals("refresh", session.getRefreshToken());
    }

    private static String body(HttpExchange ex) throws IOException {
        return new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    private static final class Json {
        private static void respond(HttpExchange ex, int code, String body) throws IOException {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
            ex.sendResponseHeaders(code, bytes.length);
            try (var os = ex.getResponseBody()) {
                os.write(bytes);
            }
        }
    }
}
