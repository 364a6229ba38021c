package com.playlistbridge.tidal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.playlistbridge.auth.AuthSession;
import com.playlistbridge.auth.TokenRefresher;
import com.playlistbridge.platform.PlatformException;
import com.playlistbridge.platform.TransientPlatformException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Refresh-token grant against the TIDAL auth server.
 */
public class TidalTokenRefresher implements TokenRefresher {

    private static final String DEFAULT_TOKEN_URL = "https://auth.tidal.com/v1/oauth2/token";

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final String clientId;
    private final String clientSecret;
    private final String tokenUrl;

    public TidalTokenRefresher(HttpClient http, ObjectMapper mapper, String clientId, String clientSecret) {
        this(http, mapper, clientId, clientSecret, DEFAULT_TOKEN_URL);
    }

    public TidalTokenRefresher(HttpClient http, ObjectMapper mapper, String clientId, String clientSecret, String tokenUrl) {
        this.http = http;
        this.mapper = mapper;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.tokenUrl = (tokenUrl == null || tokenUrl.isBlank()) ? DEFAULT_TOKEN_URL : tokenUrl.trim();
    }

    @Override
    public RefreshedToken refresh(AuthSession session) throws PlatformException, InterruptedException {
        if (clientId == null || clientId.isBlank()) {
            throw new PlatformException("TIDAL_CLIENT_ID is required to refresh the TIDAL token");
        }
        StringBuilder body = new StringBuilder()
                .append("grant_type=refresh_token")
                .append("&refresh_token=").append(urlEncode(session.getRefreshToken()))
                .append("&client_id=").append(urlEncode(clientId))
                .append("&scope=").append(urlEncode("r_usr w_usr"));
        if (clientSecret != null && !clientSecret.isBlank()) {
            body.append("&client_secret=").append(urlEncode(clientSecret));
        }
        HttpRequest req = HttpRequest.newBuilder(URI.create(tokenUrl))
                .timeout(Duration.ofSeconds(10))
                .header("Accept", "application/json")
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransientPlatformException("TIDAL token refresh failed: " + e.getMessage(), e);
        }
        if (resp.statusCode() != 200) {
            throw new PlatformException("TIDAL token refresh returned HTTP " + resp.statusCode());
        }
        try {
            JsonNode root = mapper.readTree(resp.body());
            String accessToken = root.path("access_token").asText(null);
            String refreshToken = root.path("refresh_token").asText(null);
            long expiresIn = root.path("expires_in").asLong(3600);
            return new RefreshedToken(accessToken, refreshToken, expiresIn);
        } catch (IOException e) {
            throw new PlatformException("TIDAL token refresh returned malformed JSON", e);
        }
    }

    private static String urlEncode(String s) {
        return URLEncoder.encode(s == null ? "" : s, StandardCharsets.UTF_8);
    }
}
