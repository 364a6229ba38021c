package com.playlistbridge.auth;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pre-established platform login: tokens plus the account they belong to. Created outside this
 * tool and read from a token file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuthSession {

    private volatile String accessToken;
    private volatile String refreshToken;
    private volatile String userId;
    private volatile String countryCode;
    private volatile long tokenExpiresAt;

    @JsonCreator
    public AuthSession(
            @JsonProperty("accessToken") String accessToken,
            @JsonProperty("refreshToken") String refreshToken,
            @JsonProperty("userId") String userId,
            @JsonProperty("countryCode") String countryCode,
            @JsonProperty("tokenExpiresAt") long tokenExpiresAt) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.userId = userId;
        this.countryCode = countryCode;
        this.tokenExpiresAt = tokenExpiresAt;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getCountryCode() {
        return countryCode;
    }

    public long getTokenExpiresAt() {
        return tokenExpiresAt;
    }

    /**
     * Applies a refresh result. Platforms that do not rotate refresh tokens return none, in
     * which case the current one is kept.
     */
    public void update(String accessToken, String refreshToken, long tokenExpiresAt) {
        this.accessToken = accessToken;
        if (refreshToken != null && !refreshToken.isBlank()) {
            this.refreshToken = refreshToken;
        }
        this.tokenExpiresAt = tokenExpiresAt;
    }

    @JsonIgnore
    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isBlank();
    }

    @JsonIgnore
    public boolean canRefresh() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    public boolean isTokenExpired(long nowMillis) {
        return !hasAccessToken() || nowMillis >= tokenExpiresAt;
    }

    @JsonIgnore
    public boolean isTokenExpired() {
        return isTokenExpired(System.currentTimeMillis());
    }
}
