package com.playlistbridge.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

public enum PlaylistStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("in_progress") IN_PROGRESS,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed") FAILED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
