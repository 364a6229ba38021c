package com.playlistbridge.platform;

public record TargetPlaylist(String id, String name, int trackCount) {}
