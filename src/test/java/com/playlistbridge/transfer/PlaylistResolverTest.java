package com.playlistbridge.transfer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlaylistResolverTest {

    private FakeTargetPlatform target;
    private PlaylistResolver resolver;

    @BeforeEach
    void setUp() {
        target = new FakeTargetPlatform();
        RequestPacer pacer = new RequestPacer(new RecordingSleeper(), 0, 0, 0);
        resolver = new PlaylistResolver(target, new RetryPolicy(3, 0, pacer));
    }

    @Test
    @DisplayName("Second playlist with the same name reuses the first one's target")
    void sameNameResolvesToSameTarget() throws Exception {
        PlaylistResolver.Resolution first = resolver.resolveOrCreate("Favorites", "d");
        PlaylistResolver.Resolution second = resolver.resolveOrCreate("Favorites", "d");

        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals(first.targetPlaylistId(), second.targetPlaylistId());
        assertEquals(1, target.createCalls);
        assertEquals(1, target.listPlaylistsCalls);
    }

    @Test
    void existingTargetPlaylistIsReused() throws Exception {
        String existing = target.existingPlaylist("Road Trip", "t-1");

        assertEquals(existing, resolver.findExisting("Road Trip").orElseThrow());
        PlaylistResolver.Resolution resolution = resolver.resolveOrCreate("Road Trip", "d");

        assertFalse(resolution.created());
        assertEquals(existing, resolution.targetPlaylistId());
        assertEquals(0, target.createCalls);
    }

    @Test
    @DisplayName("Names match exactly and case-sensitively")
    void namesAreCaseSensitive() throws Exception {
        target.existingPlaylist("chill");

        assertTrue(resolver.findExisting("Chill").isEmpty());
        assertTrue(resolver.resolveOrCreate("Chill", "d").created());
    }

    @Test
    void listingIsFetchedOnce() throws Exception {
        resolver.findExisting("a");
        resolver.findExisting("b");
        resolver.resolveOrCreate("c", "d");

        assertEquals(1, target.listPlaylistsCalls);
    }
}
