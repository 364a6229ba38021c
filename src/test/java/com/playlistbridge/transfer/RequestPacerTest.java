package com.playlistbridge.transfer;

import com.playlistbridge.TransferSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequestPacerTest {

    @Test
    void usesConfiguredDelays() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        RequestPacer pacer = RequestPacer.fromSettings(TransferSettings.defaults(), sleeper);

        pacer.afterSearch();
        pacer.afterBatch();
        pacer.betweenPlaylists();

        assertEquals(List.of(1500L, 3000L, 5000L), sleeper.sleeps);
    }

    @Test
    void negativeBackoffIsClamped() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        new RequestPacer(sleeper, -1, -1, -1).backoff(-5);

        assertEquals(List.of(0L), sleeper.sleeps);
    }
}
