package me.bihan.torrentbot;

import me.bihan.torrentbot.config.TorrentBotConfig;
import me.bihan.torrentbot.lifecycle.UpdatePoller;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertTrue;

class TorrentBotApplicationTest {

    @Test
    void shutdownGracePeriodCoversPollAndWorkerDrain() {
        TorrentBotConfig config = TorrentBotConfig.builder()
                .pollTimeoutSeconds(30)
                .requestTimeout(Duration.ofSeconds(30))
                .workers(4)
                .build();

        Duration grace = TorrentBotApplication.shutdownGracePeriod(config);

        Duration needed = Duration.ofSeconds(30).plus(Duration.ofSeconds(30)).plus(UpdatePoller.WORKER_DRAIN_TIMEOUT);
        assertTrue(grace.compareTo(needed) > 0, "grace period " + grace + " must exceed " + needed);
    }
}
