package me.bihan.torrentbot.config;

import lombok.Builder;
import lombok.Getter;
import me.bihan.torrentbot.chat.ChatTransport;
import me.bihan.torrentbot.daemon.DaemonClientFactory;
import me.bihan.torrentbot.daemon.QBittorrentClient;
import me.bihan.torrentbot.gate.AccessGate;
import me.bihan.torrentbot.gate.AllowList;
import me.bihan.torrentbot.gate.IngestionDispatcher;
import me.bihan.torrentbot.lifecycle.ShutdownSignal;
import me.bihan.torrentbot.lifecycle.UpdatePoller;
import me.bihan.torrentbot.telegram.TelegramBotClient;
import me.bihan.torrentbot.torrent.TorrentMetadataReader;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolved settings plus the wiring of the bot's collaborators.
 * Implements manual dependency injection; nothing here talks to the network.
 */
@Getter
@Builder
public class TorrentBotConfig {

    private static final Duration POLL_ERROR_BACKOFF = Duration.ofSeconds(5);

    private final String botToken;
    private final String telegramApiUrl;
    private final String allowedUserIds;
    private final String daemonUrl;
    private final String daemonUsername;
    private final String daemonPassword;
    private final String shutdownPhrase;
    private final int pollTimeoutSeconds;
    private final Duration requestTimeout;
    private final int workers;

    /** Creates the allow-list; malformed ids are logged and dropped. */
    public AllowList createAllowList() {
        return AllowList.parse(allowedUserIds);
    }

    /** Creates a factory producing one fresh daemon session per ingestion. */
    public DaemonClientFactory createDaemonClientFactory() {
        return () -> new QBittorrentClient(daemonUrl, requestTimeout);
    }

    /** Creates the chat transport. */
    public TelegramBotClient createTelegramBotClient() {
        return new TelegramBotClient(telegramApiUrl, botToken, requestTimeout, pollTimeoutSeconds);
    }

    public IngestionDispatcher createIngestionDispatcher(ChatTransport chatTransport, ShutdownSignal shutdownSignal) {
        return new IngestionDispatcher(
                new AccessGate(createAllowList(), shutdownPhrase),
                chatTransport,
                createDaemonClientFactory(),
                daemonUsername,
                daemonPassword,
                shutdownSignal,
                new TorrentMetadataReader());
    }

    public UpdatePoller createUpdatePoller(ChatTransport chatTransport, ShutdownSignal shutdownSignal) {
        return new UpdatePoller(
                chatTransport,
                createIngestionDispatcher(chatTransport, shutdownSignal),
                shutdownSignal,
                createWorkerExecutor(),
                pollTimeoutSeconds,
                POLL_ERROR_BACKOFF);
    }

    private ExecutorService createWorkerExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "ingestion-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
