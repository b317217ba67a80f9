package me.bihan.torrentbot.gate;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import me.bihan.torrentbot.chat.ChatTransport;
import me.bihan.torrentbot.chat.InboundMessage;
import me.bihan.torrentbot.daemon.DaemonClient;
import me.bihan.torrentbot.daemon.DaemonClientFactory;
import me.bihan.torrentbot.daemon.TorrentSource;
import me.bihan.torrentbot.exception.DaemonException;
import me.bihan.torrentbot.exception.FetchException;
import me.bihan.torrentbot.exception.TorrentBotException;
import me.bihan.torrentbot.lifecycle.ShutdownSignal;
import me.bihan.torrentbot.torrent.TorrentMetadata;
import me.bihan.torrentbot.torrent.TorrentMetadataReader;
import me.bihan.torrentbot.util.FormatUtils;

import java.io.IOException;
import java.util.Optional;

/**
 * Handles one inbound message end to end: authorize, classify, fetch the attachment if any,
 * log in to the daemon, submit, and reply.
 * Every failure ends in {@link IngestionOutcome#FAILED}; details go to the log, the chat
 * only sees the generic failure text.
 */
@Log4j2
@RequiredArgsConstructor
public class IngestionDispatcher {

    private final AccessGate accessGate;
    private final ChatTransport chatTransport;
    private final DaemonClientFactory daemonClientFactory;
    private final String daemonUsername;
    private final String daemonPassword;
    private final ShutdownSignal shutdownSignal;
    private final TorrentMetadataReader metadataReader;

    public IngestionOutcome handle(InboundMessage message) {
        MessageKind kind = accessGate.classify(message);
        switch (kind) {
            case REJECTED:
                log.debug("Dropping message from unauthorized sender {}", message != null ? message.getSenderId() : null);
                return IngestionOutcome.REJECTED;
            case IGNORED:
                log.trace("Ignoring message in chat {}", message.getChatId());
                return IngestionOutcome.IGNORED;
            case SHUTDOWN_COMMAND:
                log.info("Shutdown command received from user {}", message.getSenderId());
                shutdownSignal.requestShutdown();
                reply(message, ReplyMessages.SHUTTING_DOWN);
                return IngestionOutcome.SHUTDOWN_REQUESTED;
            case MAGNET_LINK:
                return ingestMagnet(message);
            case TORRENT_FILE:
                return ingestFile(message);
            default:
                throw new IllegalStateException("Unhandled message kind: " + kind);
        }
    }

    private IngestionOutcome ingestMagnet(InboundMessage message) {
        String magnet = message.getText();
        String name = MagnetLinks.displayName(magnet).orElse(null);
        log.info("User {} sent magnet link {}", message.getSenderId(), FormatUtils.abbreviate(magnet, 80));
        return submitAndReply(message, TorrentSource.magnet(magnet), name);
    }

    private IngestionOutcome ingestFile(InboundMessage message) {
        byte[] content;
        try {
            content = chatTransport.fetchAttachment(message.getAttachment().getFileRef());
        } catch (FetchException e) {
            log.error("Failed to fetch torrent file for chat {}: {}", message.getChatId(), e.getMessage(), e);
            reply(message, ReplyMessages.FAILED);
            return IngestionOutcome.FAILED;
        }

        log.info("Downloaded torrent file {} ({}) from user {}",
                message.getAttachment().getFileName(), FormatUtils.formatBytes(content.length), message.getSenderId());

        Optional<TorrentMetadata> metadata = metadataReader.read(content);
        metadata.ifPresent(m -> log.info("Torrent '{}' ({}) info hash {}",
                m.getName(), FormatUtils.formatBytes(m.getTotalLength()), m.getInfoHash()));

        String name = metadata.map(TorrentMetadata::getName).orElse(null);
        return submitAndReply(message, TorrentSource.file(content), name);
    }

    private IngestionOutcome submitAndReply(InboundMessage message, TorrentSource source, String torrentName) {
        try {
            submit(source);
        } catch (TorrentBotException e) {
            log.error("Failed to add {} for chat {}: {}", source.describe(), message.getChatId(), e.getMessage(), e);
            reply(message, ReplyMessages.FAILED);
            return IngestionOutcome.FAILED;
        }
        reply(message, ReplyMessages.enqueued(torrentName));
        return IngestionOutcome.ENQUEUED;
    }

    /**
     * One fresh session per ingestion: login, then submit. A failed login never reaches submit.
     */
    private void submit(TorrentSource source) throws TorrentBotException {
        DaemonClient client = daemonClientFactory.create();
        try {
            client.login(daemonUsername, daemonPassword);
            logVersion(client);
            client.submit(source);
        } finally {
            closeQuietly(client);
        }
    }

    private void logVersion(DaemonClient client) {
        try {
            log.info("Daemon application version {}", client.queryVersion());
        } catch (DaemonException e) {
            log.warn("Could not read daemon version: {}", e.getMessage());
        }
    }

    private void reply(InboundMessage message, String text) {
        try {
            chatTransport.sendText(message.getChatId(), text);
        } catch (IOException e) {
            log.error("Failed to send reply to chat {}: {}", message.getChatId(), e.getMessage(), e);
        }
    }

    private static void closeQuietly(DaemonClient client) {
        try {
            client.close();
        } catch (IOException e) {
            log.warn("Failed to close daemon session: {}", e.getMessage());
        }
    }
}
