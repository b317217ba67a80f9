package me.bihan.torrentbot.gate;

import lombok.RequiredArgsConstructor;
import me.bihan.torrentbot.chat.InboundMessage;

/**
 * Authorizes and classifies inbound messages. Holds no per-message state.
 */
@RequiredArgsConstructor
public class AccessGate {

    public static final String MAGNET_PREFIX = "magnet:?";

    private final AllowList allowList;
    private final String shutdownPhrase;

    public MessageKind classify(InboundMessage message) {
        if (message == null || !allowList.isAllowed(message.getSenderId())) {
            return MessageKind.REJECTED;
        }
        if (message.hasAttachment()) {
            return MessageKind.TORRENT_FILE;
        }
        if (!message.hasText()) {
            return MessageKind.IGNORED;
        }

        String text = message.getText();
        if (isShutdownCommand(text)) {
            return MessageKind.SHUTDOWN_COMMAND;
        }
        if (text.startsWith(MAGNET_PREFIX)) {
            return MessageKind.MAGNET_LINK;
        }
        return MessageKind.IGNORED;
    }

    private boolean isShutdownCommand(String text) {
        return shutdownPhrase != null && !shutdownPhrase.isBlank() && shutdownPhrase.equals(text.trim());
    }
}
