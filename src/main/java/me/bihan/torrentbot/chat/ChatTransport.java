package me.bihan.torrentbot.chat;

import me.bihan.torrentbot.exception.FetchException;

import java.io.IOException;
import java.util.List;

/**
 * Chat provider operations the bot depends on.
 */
public interface ChatTransport {

    /**
     * Long-polls for updates with an id of at least {@code offset}.
     * Passing an offset also confirms every earlier update.
     */
    List<ChatUpdate> pollUpdates(long offset, int timeoutSeconds) throws IOException;

    /**
     * Sends a plain-text message to a chat.
     */
    void sendText(long chatId, String text) throws IOException;

    /**
     * Downloads the bytes behind an attachment reference.
     */
    byte[] fetchAttachment(String fileRef) throws FetchException;
}
