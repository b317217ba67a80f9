package me.bihan.torrentbot.exception;

/**
 * Retrieving an attachment from the chat provider failed.
 */
public class FetchException extends TorrentBotException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
