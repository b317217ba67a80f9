package me.bihan.torrentbot.exception;

/**
 * Base type for every failure the relay bot reports.
 */
public class TorrentBotException extends Exception {

    public TorrentBotException(String message) {
        super(message);
    }

    public TorrentBotException(String message, Throwable cause) {
        super(message, cause);
    }
}
