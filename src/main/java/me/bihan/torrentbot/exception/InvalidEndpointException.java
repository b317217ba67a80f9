package me.bihan.torrentbot.exception;

/**
 * The configured daemon address is not a valid absolute http(s) URL.
 */
public class InvalidEndpointException extends TorrentBotException {

    public InvalidEndpointException(String message) {
        super(message);
    }

    public InvalidEndpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
