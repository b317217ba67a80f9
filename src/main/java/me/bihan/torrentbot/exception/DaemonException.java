package me.bihan.torrentbot.exception;

/**
 * A call to the torrent daemon did not succeed.
 */
public class DaemonException extends TorrentBotException {

    public DaemonException(String message) {
        super(message);
    }

    public DaemonException(String message, Throwable cause) {
        super(message, cause);
    }
}
