package me.bihan.torrentbot.exception;

/**
 * Missing or unusable settings detected at startup.
 * Also raised when the daemon endpoint cannot be discovered.
 */
public class ConfigurationException extends TorrentBotException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
