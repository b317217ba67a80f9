package me.bihan.torrentbot.gate;

/**
 * What the access gate decided an inbound message is.
 */
public enum MessageKind {
    /** Sender is missing or not on the allow-list */
    REJECTED,
    /** Text equal to the configured shutdown phrase */
    SHUTDOWN_COMMAND,
    /** Document attachment, to be fetched and relayed as a .torrent file */
    TORRENT_FILE,
    /** Text starting with the magnet prefix */
    MAGNET_LINK,
    /** Anything else from an allowed sender */
    IGNORED
}
