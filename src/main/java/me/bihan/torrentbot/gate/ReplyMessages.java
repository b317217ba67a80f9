package me.bihan.torrentbot.gate;

/**
 * User-facing reply texts. Never include daemon addresses, credentials or daemon responses here.
 */
public final class ReplyMessages {

    public static final String ENQUEUED = "✅ Torrent added to the queue";
    public static final String ENQUEUED_NAMED = "✅ Torrent %s added to the queue";
    public static final String FAILED = "⛔ Failed to add torrent, see logs";
    public static final String SHUTTING_DOWN = "Shutting down";

    private ReplyMessages() {
    }

    public static String enqueued(String torrentName) {
        if (torrentName == null || torrentName.isBlank()) {
            return ENQUEUED;
        }
        return String.format(ENQUEUED_NAMED, torrentName);
    }
}
