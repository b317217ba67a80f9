package me.bihan.torrentbot.gate;

/**
 * Terminal state of handling one inbound message.
 * Only ENQUEUED, FAILED and SHUTDOWN_REQUESTED produce a reply.
 */
public enum IngestionOutcome {
    ENQUEUED,
    FAILED,
    SHUTDOWN_REQUESTED,
    IGNORED,
    REJECTED
}
