package me.bihan.torrentbot.daemon;

import me.bihan.torrentbot.exception.InvalidEndpointException;

/**
 * Creates a fresh, unauthenticated daemon client for one ingestion attempt.
 */
@FunctionalInterface
public interface DaemonClientFactory {

    DaemonClient create() throws InvalidEndpointException;
}
