package me.bihan.torrentbot.daemon;

import me.bihan.torrentbot.exception.AuthenticationFailedException;
import me.bihan.torrentbot.exception.DaemonException;

import java.io.Closeable;

/**
 * Session with one torrent daemon endpoint.
 * A client starts unauthenticated; {@link #login} must succeed before anything is submitted.
 */
public interface DaemonClient extends Closeable {

    /**
     * Authenticates against the daemon. On success the session cookie is kept by this
     * client and sent with every later request.
     *
     * @throws AuthenticationFailedException if the daemon refuses the credentials or cannot be reached
     */
    void login(String username, String password) throws AuthenticationFailedException;

    /**
     * Adds a torrent to the daemon's queue.
     *
     * @throws AuthenticationFailedException if called before a successful login
     * @throws me.bihan.torrentbot.exception.SubmissionRejectedException if the daemon does not answer {@code Ok.}
     */
    void submit(TorrentSource source) throws DaemonException;

    /**
     * Reads the daemon's application version. Diagnostic only.
     */
    String queryVersion() throws DaemonException;

    /**
     * Returns the base endpoint this client talks to.
     */
    String getBaseUrl();

    boolean isAuthenticated();
}
