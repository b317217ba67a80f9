package me.bihan.torrentbot.exception;

/**
 * Login was refused, the daemon was unreachable during login,
 * or a request needing a session was made without one.
 */
public class AuthenticationFailedException extends DaemonException {

    public AuthenticationFailedException(String message) {
        super(message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
