package me.bihan.torrentbot.exception;

import lombok.Getter;

/**
 * The add-torrent call returned a non-success status or a body other than {@code Ok.}.
 */
@Getter
public class SubmissionRejectedException extends DaemonException {

    /** HTTP status of the rejected call, or -1 when no response was received */
    private final int statusCode;

    /** Response text as sent by the daemon, or null when no response was received */
    private final String responseBody;

    public SubmissionRejectedException(int statusCode, String responseBody) {
        super("Daemon rejected torrent (status " + statusCode + "): " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public SubmissionRejectedException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.responseBody = null;
    }
}
