package me.bihan.torrentbot.daemon;

import lombok.Value;

/**
 * Status and text body of one daemon call.
 */
@Value
class DaemonResponse {

    int statusCode;
    String body;

    boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
