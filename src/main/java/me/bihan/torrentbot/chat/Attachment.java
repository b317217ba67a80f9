package me.bihan.torrentbot.chat;

import lombok.Value;

/**
 * Document attached to a message. The file reference is opaque and only meaningful
 * to the transport that produced it.
 */
@Value
public class Attachment {

    String fileRef;
    String fileName;
}
