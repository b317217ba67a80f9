package me.bihan.torrentbot.chat;

import lombok.Builder;
import lombok.Value;

/**
 * Transport-neutral view of an incoming chat message.
 */
@Value
@Builder
public class InboundMessage {

    /** Sender identity, null when the chat provider reports no sender */
    Long senderId;
    long chatId;
    String text;
    Attachment attachment;

    public boolean hasAttachment() {
        return attachment != null;
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }
}
