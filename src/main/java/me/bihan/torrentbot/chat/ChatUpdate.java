package me.bihan.torrentbot.chat;

import lombok.Value;

/**
 * One polled update. The message is null for update kinds the bot does not handle.
 */
@Value
public class ChatUpdate {

    long updateId;
    InboundMessage message;
}
