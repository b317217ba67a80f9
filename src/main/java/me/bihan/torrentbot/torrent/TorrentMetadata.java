package me.bihan.torrentbot.torrent;

import lombok.Builder;
import lombok.Value;

/**
 * Identifying fields read from a .torrent file before it is relayed.
 */
@Value
@Builder
public class TorrentMetadata {

    String name;
    String infoHash;
    long totalLength;
}
