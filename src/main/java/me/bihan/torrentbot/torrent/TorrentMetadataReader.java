package me.bihan.torrentbot.torrent;

import com.dampcake.bencode.Bencode;
import com.dampcake.bencode.Type;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the display name and info hash of an uploaded .torrent file.
 * The daemon is the judge of validity: a file this reader cannot parse is still relayed.
 */
@Log4j2
public class TorrentMetadataReader {

    public Optional<TorrentMetadata> read(byte[] data) {
        if (data == null || data.length == 0) {
            return Optional.empty();
        }
        try {
            Bencode bencode = new Bencode(true);
            Map<String, Object> torrentMap = bencode.decode(data, Type.DICTIONARY);

            Object infoObj = torrentMap.get("info");
            if (!(infoObj instanceof Map)) {
                log.debug("Torrent data has no info dictionary");
                return Optional.empty();
            }

            @SuppressWarnings("unchecked")
            Map<String, Object> info = (Map<String, Object>) infoObj;
            String infoHash = DigestUtils.sha1Hex(bencode.encode(info));

            TorrentMetadata metadata = TorrentMetadata.builder()
                    .name(asString(info.get("name")))
                    .infoHash(infoHash)
                    .totalLength(totalLength(info))
                    .build();

            log.debug("Read torrent metadata: name={}, infoHash={}", metadata.getName(), infoHash);
            return Optional.of(metadata);
        } catch (RuntimeException e) {
            log.debug("Could not parse torrent data: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static long totalLength(Map<String, Object> info) {
        Object length = info.get("length");
        if (length instanceof Number) {
            return ((Number) length).longValue();
        }
        Object files = info.get("files");
        if (files instanceof List) {
            long total = 0;
            for (Object file : (List<?>) files) {
                if (file instanceof Map) {
                    Object fileLength = ((Map<?, ?>) file).get("length");
                    if (fileLength instanceof Number) {
                        total += ((Number) fileLength).longValue();
                    }
                }
            }
            return total;
        }
        return 0;
    }

    private static String asString(Object value) {
        if (value instanceof String) {
            return (String) value;
        } else if (value instanceof ByteBuffer) {
            ByteBuffer buffer = ((ByteBuffer) value).duplicate();
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return null;
    }
}
