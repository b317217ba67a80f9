package me.bihan.torrentbot.daemon;

import lombok.Getter;
import org.apache.hc.client5.http.entity.mime.MultipartEntityBuilder;
import org.apache.hc.core5.http.ContentType;

import java.nio.charset.StandardCharsets;

/**
 * A torrent handed to the daemon: either a magnet/URL string or the bytes of a .torrent file.
 * Both variants are sent as a single part of the same multipart add-torrent request.
 */
public abstract class TorrentSource {

    public static final String URLS_PART = "urls";
    public static final String TORRENTS_PART = "torrents";
    public static final String TORRENT_FILE_NAME = "torrent.torrent";
    public static final ContentType TORRENT_CONTENT_TYPE = ContentType.create("application/x-bittorrent");

    private TorrentSource() {
    }

    public static TorrentSource magnet(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("Magnet link must not be empty");
        }
        return new MagnetSource(uri);
    }

    public static TorrentSource file(byte[] content) {
        if (content == null) {
            throw new IllegalArgumentException("Torrent file content must not be null");
        }
        return new FileSource(content);
    }

    /**
     * Name of the multipart part carrying this source.
     */
    public abstract String getPartName();

    /**
     * Short description for log output.
     */
    public abstract String describe();

    abstract void addTo(MultipartEntityBuilder builder);

    @Getter
    public static final class MagnetSource extends TorrentSource {

        private final String uri;

        private MagnetSource(String uri) {
            this.uri = uri;
        }

        @Override
        public String getPartName() {
            return URLS_PART;
        }

        @Override
        public String describe() {
            return "magnet link";
        }

        @Override
        void addTo(MultipartEntityBuilder builder) {
            // raw text, no filename so only Content-Disposition is written
            builder.addBinaryBody(URLS_PART, uri.getBytes(StandardCharsets.UTF_8));
        }
    }

    public static final class FileSource extends TorrentSource {

        private final byte[] content;

        private FileSource(byte[] content) {
            this.content = content.clone();
        }

        public byte[] getContent() {
            return content.clone();
        }

        @Override
        public String getPartName() {
            return TORRENTS_PART;
        }

        @Override
        public String describe() {
            return "torrent file (" + content.length + " bytes)";
        }

        @Override
        void addTo(MultipartEntityBuilder builder) {
            builder.addBinaryBody(TORRENTS_PART, content, TORRENT_CONTENT_TYPE, TORRENT_FILE_NAME);
        }
    }
}
