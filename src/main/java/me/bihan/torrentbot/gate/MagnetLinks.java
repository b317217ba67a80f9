package me.bihan.torrentbot.gate;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Helpers for magnet URIs.
 */
public final class MagnetLinks {

    private MagnetLinks() {
    }

    /**
     * Returns the decoded {@code dn} (display name) parameter of a magnet link, if present.
     */
    public static Optional<String> displayName(String magnet) {
        if (magnet == null || !magnet.startsWith(AccessGate.MAGNET_PREFIX)) {
            return Optional.empty();
        }
        String query = magnet.substring(AccessGate.MAGNET_PREFIX.length());
        for (String parameter : query.split("&")) {
            if (parameter.startsWith("dn=")) {
                try {
                    String name = URLDecoder.decode(parameter.substring(3), StandardCharsets.UTF_8).trim();
                    return name.isEmpty() ? Optional.empty() : Optional.of(name);
                } catch (IllegalArgumentException e) {
                    // malformed escape, fall back to the raw value
                    return Optional.of(parameter.substring(3));
                }
            }
        }
        return Optional.empty();
    }
}
