package me.bihan.torrentbot.config;

import lombok.extern.log4j.Log4j2;
import me.bihan.torrentbot.daemon.QBittorrentClient;
import me.bihan.torrentbot.exception.ConfigurationException;
import me.bihan.torrentbot.exception.InvalidEndpointException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Works out the daemon base URL. An explicit URL always wins; without one, a bot running
 * in a container assumes the daemon listens on the container's default gateway.
 */
@Log4j2
public class DaemonEndpointResolver {

    private static final String DEFAULT_ROUTE_DESTINATION = "00000000";

    private final Path filesystemRoot;

    public DaemonEndpointResolver() {
        this(Path.of("/"));
    }

    /**
     * @param filesystemRoot directory standing in for "/" when looking up container markers and the route table
     */
    public DaemonEndpointResolver(Path filesystemRoot) {
        this.filesystemRoot = filesystemRoot;
    }

    public String resolve(String configuredUrl, int daemonPort) throws ConfigurationException, InvalidEndpointException {
        if (configuredUrl != null && !configuredUrl.isBlank()) {
            return QBittorrentClient.parseEndpoint(configuredUrl).toString();
        }

        if (!isRunningInContainer()) {
            throw new ConfigurationException("Daemon URL is not configured and the bot is not running in a container");
        }

        String gateway = findDefaultGateway()
                .orElseThrow(() -> new ConfigurationException("Could not discover the default gateway from the route table"));
        String url = "http://" + gateway + ":" + daemonPort;
        log.info("Discovered daemon at default gateway {}", url);
        return QBittorrentClient.parseEndpoint(url).toString();
    }

    boolean isRunningInContainer() {
        return Files.exists(filesystemRoot.resolve(".dockerenv"))
                || Files.exists(filesystemRoot.resolve("run/.containerenv"));
    }

    Optional<String> findDefaultGateway() throws ConfigurationException {
        Path routeTable = filesystemRoot.resolve("proc/net/route");
        List<String> lines;
        try {
            lines = Files.readAllLines(routeTable, StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read route table " + routeTable + ": " + e.getMessage(), e);
        }

        // Iface Destination Gateway Flags ...; first line is the header
        for (String line : lines.subList(Math.min(1, lines.size()), lines.size())) {
            String[] columns = line.trim().split("\\s+");
            if (columns.length < 3 || !DEFAULT_ROUTE_DESTINATION.equals(columns[1])) {
                continue;
            }
            try {
                return Optional.of(decodeGateway(columns[2]));
            } catch (NumberFormatException e) {
                log.warn("Skipping unreadable gateway '{}' on interface {}", columns[2], columns[0]);
            }
        }
        return Optional.empty();
    }

    /**
     * The route table stores IPv4 addresses as little-endian hex.
     */
    static String decodeGateway(String hex) {
        long value = Long.parseLong(hex, 16);
        return (value & 0xFF) + "."
                + ((value >> 8) & 0xFF) + "."
                + ((value >> 16) & 0xFF) + "."
                + ((value >> 24) & 0xFF);
    }
}
