package me.bihan.torrentbot.cli;

import lombok.Getter;
import me.bihan.torrentbot.exception.ConfigurationException;
import me.bihan.torrentbot.telegram.TelegramBotClient;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command definition for the relay bot using PicoCLI.
 * Every setting can also come from a BITTORRENT_BOT_* environment variable.
 */
@Command(
    name = "torrent-relay-bot",
    mixinStandardHelpOptions = true,
    version = "Torrent Relay Bot 1.0.0",
    description = "Relays magnet links and .torrent files sent by allowed chat users to a qBittorrent daemon.",
    descriptionHeading = "%nDescription:%n%n",
    optionListHeading = "%nOptions:%n",
    footerHeading = "%nExamples:%n",
    footer = {
        "  # Explicit daemon URL:",
        "  java -jar torrent-relay-bot.jar --bot-token 123:abc --user-id 42 \\",
        "       --username admin --password secret --url http://nas.local:8080",
        "",
        "  # Inside a container, settings from the environment and the daemon on the gateway:",
        "  BITTORRENT_BOT_BOT_TOKEN=123:abc BITTORRENT_BOT_USER_ID=42,43 \\",
        "  BITTORRENT_BOT_USERNAME=admin BITTORRENT_BOT_PASSWORD=secret java -jar torrent-relay-bot.jar",
        ""
    }
)
@Getter
public class TorrentBotCommand implements Callable<Integer> {

    @Option(
        names = {"--bot-token"},
        paramLabel = "<token>",
        description = "Chat bot token (env: BITTORRENT_BOT_BOT_TOKEN)",
        defaultValue = "${env:BITTORRENT_BOT_BOT_TOKEN}"
    )
    private String botToken;

    @Option(
        names = {"--user-id"},
        paramLabel = "<ids>",
        description = "Comma-separated ids of users allowed to add torrents (env: BITTORRENT_BOT_USER_ID)",
        defaultValue = "${env:BITTORRENT_BOT_USER_ID}"
    )
    private String userIds;

    @Option(
        names = {"--username"},
        paramLabel = "<username>",
        description = "Daemon Web UI user (env: BITTORRENT_BOT_USERNAME)",
        defaultValue = "${env:BITTORRENT_BOT_USERNAME}"
    )
    private String daemonUsername;

    @Option(
        names = {"--password"},
        paramLabel = "<password>",
        description = "Daemon Web UI password (env: BITTORRENT_BOT_PASSWORD)",
        defaultValue = "${env:BITTORRENT_BOT_PASSWORD}"
    )
    private String daemonPassword;

    @Option(
        names = {"--url"},
        paramLabel = "<url>",
        description = "Daemon base URL; discovered from the default gateway inside a container when omitted (env: BITTORRENT_BOT_URL)",
        defaultValue = "${env:BITTORRENT_BOT_URL}"
    )
    private String daemonUrl;

    @Option(
        names = {"--daemon-port"},
        paramLabel = "<port>",
        description = "Daemon port used with gateway discovery (default: ${DEFAULT-VALUE})",
        defaultValue = "${env:BITTORRENT_BOT_DAEMON_PORT:-8080}"
    )
    private int daemonPort;

    @Option(
        names = {"--shutdown-phrase"},
        paramLabel = "<text>",
        description = "Message text that stops the bot (default: ${DEFAULT-VALUE})",
        defaultValue = "${env:BITTORRENT_BOT_SHUTDOWN_PHRASE:-/shutdown}"
    )
    private String shutdownPhrase;

    @Option(
        names = {"--telegram-api"},
        paramLabel = "<url>",
        description = "Bot API base URL (default: ${DEFAULT-VALUE})",
        defaultValue = TelegramBotClient.DEFAULT_API_URL
    )
    private String telegramApiUrl;

    @Option(
        names = {"--poll-timeout"},
        paramLabel = "<seconds>",
        description = "Long-poll timeout in seconds (default: ${DEFAULT-VALUE})",
        defaultValue = "30"
    )
    private int pollTimeoutSeconds;

    @Option(
        names = {"--request-timeout"},
        paramLabel = "<seconds>",
        description = "Timeout for each HTTP call in seconds (default: ${DEFAULT-VALUE})",
        defaultValue = "30"
    )
    private int requestTimeoutSeconds;

    @Option(
        names = {"-w", "--workers"},
        paramLabel = "<count>",
        description = "Messages handled in parallel (default: ${DEFAULT-VALUE})",
        defaultValue = "4"
    )
    private int workers;

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose logging output"
    )
    private boolean verbose;

    @Override
    public Integer call() throws Exception {
        // The actual business logic is run by the main application
        return 0;
    }

    /**
     * Validates the parsed settings.
     * @throws ConfigurationException listing every missing or out-of-range setting
     */
    public void validateArguments() throws ConfigurationException {
        List<String> problems = new ArrayList<>();

        requireValue(botToken, "--bot-token / BITTORRENT_BOT_BOT_TOKEN", problems);
        requireValue(userIds, "--user-id / BITTORRENT_BOT_USER_ID", problems);
        requireValue(daemonUsername, "--username / BITTORRENT_BOT_USERNAME", problems);
        requireValue(daemonPassword, "--password / BITTORRENT_BOT_PASSWORD", problems);

        if (daemonPort < 1 || daemonPort > 65535) {
            problems.add("daemon port must be between 1 and 65535");
        }
        if (pollTimeoutSeconds < 0 || pollTimeoutSeconds > 300) {
            problems.add("poll timeout must be between 0 and 300 seconds");
        }
        if (requestTimeoutSeconds < 1 || requestTimeoutSeconds > 600) {
            problems.add("request timeout must be between 1 and 600 seconds");
        }
        if (workers < 1 || workers > 64) {
            problems.add("workers must be between 1 and 64");
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", problems));
        }
    }

    private static void requireValue(String value, String name, List<String> problems) {
        if (value == null || value.isBlank()) {
            problems.add("missing " + name);
        }
    }
}
