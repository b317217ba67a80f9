package me.bihan.torrentbot;

import lombok.extern.log4j.Log4j2;
import me.bihan.torrentbot.cli.TorrentBotCommand;
import me.bihan.torrentbot.config.DaemonEndpointResolver;
import me.bihan.torrentbot.config.TorrentBotConfig;
import me.bihan.torrentbot.exception.TorrentBotException;
import me.bihan.torrentbot.lifecycle.ShutdownSignal;
import me.bihan.torrentbot.lifecycle.UpdatePoller;
import me.bihan.torrentbot.telegram.TelegramBotClient;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

import java.io.IOException;
import java.time.Duration;

/**
 * Torrent relay bot application.
 * Polls the chat for messages from allowed users and relays magnet links and
 * .torrent files to a qBittorrent daemon until the shutdown command arrives.
 */
@Log4j2
public class TorrentBotApplication {

    public static void main(String[] args) {
        // Parse command line arguments with picocli
        TorrentBotCommand command = new TorrentBotCommand();
        CommandLine commandLine = new CommandLine(command);

        try {
            commandLine.parseArgs(args);

            if (commandLine.isUsageHelpRequested()) {
                commandLine.usage(System.out);
                System.exit(0);
            }

            if (commandLine.isVersionHelpRequested()) {
                commandLine.printVersionHelp(System.out);
                System.exit(0);
            }

            command.validateArguments();

            if (command.isVerbose()) {
                Configurator.setRootLevel(Level.DEBUG);
                log.debug("Verbose logging enabled");
            }

            String daemonUrl = new DaemonEndpointResolver().resolve(command.getDaemonUrl(), command.getDaemonPort());

            log.info("=== Torrent Relay Bot Starting ===");
            log.info("Daemon: {}", daemonUrl);
            log.info("Workers: {}", command.getWorkers());

            TorrentBotConfig config = TorrentBotConfig.builder()
                    .botToken(command.getBotToken())
                    .telegramApiUrl(command.getTelegramApiUrl())
                    .allowedUserIds(command.getUserIds())
                    .daemonUrl(daemonUrl)
                    .daemonUsername(command.getDaemonUsername())
                    .daemonPassword(command.getDaemonPassword())
                    .shutdownPhrase(command.getShutdownPhrase())
                    .pollTimeoutSeconds(command.getPollTimeoutSeconds())
                    .requestTimeout(Duration.ofSeconds(command.getRequestTimeoutSeconds()))
                    .workers(command.getWorkers())
                    .build();

            run(config);

            log.info("=== Torrent Relay Bot Finished ===");
            System.exit(0);

        } catch (CommandLine.ParameterException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            commandLine.usage(System.err);
            System.exit(2);
        } catch (TorrentBotException e) {
            log.error("Startup failed: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            log.error("Application error: {}", e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void run(TorrentBotConfig config) throws IOException, InterruptedException {
        ShutdownSignal shutdownSignal = new ShutdownSignal();

        try (TelegramBotClient telegram = config.createTelegramBotClient()) {
            UpdatePoller poller = config.createUpdatePoller(telegram, shutdownSignal);
            Thread pollerThread = new Thread(poller, "update-poller");

            // Setup shutdown hook for graceful cleanup
            Thread hook = new Thread(() -> {
                shutdownSignal.requestShutdown();
                try {
                    pollerThread.join(shutdownGracePeriod(config).toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);

            pollerThread.start();
            pollerThread.join();

            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // JVM is already shutting down
                log.debug("Shutdown in progress, hook stays registered");
            }
        }
    }

    /**
     * Upper bound for the poller to stop: the current long poll, the confirming poll, then the worker drain.
     */
    static Duration shutdownGracePeriod(TorrentBotConfig config) {
        return Duration.ofSeconds(config.getPollTimeoutSeconds())
                .plus(config.getRequestTimeout())
                .plus(UpdatePoller.WORKER_DRAIN_TIMEOUT)
                .plusSeconds(10);
    }
}
