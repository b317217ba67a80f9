package me.bihan.torrentbot.cli;

import me.bihan.torrentbot.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TorrentBotCommandTest {

    @Test
    void parsesAllSettings() {
        TorrentBotCommand command = parse(
                "--bot-token", "123:abc",
                "--user-id", "42,43",
                "--username", "admin",
                "--password", "secret",
                "--url", "http://nas.local:8080",
                "--shutdown-phrase", "stop now",
                "--workers", "2",
                "-v");

        assertDoesNotThrow(command::validateArguments);
        assertEquals("123:abc", command.getBotToken());
        assertEquals("42,43", command.getUserIds());
        assertEquals("admin", command.getDaemonUsername());
        assertEquals("secret", command.getDaemonPassword());
        assertEquals("http://nas.local:8080", command.getDaemonUrl());
        assertEquals("stop now", command.getShutdownPhrase());
        assertEquals(2, command.getWorkers());
        assertTrue(command.isVerbose());
    }

    @Test
    void appliesDefaults() {
        TorrentBotCommand command = parse(
                "--bot-token", "123:abc", "--user-id", "42", "--username", "admin", "--password", "secret");

        assertEquals(30, command.getPollTimeoutSeconds());
        assertEquals(30, command.getRequestTimeoutSeconds());
        assertEquals(4, command.getWorkers());
        assertEquals("https://api.telegram.org", command.getTelegramApiUrl());
    }

    @Test
    void missingRequiredSettingsAreReportedTogether() {
        TorrentBotCommand command = parse("--bot-token", "123:abc", "--username", "", "--password", "secret");

        ConfigurationException e = assertThrows(ConfigurationException.class, command::validateArguments);
        assertTrue(e.getMessage().contains("--username"), e.getMessage());
    }

    @Test
    void outOfRangeValuesAreRejected() {
        TorrentBotCommand command = parse(
                "--bot-token", "123:abc", "--user-id", "42", "--username", "admin", "--password", "secret",
                "--workers", "0");

        ConfigurationException e = assertThrows(ConfigurationException.class, command::validateArguments);
        assertTrue(e.getMessage().contains("workers"), e.getMessage());
    }

    private static TorrentBotCommand parse(String... args) {
        TorrentBotCommand command = new TorrentBotCommand();
        new CommandLine(command).parseArgs(args);
        return command;
    }
}
