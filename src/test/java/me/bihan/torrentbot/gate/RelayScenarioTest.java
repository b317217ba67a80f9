package me.bihan.torrentbot.gate;

import me.bihan.torrentbot.chat.Attachment;
import me.bihan.torrentbot.chat.ChatTransport;
import me.bihan.torrentbot.chat.InboundMessage;
import me.bihan.torrentbot.daemon.QBittorrentClient;
import me.bihan.torrentbot.lifecycle.ShutdownSignal;
import me.bihan.torrentbot.torrent.TorrentMetadataReader;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Runs the dispatcher against a real daemon client and a fake daemon.
 */
@ExtendWith(MockitoExtension.class)
class RelayScenarioTest {

    private static final long CHAT_ID = 7L;

    @Mock
    private ChatTransport chatTransport;

    private MockWebServer daemon;
    private IngestionDispatcher dispatcher;

    @BeforeEach
    void setUp() throws IOException {
        daemon = new MockWebServer();
        daemon.start();
        String daemonUrl = daemon.url("/").toString();
        dispatcher = new IngestionDispatcher(
                new AccessGate(AllowList.parse("42"), "/shutdown"),
                chatTransport,
                () -> new QBittorrentClient(daemonUrl, Duration.ofSeconds(5)),
                "admin",
                "adminadmin",
                new ShutdownSignal(),
                new TorrentMetadataReader());
    }

    @AfterEach
    void tearDown() throws IOException {
        daemon.shutdown();
    }

    @Test
    void allowedMagnetIsRelayedAndAcknowledged() throws Exception {
        String magnet = "magnet:?xt=urn:btih:ABC&dn=Test";
        enqueueLoginVersionAnd("Ok.");

        IngestionOutcome outcome = dispatcher.handle(message(42L, magnet, null));

        assertEquals(IngestionOutcome.ENQUEUED, outcome);
        assertEquals("/api/v2/auth/login", take().getPath());
        assertEquals("/api/v2/app/version", take().getPath());
        RecordedRequest add = take();
        assertEquals("/api/v2/torrents/add", add.getPath());
        assertTrue(add.getBody().readUtf8().contains("name=\"urls\"\r\n\r\n" + magnet + "\r\n"));
        assertEquals(3, daemon.getRequestCount());
        verify(chatTransport).sendText(CHAT_ID, "✅ Torrent Test added to the queue");
    }

    @Test
    void unknownSenderCausesNoTraffic() throws Exception {
        IngestionOutcome outcome = dispatcher.handle(message(99L, "magnet:?xt=urn:btih:ABC", null));

        assertEquals(IngestionOutcome.REJECTED, outcome);
        assertEquals(0, daemon.getRequestCount());
        verify(chatTransport, never()).sendText(anyLong(), anyString());
    }

    @Test
    void attachmentBytesReachDaemonUnchanged() throws Exception {
        byte[] content = {0x64, 0x38, 0x3a, 0x61, 0x6e, 0x6e, 0x6f};
        when(chatTransport.fetchAttachment("doc-1")).thenReturn(content);
        enqueueLoginVersionAnd("Ok.");

        IngestionOutcome outcome = dispatcher.handle(message(42L, null, new Attachment("doc-1", "a.torrent")));

        assertEquals(IngestionOutcome.ENQUEUED, outcome);
        take();
        take();
        String body = take().getBody().readString(StandardCharsets.ISO_8859_1);
        assertTrue(body.contains("name=\"torrents\"; filename=\"torrent.torrent\""), body);
        assertTrue(body.contains("Content-Type: application/x-bittorrent\r\n\r\n"
                + new String(content, StandardCharsets.ISO_8859_1) + "\r\n"), body);
        verify(chatTransport).sendText(CHAT_ID, ReplyMessages.ENQUEUED);
    }

    @Test
    void successStatusWithoutSentinelIsFailure() throws Exception {
        enqueueLoginVersionAnd("Fails.");

        IngestionOutcome outcome = dispatcher.handle(message(42L, "magnet:?xt=urn:btih:ABC", null));

        assertEquals(IngestionOutcome.FAILED, outcome);
        verify(chatTransport).sendText(CHAT_ID, ReplyMessages.FAILED);
    }

    @Test
    void refusedLoginNeverReachesAddEndpoint() throws Exception {
        daemon.enqueue(new MockResponse().setResponseCode(403).setBody("Forbidden"));

        IngestionOutcome outcome = dispatcher.handle(message(42L, "magnet:?xt=urn:btih:ABC", null));

        assertEquals(IngestionOutcome.FAILED, outcome);
        assertEquals(1, daemon.getRequestCount());
        assertEquals("/api/v2/auth/login", take().getPath());
    }

    private void enqueueLoginVersionAnd(String addBody) {
        daemon.enqueue(new MockResponse().addHeader("Set-Cookie", "SID=abc; HttpOnly; path=/").setBody("Ok."));
        daemon.enqueue(new MockResponse().setBody("v4.6.2"));
        daemon.enqueue(new MockResponse().setResponseCode(200).setBody(addBody));
    }

    private RecordedRequest take() throws InterruptedException {
        RecordedRequest request = daemon.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        return request;
    }

    private static InboundMessage message(long senderId, String text, Attachment attachment) {
        return InboundMessage.builder()
                .senderId(senderId)
                .chatId(CHAT_ID)
                .text(text)
                .attachment(attachment)
                .build();
    }
}
