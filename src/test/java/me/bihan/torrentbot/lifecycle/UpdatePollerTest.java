package me.bihan.torrentbot.lifecycle;

import me.bihan.torrentbot.chat.ChatTransport;
import me.bihan.torrentbot.chat.ChatUpdate;
import me.bihan.torrentbot.chat.InboundMessage;
import me.bihan.torrentbot.gate.IngestionDispatcher;
import me.bihan.torrentbot.gate.IngestionOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UpdatePollerTest {

    @Mock
    private ChatTransport chatTransport;
    @Mock
    private IngestionDispatcher dispatcher;

    private ShutdownSignal shutdownSignal;
    private ExecutorService executor;
    private UpdatePoller poller;

    @BeforeEach
    void setUp() {
        shutdownSignal = new ShutdownSignal();
        executor = Executors.newFixedThreadPool(2);
        poller = new UpdatePoller(chatTransport, dispatcher, shutdownSignal, executor, 30, Duration.ZERO);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void pollSchedulesEachMessageAndAdvancesOffset() throws Exception {
        InboundMessage first = message(1L);
        InboundMessage second = message(2L);
        when(chatTransport.pollUpdates(0, 30)).thenReturn(List.of(
                new ChatUpdate(10, first),
                new ChatUpdate(11, null),
                new ChatUpdate(12, second)));

        int scheduled = poller.pollOnce();

        assertEquals(2, scheduled);
        assertEquals(13, poller.getOffset());
        verify(dispatcher, timeout(2000)).handle(first);
        verify(dispatcher, timeout(2000)).handle(second);
    }

    @Test
    void pollFailureKeepsOffset() throws Exception {
        when(chatTransport.pollUpdates(0, 30)).thenThrow(new IOException("timeout"));

        assertEquals(0, poller.pollOnce());
        assertEquals(0, poller.getOffset());
        verify(dispatcher, never()).handle(any());
    }

    @Test
    void runStopsAfterShutdownAndConfirmsOffset() throws Exception {
        InboundMessage message = message(1L);
        when(chatTransport.pollUpdates(0, 30)).thenAnswer(invocation -> {
            shutdownSignal.requestShutdown();
            return List.of(new ChatUpdate(5, message));
        });
        when(chatTransport.pollUpdates(6, 0)).thenReturn(List.of());

        poller.run();

        verify(dispatcher).handle(message);
        verify(chatTransport).pollUpdates(6, 0);
        assertTrue(executor.isShutdown());
        assertTrue(executor.isTerminated());
    }

    @Test
    void runWaitsForInFlightIngestionAfterShutdown() throws Exception {
        InboundMessage message = message(1L);
        AtomicBoolean finished = new AtomicBoolean();
        when(dispatcher.handle(message)).thenAnswer(invocation -> {
            Thread.sleep(500);
            finished.set(true);
            return IngestionOutcome.ENQUEUED;
        });
        when(chatTransport.pollUpdates(0, 30)).thenAnswer(invocation -> {
            shutdownSignal.requestShutdown();
            return List.of(new ChatUpdate(5, message));
        });
        when(chatTransport.pollUpdates(6, 0)).thenReturn(List.of());

        poller.run();

        assertTrue(finished.get());
        assertTrue(executor.isTerminated());
    }

    @Test
    void dispatcherErrorDoesNotStopPolling() throws Exception {
        InboundMessage broken = message(1L);
        InboundMessage next = message(2L);
        when(dispatcher.handle(broken)).thenThrow(new IllegalStateException("boom"));
        when(chatTransport.pollUpdates(0, 30)).thenReturn(List.of(new ChatUpdate(1, broken)));
        when(chatTransport.pollUpdates(2, 30)).thenReturn(List.of(new ChatUpdate(2, next)));

        poller.pollOnce();
        poller.pollOnce();

        verify(dispatcher, timeout(2000)).handle(broken);
        verify(dispatcher, timeout(2000)).handle(next);
    }

    private static InboundMessage message(long chatId) {
        return InboundMessage.builder().senderId(42L).chatId(chatId).text("magnet:?xt=urn:btih:" + chatId).build();
    }
}
