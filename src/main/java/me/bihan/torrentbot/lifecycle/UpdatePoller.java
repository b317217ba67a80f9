package me.bihan.torrentbot.lifecycle;

import lombok.extern.log4j.Log4j2;
import me.bihan.torrentbot.chat.ChatTransport;
import me.bihan.torrentbot.chat.ChatUpdate;
import me.bihan.torrentbot.chat.InboundMessage;
import me.bihan.torrentbot.gate.IngestionDispatcher;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Background loop: polls chat updates and hands each message to the dispatcher
 * as its own task. Stops once the shutdown signal is raised, after letting
 * in-flight ingestions finish.
 */
@Log4j2
public class UpdatePoller implements Runnable {

    /** How long in-flight ingestions may keep running once polling has stopped. */
    public static final Duration WORKER_DRAIN_TIMEOUT = Duration.ofSeconds(60);

    private final ChatTransport chatTransport;
    private final IngestionDispatcher dispatcher;
    private final ShutdownSignal shutdownSignal;
    private final ExecutorService workerExecutor;
    private final int pollTimeoutSeconds;
    private final Duration errorBackoff;

    private long offset;

    public UpdatePoller(ChatTransport chatTransport, IngestionDispatcher dispatcher, ShutdownSignal shutdownSignal,
                        ExecutorService workerExecutor, int pollTimeoutSeconds, Duration errorBackoff) {
        this.chatTransport = chatTransport;
        this.dispatcher = dispatcher;
        this.shutdownSignal = shutdownSignal;
        this.workerExecutor = workerExecutor;
        this.pollTimeoutSeconds = pollTimeoutSeconds;
        this.errorBackoff = errorBackoff;
    }

    @Override
    public void run() {
        log.info("Polling for chat updates (timeout {}s)", pollTimeoutSeconds);
        try {
            while (!shutdownSignal.shouldShutdown() && !Thread.currentThread().isInterrupted()) {
                pollOnce();
            }
        } finally {
            confirmProcessed();
            stopWorkers();
        }
        log.info("Update polling stopped");
    }

    /**
     * Polls one batch and schedules its messages. Returns the number of messages scheduled.
     */
    int pollOnce() {
        List<ChatUpdate> updates;
        try {
            updates = chatTransport.pollUpdates(offset, pollTimeoutSeconds);
        } catch (IOException e) {
            log.error("Failed to poll updates: {}", e.getMessage());
            pause();
            return 0;
        }

        int scheduled = 0;
        for (ChatUpdate update : updates) {
            offset = Math.max(offset, update.getUpdateId() + 1);
            InboundMessage message = update.getMessage();
            if (message == null) {
                continue;
            }
            try {
                workerExecutor.submit(() -> dispatch(message));
                scheduled++;
            } catch (RejectedExecutionException e) {
                log.warn("Dropping update {}, workers are shutting down", update.getUpdateId());
            }
        }
        return scheduled;
    }

    long getOffset() {
        return offset;
    }

    private void dispatch(InboundMessage message) {
        try {
            dispatcher.handle(message);
        } catch (RuntimeException e) {
            log.error("Unexpected error handling message in chat {}", message.getChatId(), e);
        }
    }

    private void confirmProcessed() {
        if (offset == 0) {
            return;
        }
        // a zero-timeout poll acknowledges everything below the offset so it is not redelivered
        try {
            chatTransport.pollUpdates(offset, 0);
        } catch (IOException e) {
            log.warn("Failed to confirm processed updates: {}", e.getMessage());
        }
    }

    private void stopWorkers() {
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(WORKER_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Ingestions still running after {}s, forcing shutdown", WORKER_DRAIN_TIMEOUT.getSeconds());
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void pause() {
        try {
            Thread.sleep(errorBackoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
