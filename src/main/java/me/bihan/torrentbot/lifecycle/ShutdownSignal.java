package me.bihan.torrentbot.lifecycle;

import lombok.extern.log4j.Log4j2;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide cooperative shutdown flag.
 * Set by the shutdown command or the JVM shutdown hook, polled by the update loop.
 */
@Log4j2
public class ShutdownSignal {

    private final AtomicBoolean requested = new AtomicBoolean(false);

    public void requestShutdown() {
        if (requested.compareAndSet(false, true)) {
            log.info("Shutdown requested");
        }
    }

    public boolean shouldShutdown() {
        return requested.get();
    }
}
