package com.elssolution.modemmonitor.alerts;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Last line of defence for the poll thread. The orchestrator catches everything itself, so
 * reaching this handler means a bug; it is logged and counted for {@code /status}.
 */
@Slf4j
@Component
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    private final AtomicLong uncaught = new AtomicLong();
    private volatile String lastUncaught = "-";
    private volatile boolean stopping = false; // mute noise while shutting down

    @PostConstruct
    void registerAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
        log.info("Global uncaught handler installed");
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent e) {
        stopping = true;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        if (stopping) return;
        uncaught.incrementAndGet();
        lastUncaught = Instant.now() + " " + t.getName() + ": " + e;
        log.error("Uncaught in {} -> {}", t.getName(), e.toString(), e);
    }

    public long uncaughtCount() { return uncaught.get(); }

    /** Time, thread and exception of the most recent uncaught error, or "-". */
    public String lastUncaught() { return lastUncaught; }
}
