package com.elssolution.modemmonitor.alerts;

import com.elssolution.modemmonitor.detect.EscalationPolicy;
import com.elssolution.modemmonitor.service.PollOrchestrator;
import com.elssolution.modemmonitor.store.WatermarkStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Instant;

/** Start and stop notices, so a silent channel can be told apart from a dead monitor. */
@Component
public class LifecycleNotifier {
    private final NotificationService notifications;
    private final PollOrchestrator poller;
    private final EscalationPolicy escalation;
    private final WatermarkStore watermarkStore;

    @Value("${alert.startupPing:true}")  boolean startupPing;
    @Value("${alert.shutdownPing:true}") boolean shutdownPing;

    public LifecycleNotifier(NotificationService notifications, PollOrchestrator poller,
                             EscalationPolicy escalation, WatermarkStore watermarkStore) {
        this.notifications = notifications;
        this.poller = poller;
        this.escalation = escalation;
        this.watermarkStore = watermarkStore;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!startupPing) return;
        notifications.publishLifecycle("Modem monitor STARTED at " + Instant.now()
                + "\nPolling every " + poller.getPollIntervalSeconds() + " s"
                + ", escalation " + escalation.mode()
                + ", dedup " + poller.dedupMode()
                + ", watermark " + watermarkStore.describe());
    }

    @PreDestroy
    public void onShutdown() {
        if (!shutdownPing) return;
        notifications.publishLifecycle("Modem monitor STOPPING at " + Instant.now()
                + "\nTicks " + poller.ticks()
                + ", events forwarded " + poller.eventsForwarded()
                + ", anomalies " + poller.anomaliesDetected()
                + ", fetch failures " + poller.fetchFailures());
    }
}
