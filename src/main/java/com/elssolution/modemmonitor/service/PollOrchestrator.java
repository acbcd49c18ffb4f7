package com.elssolution.modemmonitor.service;

import com.elssolution.modemmonitor.alerts.AnomalyEpisodes;
import com.elssolution.modemmonitor.alerts.NotificationService;
import com.elssolution.modemmonitor.detect.AnomalyDetector;
import com.elssolution.modemmonitor.domain.ChannelDirection;
import com.elssolution.modemmonitor.domain.ChannelReading;
import com.elssolution.modemmonitor.domain.ChannelState;
import com.elssolution.modemmonitor.domain.EventLogEntry;
import com.elssolution.modemmonitor.domain.EventPriority;
import com.elssolution.modemmonitor.domain.Watermark;
import com.elssolution.modemmonitor.domain.anomaly.Anomaly;
import com.elssolution.modemmonitor.events.DedupMode;
import com.elssolution.modemmonitor.events.DedupResult;
import com.elssolution.modemmonitor.events.DedupState;
import com.elssolution.modemmonitor.events.Deduplicator;
import com.elssolution.modemmonitor.store.WatermarkStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the poll cycle.
 *
 * STARTUP (once): load the stored watermark, report the events it has not seen, persist.
 * STEADY_STATE (every interval): events the same way, then downstream and upstream channels
 * through the detector. Anomalies pass through {@link AnomalyEpisodes}: only a newly active
 * condition is sent, and its disappearance is sent once as a resolve.
 *
 * Events, downstream and upstream are separate failure domains: one failing is logged and
 * skipped for this tick without touching the others. Everything runs on the single scheduler
 * thread, which owns {@link ChannelState} and the dedup state.
 */
@Slf4j
@Service
public class PollOrchestrator {

    public enum Phase { CREATED, STARTUP, STEADY_STATE, STOPPED }

    // ==== Config ====
    @Getter @Setter @Value("${monitor.pollIntervalSeconds:60}")     private int pollIntervalSeconds;
    @Getter @Setter @Value("${monitor.events.suppressNotice:true}") private boolean suppressNotice;

    // ==== Collaborators ====
    private final ScheduledExecutorService scheduler;
    private final TelemetrySource telemetry;
    private final AnomalyDetector detector;
    private final Deduplicator deduplicator;
    private final WatermarkStore watermarkStore;
    private final NotificationService notifications;
    private volatile ScheduledFuture<?> loopHandle;

    // ==== Owned by the poll thread ====
    private final ChannelState channelState = new ChannelState();
    private final AnomalyEpisodes episodes = new AnomalyEpisodes();
    @Getter private volatile DedupState dedupState = DedupState.coldStart();
    private volatile Watermark lastPersisted;
    @Getter private volatile boolean persistPending = false;

    // ==== Published for status/health ====
    @Getter private volatile Phase phase = Phase.CREATED;
    @Getter private volatile long lastEventsOkMs = 0L;
    @Getter private volatile long lastDownstreamOkMs = 0L;
    @Getter private volatile long lastUpstreamOkMs = 0L;
    private volatile Map<ChannelDirection, Map<Integer, ChannelReading>> channelSnapshot = Map.of();
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong eventsForwarded = new AtomicLong();
    private final AtomicLong eventsSuppressed = new AtomicLong();
    private final AtomicLong anomaliesDetected = new AtomicLong();
    private final AtomicLong anomaliesRaised = new AtomicLong();
    private final AtomicLong anomaliesResolved = new AtomicLong();
    private final AtomicLong fetchFailures = new AtomicLong();

    public PollOrchestrator(ScheduledExecutorService scheduler,
                            TelemetrySource telemetry,
                            AnomalyDetector detector,
                            Deduplicator deduplicator,
                            WatermarkStore watermarkStore,
                            NotificationService notifications) {
        this.scheduler = scheduler;
        this.telemetry = telemetry;
        this.detector = detector;
        this.deduplicator = deduplicator;
        this.watermarkStore = watermarkStore;
        this.notifications = notifications;
    }

    // ---- Lifecycle ----
    @PostConstruct
    void validate() {
        if (pollIntervalSeconds <= 0) {
            throw new IllegalStateException("monitor.pollIntervalSeconds must be positive, got " + pollIntervalSeconds);
        }
    }

    /** Starts once the context is ready, so every sink is registered before the first event goes out. */
    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        validate();
        scheduler.execute(this::startupSafe);
        loopHandle = scheduler.scheduleAtFixedRate(this::tickSafe,
                pollIntervalSeconds, pollIntervalSeconds, TimeUnit.SECONDS);
        log.info("Modem polling: every={}s, dedup={}, suppressNotice={}, store={}",
                pollIntervalSeconds, deduplicator.mode(), suppressNotice, watermarkStore.describe());
    }

    @PreDestroy
    public void shutdown() {
        phase = Phase.STOPPED;
        ScheduledFuture<?> h = loopHandle;
        if (h != null) h.cancel(false);
        if (persistPending) {
            log.info("shutdown_flush watermark={}", dedupState.watermark());
            persist(dedupState.watermark());
        }
    }

    // ---- Phases ----

    /** One-time startup: resume from the stored watermark, or cold start. */
    public void runStartup() {
        phase = Phase.STARTUP;
        Optional<Watermark> stored = watermarkStore.load();
        stored.ifPresentOrElse(
                w -> log.info("startup_watermark_loaded {}", w),
                () -> log.info("startup_cold_start; no stored watermark"));
        stored.ifPresent(w -> lastPersisted = w);
        dedupState = DedupState.fromWatermark(stored.orElse(null));

        pollEvents();
        phase = Phase.STEADY_STATE;
    }

    /** One steady-state tick. */
    public void tick() {
        long n = ticks.incrementAndGet();
        pollEvents();
        pollChannels(ChannelDirection.DOWNSTREAM);
        pollChannels(ChannelDirection.UPSTREAM);
        if (log.isDebugEnabled()) log.debug("tick #{} done", n);
    }

    private void startupSafe() {
        try {
            runStartup();
        } catch (Exception e) {
            log.warn("startup_failed: {}", e.toString(), e);
            phase = Phase.STEADY_STATE; // the loop still runs
        }
    }

    private void tickSafe() {
        try {
            tick();
        } catch (Exception e) {
            // a throw here would cancel the periodic task
            log.warn("tick_failed: {}", e.toString(), e);
        }
    }

    // ---- Sub-steps ----

    void pollEvents() {
        List<EventLogEntry> events;
        try {
            events = telemetry.fetchEvents();
        } catch (TelemetryFetchException e) {
            fetchFailures.incrementAndGet();
            log.warn("poll_events_fetch_failed reason={} endpoint={} msg={}", e.getReason(), e.getEndpoint(), e.getMessage());
            return;
        }
        lastEventsOkMs = System.currentTimeMillis();

        int forwarded = 0;
        int suppressed = 0;
        DedupResult result;
        try {
            result = deduplicator.advance(events, dedupState);
            dedupState = result.next();
            for (EventLogEntry e : result.newEvents()) {
                if (suppressNotice && e.priority() == EventPriority.NOTICE) {
                    suppressed++;
                    log.info("event_suppressed index={} priority={} time='{}' type='{}' msg='{}'",
                            e.index(), e.priority().label(), e.time(), e.type(), e.message());
                    continue;
                }
                log.info("event_new index={} priority={} time='{}' type='{}' msg='{}'",
                        e.index(), e.priority().label(), e.time(), e.type(), e.message());
                notifications.publishEvent(e);
                forwarded++;
            }
        } catch (RuntimeException ex) {
            log.warn("poll_events_failed: {}", ex.toString(), ex);
            return;
        }
        eventsForwarded.addAndGet(forwarded);
        eventsSuppressed.addAndGet(suppressed);

        if (!result.newEvents().isEmpty() || result.unparseable() > 0) {
            log.info("poll_events fetched={} new={} forwarded={} suppressedNotice={} unparseable={} watermark={}",
                    events.size(), result.newEvents().size(), forwarded, suppressed, result.unparseable(),
                    dedupState.watermark());
        }
        persist(dedupState.watermark());
    }

    void pollChannels(ChannelDirection direction) {
        List<? extends ChannelReading> readings;
        try {
            readings = direction == ChannelDirection.DOWNSTREAM ? telemetry.fetchDownstream() : telemetry.fetchUpstream();
        } catch (TelemetryFetchException e) {
            fetchFailures.incrementAndGet();
            log.warn("poll_channels_fetch_failed direction={} reason={} msg={}", direction, e.getReason(), e.getMessage());
            return;
        }

        try {
            List<Anomaly> anomalies = detector.detect(direction, readings, channelState);
            if (direction == ChannelDirection.DOWNSTREAM) lastDownstreamOkMs = System.currentTimeMillis();
            else lastUpstreamOkMs = System.currentTimeMillis();
            publishSnapshot();

            anomaliesDetected.addAndGet(anomalies.size());
            for (Anomaly a : anomalies) {
                if (log.isDebugEnabled()) log.debug("anomaly key={} {}", a.key(), a.describe());
            }

            AnomalyEpisodes.Transitions t = episodes.update(direction, anomalies);
            if (!t.isEmpty()) {
                log.info("poll_channels direction={} channels={} anomalies={} raised={} resolved={}",
                        direction, readings.size(), anomalies.size(), t.raised().size(), t.resolved().size());
            }
            for (Anomaly a : t.raised()) {
                log.warn("anomaly_new key={} {}", a.key(), a.describe());
                notifications.publishAnomaly(a);
            }
            for (AnomalyEpisodes.EpisodeView r : t.resolved()) {
                notifications.publishResolved(r);
            }
            anomaliesRaised.addAndGet(t.raised().size());
            anomaliesResolved.addAndGet(t.resolved().size());
        } catch (RuntimeException ex) {
            log.warn("poll_channels_failed direction={}: {}", direction, ex.toString(), ex);
        }
    }

    // ---- Persistence ----

    /** Called from the poll thread and, at shutdown, from the closing thread. */
    private synchronized void persist(Watermark w) {
        if (w == null) return;
        if (w.equals(lastPersisted) && !persistPending) return;
        try {
            watermarkStore.save(w);
            lastPersisted = w;
            persistPending = false;
        } catch (IOException | RuntimeException e) {
            // in-memory watermark stays authoritative; retried next cycle
            persistPending = true;
            log.warn("watermark_persist_failed watermark={} err={}", w, e.toString());
        }
    }

    // ---- Views ----

    private void publishSnapshot() {
        Map<ChannelDirection, Map<Integer, ChannelReading>> m = new EnumMap<>(ChannelDirection.class);
        for (ChannelDirection d : ChannelDirection.values()) m.put(d, channelState.snapshot(d));
        channelSnapshot = m;
    }

    /** Latest known reading per channel; safe to call from any thread. */
    public Map<Integer, ChannelReading> channels(ChannelDirection direction) {
        return channelSnapshot.getOrDefault(direction, Map.of());
    }

    public Optional<Watermark> currentWatermark() { return dedupState.watermarkOpt(); }

    public DedupMode dedupMode() { return deduplicator.mode(); }

    public long ticks() { return ticks.get(); }
    public long eventsForwarded() { return eventsForwarded.get(); }
    public long eventsSuppressed() { return eventsSuppressed.get(); }
    public long anomaliesDetected() { return anomaliesDetected.get(); }
    public long anomaliesRaised() { return anomaliesRaised.get(); }
    public long anomaliesResolved() { return anomaliesResolved.get(); }

    /** Conditions currently active, most recently raised first. */
    public List<AnomalyEpisodes.EpisodeView> activeAnomalies() { return episodes.active(); }
    public long fetchFailures() { return fetchFailures.get(); }
}
