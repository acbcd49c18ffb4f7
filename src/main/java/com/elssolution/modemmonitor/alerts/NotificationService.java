package com.elssolution.modemmonitor.alerts;

import com.elssolution.modemmonitor.domain.EventLogEntry;
import com.elssolution.modemmonitor.domain.anomaly.Anomaly;
import lombok.Builder;
import lombok.Setter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Fans device events and anomalies out to the registered sinks.
 * Delivery is best effort: a failing sink is logged and skipped, nothing is retried.
 */
@Slf4j
@Service
public class NotificationService {

    public enum Kind { EVENT, ANOMALY, RESOLVED, LIFECYCLE }

    // ---- Views returned to callers ----
    @Value @Builder
    public static class NotificationView {
        Kind kind;
        String key;
        String title;
        String message;
        long ts;            // epoch ms
        boolean delivered;  // at least one sink accepted it
    }

    /** Pluggable sinks: Discord, Telegram. */
    public interface NotificationSink {
        String name();
        boolean enabled();
        default boolean onEvent(EventLogEntry event) { return true; }
        default boolean onAnomaly(Anomaly anomaly) { return true; }
        default boolean onResolved(AnomalyEpisodes.EpisodeView episode) { return true; }
        default boolean onLifecycle(String text) { return true; }
    }

    // ---- state ----
    private final List<NotificationSink> sinks = new CopyOnWriteArrayList<>();
    private final Deque<NotificationView> recent = new ArrayDeque<>();
    private final int recentCapacity = 50;
    private final Map<String, Long> lastAnomalySent = new ConcurrentHashMap<>();
    private final long anomalyCooldownMs;

    @Setter
    @org.springframework.beans.factory.annotation.Value("${alert.notifyResolved:true}")
    private boolean notifyResolved = true;

    public NotificationService(
            @org.springframework.beans.factory.annotation.Value("${alert.anomalyCooldownSeconds:0}") long anomalyCooldownSeconds) {
        this.anomalyCooldownMs = Math.max(0, anomalyCooldownSeconds) * 1000L;
    }

    // ---- API ----
    public void registerSink(NotificationSink sink) {
        sinks.add(sink);
        log.info("Notification sink registered: {} enabled={}", sink.name(), sink.enabled());
    }

    public boolean publishEvent(EventLogEntry e) {
        String title = "Modem Event: " + e.priority().label();
        String text = e.time() + " [" + e.type() + "] " + e.message();
        boolean ok = fanOut("event#" + e.index(), s -> s.onEvent(e));
        record(Kind.EVENT, "EVENT:" + e.index(), title, text, ok);
        return ok;
    }

    /**
     * With a cooldown configured, the same anomaly key is sent at most once per cooldown
     * window; it is still detected and logged every poll.
     */
    public boolean publishAnomaly(Anomaly a) {
        long now = System.currentTimeMillis();
        if (anomalyCooldownMs > 0) {
            Long last = lastAnomalySent.get(a.key());
            if (last != null && (now - last) < anomalyCooldownMs) {
                log.debug("anomaly_in_cooldown key={} lastSentAgoMs={}", a.key(), now - last);
                return false;
            }
        }
        boolean ok = fanOut(a.key(), s -> s.onAnomaly(a));
        if (ok) lastAnomalySent.put(a.key(), now);
        record(Kind.ANOMALY, a.key(), a.title(), a.describe(), ok);
        return ok;
    }

    /** End of an anomaly episode; recorded always, sent only when {@code alert.notifyResolved} is on. */
    public boolean publishResolved(AnomalyEpisodes.EpisodeView episode) {
        String text = episode.getMessage() + " (cleared after " + episode.getPolls() + " poll(s))";
        boolean ok = notifyResolved && fanOut("resolved " + episode.getKey(), s -> s.onResolved(episode));
        record(Kind.RESOLVED, episode.getKey(), "Resolved: " + episode.getTitle(), text, ok);
        return ok;
    }

    public boolean publishLifecycle(String text) {
        boolean ok = fanOut("lifecycle", s -> s.onLifecycle(text));
        record(Kind.LIFECYCLE, "LIFECYCLE", "Lifecycle", text, ok);
        return ok;
    }

    /** Newest first. */
    public List<NotificationView> recent() {
        List<NotificationView> copy;
        synchronized (recent) {
            copy = new ArrayList<>(recent);
        }
        Collections.reverse(copy);
        return copy;
    }

    // ---- internals ----
    private boolean fanOut(String what, Predicate<NotificationSink> call) {
        boolean any = false;
        boolean attempted = false;
        for (NotificationSink s : sinks) {
            if (!s.enabled()) continue;
            attempted = true;
            try {
                if (call.test(s)) any = true;
                else log.warn("notify_failed sink={} item={}", s.name(), what);
            } catch (RuntimeException ex) {
                log.warn("notify_failed sink={} item={} err={}", s.name(), what, ex.toString());
            }
        }
        if (!attempted) log.debug("notify_skipped item={} (no enabled sink)", what);
        return any;
    }

    private void record(Kind kind, String key, String title, String message, boolean delivered) {
        NotificationView v = NotificationView.builder()
                .kind(kind).key(key).title(title).message(message)
                .ts(System.currentTimeMillis()).delivered(delivered)
                .build();
        synchronized (recent) {
            recent.addLast(v);
            while (recent.size() > recentCapacity) recent.removeFirst();
        }
    }
}
