package com.elssolution.modemmonitor.alerts;

import com.elssolution.modemmonitor.domain.ChannelDirection;
import com.elssolution.modemmonitor.domain.anomaly.Anomaly;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Raise/resolve episodes per anomaly key, one key space per direction.
 *
 * A key present in a poll that was not active starts an episode (raise). A key that stays
 * present only refreshes it. An active key missing from a later successful poll of the same
 * direction closes the episode (resolve); it can be raised again afterwards.
 *
 * Updated by the poll thread only; {@link #active()} may be read from any thread.
 */
@Slf4j
public class AnomalyEpisodes {

    @Value @Builder
    public static class EpisodeView {
        String key;
        String title;
        String message;
        ChannelDirection direction;
        long startedAt;   // epoch ms, start of the current episode
        long lastSeen;    // epoch ms
        int polls;        // polls in which the key was present during this episode
    }

    /** Outcome of one poll: anomalies to send, episodes that just ended. */
    public record Transitions(List<Anomaly> raised, List<EpisodeView> resolved) {
        public Transitions {
            raised = List.copyOf(raised);
            resolved = List.copyOf(resolved);
        }

        public boolean isEmpty() { return raised.isEmpty() && resolved.isEmpty(); }
    }

    private final Map<ChannelDirection, Map<String, MutableEpisode>> active = new EnumMap<>(ChannelDirection.class);

    public AnomalyEpisodes() {
        for (ChannelDirection d : ChannelDirection.values()) active.put(d, new ConcurrentHashMap<>());
    }

    public Transitions update(ChannelDirection direction, List<Anomaly> anomalies) {
        long now = System.currentTimeMillis();
        Map<String, MutableEpisode> episodes = active.get(direction);

        Map<String, Anomaly> present = new LinkedHashMap<>();
        for (Anomaly a : anomalies) present.putIfAbsent(a.key(), a);

        List<Anomaly> raised = new ArrayList<>();
        for (Anomaly a : present.values()) {
            MutableEpisode e = episodes.get(a.key());
            if (e == null) {
                episodes.put(a.key(), new MutableEpisode(a, direction, now));
                raised.add(a);
                log.info("anomaly_raise key={} direction={}", a.key(), direction);
            } else {
                e.refresh(a, now);
            }
        }

        List<EpisodeView> resolved = new ArrayList<>();
        Iterator<Map.Entry<String, MutableEpisode>> it = episodes.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, MutableEpisode> entry = it.next();
            if (present.containsKey(entry.getKey())) continue;
            it.remove();
            EpisodeView v = entry.getValue().view();
            resolved.add(v);
            log.info("anomaly_resolve key={} direction={} polls={}", v.getKey(), direction, v.getPolls());
        }
        return new Transitions(raised, resolved);
    }

    /** Ongoing episodes, most recently started first. */
    public List<EpisodeView> active() {
        List<EpisodeView> out = new ArrayList<>();
        for (Map<String, MutableEpisode> m : active.values()) {
            m.values().forEach(e -> out.add(e.view()));
        }
        out.sort(Comparator.comparingLong(EpisodeView::getStartedAt).reversed());
        return out;
    }

    public int activeCount() {
        int n = 0;
        for (Map<String, MutableEpisode> m : active.values()) n += m.size();
        return n;
    }

    // ---- per-key mutable record ----
    private static class MutableEpisode {
        final String key;
        final ChannelDirection direction;
        final long startedAt;
        volatile String title;
        volatile String message;
        volatile long lastSeen;
        volatile int polls;

        MutableEpisode(Anomaly a, ChannelDirection direction, long now) {
            this.key = a.key();
            this.direction = direction;
            this.startedAt = now;
            refresh(a, now);
        }

        void refresh(Anomaly a, long now) {
            title = a.title();
            message = a.describe();
            lastSeen = now;
            polls++;
        }

        EpisodeView view() {
            return EpisodeView.builder()
                    .key(key).title(title).message(message).direction(direction)
                    .startedAt(startedAt).lastSeen(lastSeen).polls(polls)
                    .build();
        }
    }
}
