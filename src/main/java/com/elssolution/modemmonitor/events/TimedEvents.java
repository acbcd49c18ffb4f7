package com.elssolution.modemmonitor.events;

import com.elssolution.modemmonitor.domain.EventLogEntry;
import com.elssolution.modemmonitor.domain.Watermark;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
final class TimedEvents {

    private TimedEvents() {}

    /** Parses every timestamp, dropping (and logging) entries that do not parse. Order is kept. */
    static List<TimedEvent> parseAll(List<EventLogEntry> events) {
        List<TimedEvent> out = new ArrayList<>(events.size());
        for (EventLogEntry e : events) {
            Optional<LocalDateTime> ts = e.parseTimestamp();
            if (ts.isEmpty()) {
                log.warn("event_timestamp_unparseable index={} time='{}'; event dropped", e.index(), e.time());
                continue;
            }
            out.add(new TimedEvent(e, new Watermark(ts.get(), e.index())));
        }
        return out;
    }
}
