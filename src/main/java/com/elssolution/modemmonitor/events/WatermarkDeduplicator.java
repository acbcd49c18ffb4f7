package com.elssolution.modemmonitor.events;

import com.elssolution.modemmonitor.domain.EventLogEntry;
import com.elssolution.modemmonitor.domain.Watermark;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Returns every event strictly newer than the watermark (timestamp, then index within the
 * same second). Without a watermark only the newest event is returned so a first boot does
 * not replay the whole device log.
 */
@Slf4j
public class WatermarkDeduplicator implements Deduplicator {

    @Override public DedupMode mode() { return DedupMode.WATERMARK; }

    @Override
    public DedupResult advance(List<EventLogEntry> newestFirst, DedupState state) {
        List<TimedEvent> timed = TimedEvents.parseAll(newestFirst);
        int dropped = newestFirst.size() - timed.size();
        if (timed.isEmpty()) {
            return new DedupResult(List.of(), state, dropped);
        }

        Watermark current = state.watermark();
        List<EventLogEntry> fresh;
        if (current == null) {
            fresh = List.of(timed.get(0).entry());
            log.info("dedup_cold_start newest_index={} batch={}; reporting newest only",
                    timed.get(0).entry().index(), timed.size());
        } else {
            fresh = timed.stream()
                    .filter(t -> t.marker().isNewerThan(current))
                    .map(TimedEvent::entry)
                    .toList();
        }

        Watermark next = Watermark.advance(current, timed.get(0).marker());
        if (current != null && next == current && timed.get(0).marker().compareTo(current) < 0) {
            log.warn("watermark_regression_ignored current={} device_newest={}", current, timed.get(0).marker());
        }
        return new DedupResult(fresh, new DedupState(next, state.previousIndexes()), dropped);
    }
}
