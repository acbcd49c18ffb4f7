package com.elssolution.modemmonitor.events;

import com.elssolution.modemmonitor.domain.EventLogEntry;
import com.elssolution.modemmonitor.domain.Watermark;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reports the leading run of events whose index was not in the previous poll's list.
 * The first poll after a restart has no list yet; events newer than the stored watermark are
 * reported then, or the newest event alone when nothing was stored.
 *
 * Known limitation: when the modem clears its log on reboot the new, low indexes usually
 * already appeared in the previous list, so nothing is reported until the log grows past it.
 */
@Slf4j
public class PrefixDiffDeduplicator implements Deduplicator {

    @Override public DedupMode mode() { return DedupMode.PREFIX_DIFF; }

    @Override
    public DedupResult advance(List<EventLogEntry> newestFirst, DedupState state) {
        List<TimedEvent> timed = TimedEvents.parseAll(newestFirst);
        int dropped = newestFirst.size() - timed.size();
        if (timed.isEmpty()) {
            return new DedupResult(List.of(), state, dropped);
        }

        List<EventLogEntry> fresh = new ArrayList<>();
        Watermark stored = state.watermark();
        if (!state.hasPreviousPoll() && stored != null) {
            // no index list yet after a restart: the stored watermark bounds the first poll
            for (TimedEvent t : timed) {
                if (t.marker().isNewerThan(stored)) fresh.add(t.entry());
            }
            log.info("dedup_resume watermark={} batch={} new={}", stored, timed.size(), fresh.size());
        } else if (!state.hasPreviousPoll()) {
            fresh.add(timed.get(0).entry());
            log.info("dedup_cold_start newest_index={} batch={}; reporting newest only",
                    timed.get(0).entry().index(), timed.size());
        } else {
            Set<Long> known = new HashSet<>(state.previousIndexes());
            for (TimedEvent t : timed) {
                if (known.contains(t.entry().index())) break;
                fresh.add(t.entry());
            }
        }

        List<Long> indexes = timed.stream().map(t -> t.entry().index()).toList();
        Watermark next = Watermark.advance(stored, timed.get(0).marker());
        return new DedupResult(fresh, new DedupState(next, indexes), dropped);
    }
}
