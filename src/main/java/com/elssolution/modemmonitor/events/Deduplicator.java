package com.elssolution.modemmonitor.events;

import com.elssolution.modemmonitor.domain.EventLogEntry;

import java.util.List;

/**
 * Selects the events of a newest-first batch that were not reported yet.
 *
 * Both implementations share two rules: with no memory at all only the single newest event is
 * returned, and the watermark always follows the batch's newest event, moving forward only.
 */
public interface Deduplicator {

    DedupMode mode();

    DedupResult advance(List<EventLogEntry> newestFirst, DedupState state);
}
