package com.elssolution.modemmonitor.events;

import com.elssolution.modemmonitor.domain.EventLogEntry;

import java.util.List;

/**
 * @param newEvents   unseen events, newest first (device order)
 * @param next        state to use for the following poll
 * @param unparseable events dropped because their timestamp could not be read
 */
public record DedupResult(List<EventLogEntry> newEvents, DedupState next, int unparseable) {

    public DedupResult {
        newEvents = List.copyOf(newEvents);
    }
}
