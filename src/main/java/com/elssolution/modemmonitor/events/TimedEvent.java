package com.elssolution.modemmonitor.events;

import com.elssolution.modemmonitor.domain.EventLogEntry;
import com.elssolution.modemmonitor.domain.Watermark;

/** An event paired with its parsed marker. */
record TimedEvent(EventLogEntry entry, Watermark marker) {}
