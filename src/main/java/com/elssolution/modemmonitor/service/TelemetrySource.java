package com.elssolution.modemmonitor.service;

import com.elssolution.modemmonitor.domain.DownstreamChannel;
import com.elssolution.modemmonitor.domain.EventLogEntry;
import com.elssolution.modemmonitor.domain.UpstreamChannel;

import java.util.List;

/** Typed telemetry from the device. Implementations must bound every call with a timeout. */
public interface TelemetrySource {

    List<DownstreamChannel> fetchDownstream() throws TelemetryFetchException;

    List<UpstreamChannel> fetchUpstream() throws TelemetryFetchException;

    /** Newest first. */
    List<EventLogEntry> fetchEvents() throws TelemetryFetchException;
}
