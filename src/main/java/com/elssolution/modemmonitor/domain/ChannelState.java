package com.elssolution.modemmonitor.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Last reading seen per channel, per direction. Entries are overwritten, never removed:
 * a channel missing from one poll keeps its stale reading.
 *
 * Not thread-safe; owned by the single poll worker.
 */
public final class ChannelState {

    private final Map<ChannelDirection, Map<Integer, ChannelReading>> previous = new EnumMap<>(ChannelDirection.class);

    public ChannelState() {
        for (ChannelDirection d : ChannelDirection.values()) previous.put(d, new LinkedHashMap<>());
    }

    public Optional<ChannelReading> previous(ChannelDirection direction, int channelId) {
        return Optional.ofNullable(previous.get(direction).get(channelId));
    }

    public void remember(ChannelReading reading) {
        previous.get(reading.direction()).put(reading.channelId(), reading);
    }

    /** Detached copy, safe to hand to other threads. */
    public Map<Integer, ChannelReading> snapshot(ChannelDirection direction) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(previous.get(direction)));
    }

    public int size(ChannelDirection direction) { return previous.get(direction).size(); }
}
