package com.elssolution.modemmonitor.domain;

/** Upstream channel as reported by {@code usinfo.asp}. No SNR or error counters upstream. */
public record UpstreamChannel(
        int channelId,
        int portId,
        double frequency,      // Hz
        String bandwidth,
        String modulation,
        double signalStrength  // dBmV
) implements ChannelReading {

    @Override public ChannelDirection direction() { return ChannelDirection.UPSTREAM; }
}
