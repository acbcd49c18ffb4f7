package com.elssolution.modemmonitor.domain;

/**
 * Downstream QAM channel as reported by {@code dsinfo.asp}.
 * Error counters only grow, except when the modem reboots and they restart from zero.
 */
public record DownstreamChannel(
        int channelId,
        int portId,
        double frequency,      // Hz
        String modulation,
        double signalStrength, // dBmV
        double snr,            // dB
        long correctedErrors,
        long uncorrectableErrors
) implements ChannelReading {

    @Override public ChannelDirection direction() { return ChannelDirection.DOWNSTREAM; }
}
