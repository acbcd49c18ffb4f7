package com.elssolution.modemmonitor.domain;

/** One channel's values from a single poll. */
public interface ChannelReading {
    int channelId();
    ChannelDirection direction();
    double frequency();
    double signalStrength();
    String modulation();
}
