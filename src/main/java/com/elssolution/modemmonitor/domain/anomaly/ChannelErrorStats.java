package com.elssolution.modemmonitor.domain.anomaly;

/** Counter movement of one downstream channel between two consecutive polls. */
public record ChannelErrorStats(
        int channelId,
        long previousUncorrectable,
        long currentUncorrectable,
        long uncorrectedDelta,
        long correctedDelta,
        double errorRate
) {}
