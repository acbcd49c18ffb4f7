package com.elssolution.modemmonitor.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable limits for one run. Defaults follow common DOCSIS 3.0/3.1 guidance.
 * Range checks are inclusive at both bounds; the SNR floor is exclusive.
 */
@Value
@Builder
public class Thresholds {
    @Builder.Default double downstreamSnrMin = 33.0;
    @Builder.Default double downstreamSignalMin = -9.0;
    @Builder.Default double downstreamSignalMax = 15.0;
    @Builder.Default double upstreamSignalMin = 37.0;
    @Builder.Default double upstreamSignalMax = 53.0;
    /** Rate mode: uncorrectable / (corrected + uncorrectable) above this fires. */
    @Builder.Default double errorRateThreshold = 0.01;
    /** Delta mode: uncorrectable growth above this between two polls fires. */
    @Builder.Default long uncorrectableIncreaseThreshold = 100;

    public static Thresholds defaults() { return Thresholds.builder().build(); }

    public double signalMin(ChannelDirection d) {
        return d == ChannelDirection.DOWNSTREAM ? downstreamSignalMin : upstreamSignalMin;
    }

    public double signalMax(ChannelDirection d) {
        return d == ChannelDirection.DOWNSTREAM ? downstreamSignalMax : upstreamSignalMax;
    }
}
