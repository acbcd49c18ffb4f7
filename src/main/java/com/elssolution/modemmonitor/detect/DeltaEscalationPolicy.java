package com.elssolution.modemmonitor.detect;

import com.elssolution.modemmonitor.domain.DownstreamChannel;
import com.elssolution.modemmonitor.domain.Maths;
import com.elssolution.modemmonitor.domain.anomaly.Anomaly;
import com.elssolution.modemmonitor.domain.anomaly.ChannelErrorStats;
import com.elssolution.modemmonitor.domain.anomaly.UncorrectableErrorIncrease;

import java.util.List;
import java.util.Optional;

/** Fires per channel when uncorrectable errors grew by more than {@code threshold} since the last poll. */
public class DeltaEscalationPolicy implements EscalationPolicy {

    private final long threshold;

    public DeltaEscalationPolicy(long threshold) {
        if (threshold < 0) throw new IllegalStateException("uncorrectable increase threshold must be >= 0, got " + threshold);
        this.threshold = threshold;
    }

    @Override public EscalationMode mode() { return EscalationMode.DELTA; }

    @Override
    public Optional<ChannelErrorStats> evaluate(DownstreamChannel previous, DownstreamChannel current) {
        long increase = current.uncorrectableErrors() - previous.uncorrectableErrors();
        if (increase <= threshold) return Optional.empty();
        long corrected = current.correctedErrors() - previous.correctedErrors();
        return Optional.of(new ChannelErrorStats(
                current.channelId(),
                previous.uncorrectableErrors(),
                current.uncorrectableErrors(),
                increase,
                corrected,
                Maths.share(increase, Math.max(0, corrected))));
    }

    @Override
    public Optional<Anomaly> channelAnomaly(ChannelErrorStats c) {
        return Optional.of(new UncorrectableErrorIncrease(
                c.channelId(), c.previousUncorrectable(), c.currentUncorrectable(), c.uncorrectedDelta(), threshold));
    }

    @Override
    public Optional<Anomaly> pollAnomaly(List<ChannelErrorStats> contributions) {
        return Optional.empty();
    }
}
