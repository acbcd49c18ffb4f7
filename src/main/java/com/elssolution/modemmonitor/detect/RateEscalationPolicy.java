package com.elssolution.modemmonitor.detect;

import com.elssolution.modemmonitor.domain.DownstreamChannel;
import com.elssolution.modemmonitor.domain.Maths;
import com.elssolution.modemmonitor.domain.anomaly.Anomaly;
import com.elssolution.modemmonitor.domain.anomaly.ChannelErrorStats;
import com.elssolution.modemmonitor.domain.anomaly.HighErrorRate;

import java.util.List;
import java.util.Optional;

/**
 * Ratio of new uncorrectable errors to all new errors in the interval:
 * {@code uncorrected / (uncorrected + corrected)}. Channels above the threshold are
 * collected into a single {@link HighErrorRate} for the poll.
 */
public class RateEscalationPolicy implements EscalationPolicy {

    private final double threshold;

    public RateEscalationPolicy(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalStateException("error rate threshold must be within [0,1], got " + threshold);
        }
        this.threshold = threshold;
    }

    @Override public EscalationMode mode() { return EscalationMode.RATE; }

    @Override
    public Optional<ChannelErrorStats> evaluate(DownstreamChannel previous, DownstreamChannel current) {
        long uncorrected = current.uncorrectableErrors() - previous.uncorrectableErrors();
        long corrected = current.correctedErrors() - previous.correctedErrors();

        // quiet interval
        if (uncorrected <= 0 && corrected <= 0) return Optional.empty();

        double rate = Maths.share(Math.max(0, uncorrected), Math.max(0, corrected));
        if (rate <= threshold) return Optional.empty();

        return Optional.of(new ChannelErrorStats(
                current.channelId(),
                previous.uncorrectableErrors(),
                current.uncorrectableErrors(),
                uncorrected,
                corrected,
                rate));
    }

    @Override
    public Optional<Anomaly> channelAnomaly(ChannelErrorStats contribution) {
        return Optional.empty();
    }

    @Override
    public Optional<Anomaly> pollAnomaly(List<ChannelErrorStats> contributions) {
        if (contributions.isEmpty()) return Optional.empty();
        return Optional.of(new HighErrorRate(threshold, contributions));
    }
}
