package com.elssolution.modemmonitor.detect;

import com.elssolution.modemmonitor.domain.DownstreamChannel;
import com.elssolution.modemmonitor.domain.anomaly.Anomaly;
import com.elssolution.modemmonitor.domain.anomaly.ChannelErrorStats;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether error counter growth on a downstream channel is an escalation.
 * Exactly one policy is active per run.
 *
 * Callers only pass pairs where neither counter went backwards (see {@link AnomalyDetector}).
 */
public interface EscalationPolicy {

    EscalationMode mode();

    /** Contribution of one channel, empty when it does not escalate. */
    Optional<ChannelErrorStats> evaluate(DownstreamChannel previous, DownstreamChannel current);

    /** Anomaly emitted in channel order for a contribution; empty for batching policies. */
    Optional<Anomaly> channelAnomaly(ChannelErrorStats contribution);

    /** Anomaly appended after all per-channel ones; empty for non-batching policies or no contributions. */
    Optional<Anomaly> pollAnomaly(List<ChannelErrorStats> contributions);
}
