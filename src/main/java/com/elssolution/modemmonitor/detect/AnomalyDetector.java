package com.elssolution.modemmonitor.detect;

import com.elssolution.modemmonitor.domain.ChannelDirection;
import com.elssolution.modemmonitor.domain.ChannelReading;
import com.elssolution.modemmonitor.domain.ChannelState;
import com.elssolution.modemmonitor.domain.DownstreamChannel;
import com.elssolution.modemmonitor.domain.Thresholds;
import com.elssolution.modemmonitor.domain.anomaly.Anomaly;
import com.elssolution.modemmonitor.domain.anomaly.ChannelErrorStats;
import com.elssolution.modemmonitor.domain.anomaly.DownstreamLowSnr;
import com.elssolution.modemmonitor.domain.anomaly.DownstreamSignalOutOfRange;
import com.elssolution.modemmonitor.domain.anomaly.UpstreamSignalOutOfRange;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns one poll of channel readings into anomalies.
 *
 * Per channel, in input order:
 *   - SNR floor (downstream only, exclusive: equal is fine)
 *   - signal range (inclusive bounds, per direction)
 *   - error escalation (downstream only, needs a previous reading of the same channel)
 * then the reading replaces the stored one, whether or not anything fired.
 * A batched escalation anomaly, if the policy produces one, comes last.
 *
 * A counter that went down means the modem rebooted: no escalation is evaluated for that
 * channel this poll and the new reading becomes the baseline.
 */
@Slf4j
public class AnomalyDetector {

    private final Thresholds thresholds;
    private final EscalationPolicy escalation;

    public AnomalyDetector(Thresholds thresholds, EscalationPolicy escalation) {
        this.thresholds = thresholds;
        this.escalation = escalation;
    }

    public List<Anomaly> detect(ChannelDirection direction, List<? extends ChannelReading> readings, ChannelState state) {
        List<Anomaly> out = new ArrayList<>();
        List<ChannelErrorStats> escalated = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();

        for (ChannelReading reading : readings) {
            if (reading.direction() != direction) {
                throw new IllegalArgumentException("reading for " + reading.direction()
                        + " channel " + reading.channelId() + " passed as " + direction);
            }
            if (!seen.add(reading.channelId())) {
                log.warn("duplicate_channel direction={} channel={}; keeping first reading of this poll",
                        direction, reading.channelId());
                continue;
            }

            if (reading instanceof DownstreamChannel ds) {
                checkSnr(ds, out);
            }
            checkSignal(reading, out);
            if (reading instanceof DownstreamChannel ds) {
                checkEscalation(ds, state, out, escalated);
            }

            state.remember(reading);
        }

        escalation.pollAnomaly(escalated).ifPresent(out::add);

        if (log.isDebugEnabled()) {
            log.debug("detect direction={} channels={} anomalies={}", direction, seen.size(), out.size());
        }
        return out;
    }

    private void checkSnr(DownstreamChannel ds, List<Anomaly> out) {
        if (ds.snr() < thresholds.getDownstreamSnrMin()) {
            out.add(new DownstreamLowSnr(ds.channelId(), ds.snr(), thresholds.getDownstreamSnrMin()));
        }
    }

    private void checkSignal(ChannelReading r, List<Anomaly> out) {
        double min = thresholds.signalMin(r.direction());
        double max = thresholds.signalMax(r.direction());
        double signal = r.signalStrength();
        if (signal >= min && signal <= max) return;

        out.add(r.direction() == ChannelDirection.DOWNSTREAM
                ? new DownstreamSignalOutOfRange(r.channelId(), signal, min, max)
                : new UpstreamSignalOutOfRange(r.channelId(), signal, min, max));
    }

    private void checkEscalation(DownstreamChannel current, ChannelState state,
                                 List<Anomaly> out, List<ChannelErrorStats> escalated) {
        Optional<DownstreamChannel> prevOpt = state.previous(ChannelDirection.DOWNSTREAM, current.channelId())
                .map(DownstreamChannel.class::cast);
        if (prevOpt.isEmpty()) return; // first appearance, nothing to compare

        DownstreamChannel prev = prevOpt.get();
        if (current.uncorrectableErrors() < prev.uncorrectableErrors()
                || current.correctedErrors() < prev.correctedErrors()) {
            log.info("counter_reset channel={} uncorrectable {}->{} corrected {}->{}; rebaselining",
                    current.channelId(), prev.uncorrectableErrors(), current.uncorrectableErrors(),
                    prev.correctedErrors(), current.correctedErrors());
            return;
        }

        escalation.evaluate(prev, current).ifPresent(stats -> {
            escalated.add(stats);
            escalation.channelAnomaly(stats).ifPresent(out::add);
        });
    }
}
