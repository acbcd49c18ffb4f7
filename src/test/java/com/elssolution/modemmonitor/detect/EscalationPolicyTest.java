package com.elssolution.modemmonitor.detect;

import com.elssolution.modemmonitor.domain.DownstreamChannel;
import com.elssolution.modemmonitor.domain.anomaly.ChannelErrorStats;
import com.elssolution.modemmonitor.domain.anomaly.HighErrorRate;
import com.elssolution.modemmonitor.domain.anomaly.UncorrectableErrorIncrease;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EscalationPolicyTest {

    private static DownstreamChannel counters(long corrected, long uncorrectable) {
        return new DownstreamChannel(3, 3, 600_000_000, "256QAM", 1.0, 38.0, corrected, uncorrectable);
    }

    @Test
    void delta_policy_emits_inline_and_never_batches() {
        DeltaEscalationPolicy p = new DeltaEscalationPolicy(100);

        ChannelErrorStats stats = p.evaluate(counters(0, 100), counters(40, 250)).orElseThrow();

        assertThat(stats.uncorrectedDelta()).isEqualTo(150);
        assertThat(stats.correctedDelta()).isEqualTo(40);
        assertThat(p.channelAnomaly(stats)).contains(new UncorrectableErrorIncrease(3, 100, 250, 150, 100));
        assertThat(p.pollAnomaly(List.of(stats))).isEmpty();
        assertThat(p.mode()).isEqualTo(EscalationMode.DELTA);
    }

    @Test
    void rate_policy_only_batches() {
        RateEscalationPolicy p = new RateEscalationPolicy(0.01);

        ChannelErrorStats stats = p.evaluate(counters(100, 0), counters(190, 10)).orElseThrow();

        assertThat(stats.errorRate()).isEqualTo(0.1);
        assertThat(p.channelAnomaly(stats)).isEmpty();
        assertThat(p.pollAnomaly(List.of(stats))).contains(new HighErrorRate(0.01, List.of(stats)));
        assertThat(p.pollAnomaly(List.of())).isEmpty();
    }

    @Test
    void rate_policy_rate_at_threshold_is_quiet() {
        RateEscalationPolicy p = new RateEscalationPolicy(0.5);

        assertThat(p.evaluate(counters(0, 0), counters(10, 10))).isEmpty();
        assertThat(p.evaluate(counters(0, 0), counters(9, 11))).isPresent();
    }

    @Test
    void rate_policy_corrected_only_growth_is_not_escalation() {
        RateEscalationPolicy p = new RateEscalationPolicy(0.01);

        assertThat(p.evaluate(counters(0, 5), counters(5_000, 5))).isEmpty();
    }

    @Test
    void invalid_thresholds_fail_fast() {
        assertThatThrownBy(() -> new RateEscalationPolicy(1.5)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new RateEscalationPolicy(Double.NaN)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new DeltaEscalationPolicy(-1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void mode_names_parse_case_insensitively() {
        assertThat(EscalationMode.parse(" delta ")).isEqualTo(EscalationMode.DELTA);
        assertThat(EscalationMode.parse("Rate")).isEqualTo(EscalationMode.RATE);
        assertThatThrownBy(() -> EscalationMode.parse("both")).isInstanceOf(IllegalStateException.class);
    }
}
