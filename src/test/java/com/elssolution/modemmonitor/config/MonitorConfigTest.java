package com.elssolution.modemmonitor.config;

import com.elssolution.modemmonitor.detect.RateEscalationPolicy;
import com.elssolution.modemmonitor.domain.Thresholds;
import com.elssolution.modemmonitor.events.PrefixDiffDeduplicator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonitorConfigTest {

    private MonitorConfig config;

    @BeforeEach
    void setUp() {
        // same values as the @Value defaults
        config = new MonitorConfig();
        ReflectionTestUtils.setField(config, "downstreamSnrMin", 33.0);
        ReflectionTestUtils.setField(config, "downstreamSignalMin", -9.0);
        ReflectionTestUtils.setField(config, "downstreamSignalMax", 15.0);
        ReflectionTestUtils.setField(config, "upstreamSignalMin", 37.0);
        ReflectionTestUtils.setField(config, "upstreamSignalMax", 53.0);
        ReflectionTestUtils.setField(config, "escalationMode", "RATE");
        ReflectionTestUtils.setField(config, "errorRateThreshold", 0.01);
        ReflectionTestUtils.setField(config, "uncorrectableIncreaseThreshold", 100L);
        ReflectionTestUtils.setField(config, "dedupMode", "WATERMARK");
        ReflectionTestUtils.setField(config, "stateFile", "");
    }

    @Test
    void defaults_build_every_component() {
        Thresholds t = config.thresholds();

        assertThat(t.getDownstreamSnrMin()).isEqualTo(33.0);
        assertThat(config.escalationPolicy(t)).isInstanceOf(RateEscalationPolicy.class);
        assertThat(config.watermarkStore(new ObjectMapper()).describe()).isNotBlank();
    }

    @Test
    void inverted_downstream_bounds_are_rejected() {
        ReflectionTestUtils.setField(config, "downstreamSignalMin", 20.0);

        assertThatThrownBy(config::thresholds)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("downstream signal");
    }

    @Test
    void inverted_upstream_bounds_are_rejected() {
        ReflectionTestUtils.setField(config, "upstreamSignalMax", 30.0);

        assertThatThrownBy(config::thresholds)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("upstream signal");
    }

    @Test
    void equal_bounds_are_allowed() {
        ReflectionTestUtils.setField(config, "upstreamSignalMin", 45.0);
        ReflectionTestUtils.setField(config, "upstreamSignalMax", 45.0);

        assertThat(config.thresholds().getUpstreamSignalMin()).isEqualTo(45.0);
    }

    @Test
    void non_finite_thresholds_are_rejected() {
        ReflectionTestUtils.setField(config, "downstreamSnrMin", Double.NaN);
        assertThatThrownBy(config::thresholds)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("downstreamSnrMin");

        ReflectionTestUtils.setField(config, "downstreamSnrMin", 33.0);
        ReflectionTestUtils.setField(config, "upstreamSignalMax", Double.POSITIVE_INFINITY);
        assertThatThrownBy(config::thresholds)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("upstreamSignalMax");
    }

    @Test
    void unknown_dedup_mode_is_rejected() {
        ReflectionTestUtils.setField(config, "dedupMode", "NEWEST");

        assertThatThrownBy(config::deduplicator)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("NEWEST");
    }

    @Test
    void dedup_mode_accepts_lower_case_with_dash() {
        ReflectionTestUtils.setField(config, "dedupMode", "prefix-diff");

        assertThat(config.deduplicator()).isInstanceOf(PrefixDiffDeduplicator.class);
    }

    @Test
    void unknown_escalation_mode_is_rejected() {
        ReflectionTestUtils.setField(config, "escalationMode", "SLOPE");
        Thresholds t = config.thresholds();

        assertThatThrownBy(() -> config.escalationPolicy(t))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SLOPE");
    }

    @Test
    void error_rate_above_one_is_rejected() {
        ReflectionTestUtils.setField(config, "errorRateThreshold", 1.5);
        Thresholds t = config.thresholds();

        assertThatThrownBy(() -> config.escalationPolicy(t))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void invalid_property_stops_the_context() {
        new ApplicationContextRunner()
                .withBean(ObjectMapper.class)
                .withUserConfiguration(MonitorConfig.class)
                .withPropertyValues("monitor.thresholds.upstreamSignalMin=60")
                .run(ctx -> assertThat(ctx).hasFailed()
                        .getFailure().hasStackTraceContaining("upstream signal bounds inverted"));
    }
}
