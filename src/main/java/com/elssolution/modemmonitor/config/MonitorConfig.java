package com.elssolution.modemmonitor.config;

import com.elssolution.modemmonitor.detect.AnomalyDetector;
import com.elssolution.modemmonitor.detect.DeltaEscalationPolicy;
import com.elssolution.modemmonitor.detect.EscalationMode;
import com.elssolution.modemmonitor.detect.EscalationPolicy;
import com.elssolution.modemmonitor.detect.RateEscalationPolicy;
import com.elssolution.modemmonitor.domain.Thresholds;
import com.elssolution.modemmonitor.events.DedupMode;
import com.elssolution.modemmonitor.events.Deduplicator;
import com.elssolution.modemmonitor.events.PrefixDiffDeduplicator;
import com.elssolution.modemmonitor.events.WatermarkDeduplicator;
import com.elssolution.modemmonitor.store.FileWatermarkStore;
import com.elssolution.modemmonitor.store.InMemoryWatermarkStore;
import com.elssolution.modemmonitor.store.WatermarkStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Builds the detection and dedup components from properties. Anything invalid here throws
 * {@link IllegalStateException}, which stops the context before the first poll.
 */
@Slf4j
@Configuration
public class MonitorConfig {

    // ==== Thresholds ====
    @Value("${monitor.thresholds.downstreamSnrMin:33.0}")    private double downstreamSnrMin;
    @Value("${monitor.thresholds.downstreamSignalMin:-9.0}") private double downstreamSignalMin;
    @Value("${monitor.thresholds.downstreamSignalMax:15.0}") private double downstreamSignalMax;
    @Value("${monitor.thresholds.upstreamSignalMin:37.0}")   private double upstreamSignalMin;
    @Value("${monitor.thresholds.upstreamSignalMax:53.0}")   private double upstreamSignalMax;

    // ==== Escalation ====
    @Value("${monitor.escalation.mode:RATE}")                            private String escalationMode;
    @Value("${monitor.escalation.errorRateThreshold:0.01}")              private double errorRateThreshold;
    @Value("${monitor.escalation.uncorrectableIncreaseThreshold:100}")   private long uncorrectableIncreaseThreshold;

    // ==== Events ====
    @Value("${monitor.events.dedupMode:WATERMARK}") private String dedupMode;
    @Value("${monitor.stateFile:}")                 private String stateFile;

    @Bean
    public Thresholds thresholds() {
        Thresholds t = Thresholds.builder()
                .downstreamSnrMin(finite("downstreamSnrMin", downstreamSnrMin))
                .downstreamSignalMin(finite("downstreamSignalMin", downstreamSignalMin))
                .downstreamSignalMax(finite("downstreamSignalMax", downstreamSignalMax))
                .upstreamSignalMin(finite("upstreamSignalMin", upstreamSignalMin))
                .upstreamSignalMax(finite("upstreamSignalMax", upstreamSignalMax))
                .errorRateThreshold(errorRateThreshold)
                .uncorrectableIncreaseThreshold(uncorrectableIncreaseThreshold)
                .build();
        requireOrdered("downstream signal", t.getDownstreamSignalMin(), t.getDownstreamSignalMax());
        requireOrdered("upstream signal", t.getUpstreamSignalMin(), t.getUpstreamSignalMax());
        log.info("Thresholds: {}", t);
        return t;
    }

    @Bean
    public EscalationPolicy escalationPolicy(Thresholds t) {
        EscalationMode mode = EscalationMode.parse(escalationMode);
        EscalationPolicy policy = switch (mode) {
            case DELTA -> new DeltaEscalationPolicy(t.getUncorrectableIncreaseThreshold());
            case RATE -> new RateEscalationPolicy(t.getErrorRateThreshold());
        };
        log.info("Escalation policy: {}", mode);
        return policy;
    }

    @Bean
    public AnomalyDetector anomalyDetector(Thresholds t, EscalationPolicy policy) {
        return new AnomalyDetector(t, policy);
    }

    @Bean
    public Deduplicator deduplicator() {
        DedupMode mode = DedupMode.parse(dedupMode);
        log.info("Event dedup mode: {}", mode);
        return switch (mode) {
            case WATERMARK -> new WatermarkDeduplicator();
            case PREFIX_DIFF -> new PrefixDiffDeduplicator();
        };
    }

    @Bean
    public WatermarkStore watermarkStore(ObjectMapper objectMapper) {
        WatermarkStore store = (stateFile == null || stateFile.isBlank())
                ? new InMemoryWatermarkStore()
                : new FileWatermarkStore(Path.of(stateFile.trim()), objectMapper);
        log.info("Watermark store: {}", store.describe());
        return store;
    }

    private static double finite(String name, double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            throw new IllegalStateException("monitor.thresholds." + name + " must be a finite number, got " + v);
        }
        return v;
    }

    private static void requireOrdered(String what, double min, double max) {
        if (min > max) {
            throw new IllegalStateException(what + " bounds inverted: min " + min + " > max " + max);
        }
    }
}
