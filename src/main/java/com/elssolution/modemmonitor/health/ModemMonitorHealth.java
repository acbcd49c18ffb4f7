package com.elssolution.modemmonitor.health;

import com.elssolution.modemmonitor.service.StatusService;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

/** UP while some telemetry source answered within the last three poll intervals. */
@Component("modemMonitor")
public class ModemMonitorHealth implements HealthIndicator {
    private final StatusService status;

    public ModemMonitorHealth(StatusService status) { this.status = status; }

    @Override public Health health() {
        var v = status.buildStatusView();
        long freshest = status.freshestFetchAgeMs();
        long limitMs = 3L * v.getPollIntervalSeconds() * 1000L;
        boolean ok = freshest >= 0 && freshest <= limitMs;

        return (ok ? Health.up() : Health.down())
                .withDetail("phase", v.getPhase())
                .withDetail("eventsAgeMs", v.getEventsAgeMs())
                .withDetail("downstreamAgeMs", v.getDownstreamAgeMs())
                .withDetail("upstreamAgeMs", v.getUpstreamAgeMs())
                .withDetail("watermark", v.getWatermark())
                .build();
    }
}
