package com.elssolution.modemmonitor.domain.anomaly;

import java.util.Locale;

public record UpstreamSignalOutOfRange(int channelId, double signal, double min, double max) implements Anomaly {

    @Override public String key() { return "US_SIGNAL:" + channelId; }

    @Override public String title() { return "Upstream Signal Out of Range"; }

    @Override public String describe() {
        return String.format(Locale.ROOT, "Upstream channel %d signal out of range: %.1f dBmV (expected: %.1f to %.1f dBmV)",
                channelId, signal, min, max);
    }
}
