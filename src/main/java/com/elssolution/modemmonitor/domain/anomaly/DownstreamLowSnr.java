package com.elssolution.modemmonitor.domain.anomaly;

import java.util.Locale;

public record DownstreamLowSnr(int channelId, double snr, double threshold) implements Anomaly {

    @Override public String key() { return "DS_LOW_SNR:" + channelId; }

    @Override public String title() { return "Low SNR Detected"; }

    @Override public String describe() {
        return String.format(Locale.ROOT, "Channel %d has low SNR: %.1f dB (threshold: %.1f dB)",
                channelId, snr, threshold);
    }
}
