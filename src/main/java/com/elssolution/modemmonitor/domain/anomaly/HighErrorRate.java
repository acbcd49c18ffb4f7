package com.elssolution.modemmonitor.domain.anomaly;

import java.util.List;
import java.util.Locale;

/** All channels of one poll whose uncorrectable ratio crossed the threshold, reported as one unit. */
public record HighErrorRate(double threshold, List<ChannelErrorStats> triggeredChannels) implements Anomaly {

    public HighErrorRate {
        triggeredChannels = List.copyOf(triggeredChannels);
    }

    @Override public String key() { return "DS_ERROR_RATE"; }

    @Override public String title() {
        return triggeredChannels.size() == 1 ? "High Error Rate Detected" : "High Error Rates Detected";
    }

    @Override public String describe() {
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT,
                "High error rate detected on %d channel(s) (threshold: %.2f%%)%n",
                triggeredChannels.size(), threshold * 100.0));
        for (ChannelErrorStats s : triggeredChannels) {
            sb.append(String.format(Locale.ROOT, "%n- Channel %d: %.2f%% error rate (uncorrected: +%d, corrected: +%d)",
                    s.channelId(), s.errorRate() * 100.0, s.uncorrectedDelta(), s.correctedDelta()));
        }
        return sb.toString();
    }

    @Override public boolean escalation() { return true; }
}
