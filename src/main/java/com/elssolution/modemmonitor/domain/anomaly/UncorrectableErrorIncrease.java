package com.elssolution.modemmonitor.domain.anomaly;

import java.util.Locale;

public record UncorrectableErrorIncrease(
        int channelId,
        long previous,
        long current,
        long increase,
        long threshold
) implements Anomaly {

    @Override public String key() { return "DS_UNCORRECTABLE:" + channelId; }

    @Override public String title() { return "Uncorrectable Errors Increasing"; }

    @Override public String describe() {
        return String.format(Locale.ROOT, "Channel %d uncorrectable errors rose by %d (%d -> %d, threshold: %d)",
                channelId, increase, previous, current, threshold);
    }

    @Override public boolean escalation() { return true; }
}
