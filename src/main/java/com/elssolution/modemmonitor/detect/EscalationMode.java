package com.elssolution.modemmonitor.detect;

import java.util.Locale;

public enum EscalationMode {
    /** Per-channel alert when uncorrectable errors grow by more than a fixed count. */
    DELTA,
    /** One batched alert per poll for channels whose uncorrectable ratio is too high. */
    RATE;

    public static EscalationMode parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalStateException("escalation mode is empty");
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown escalation mode '" + raw + "' (expected DELTA or RATE)", e);
        }
    }
}
