package com.elssolution.modemmonitor.events;

import java.util.Locale;

public enum DedupMode {
    /** Compare against a durable timestamp watermark. Default. */
    WATERMARK,
    /** Compare against the previous poll's index list; in-memory only. */
    PREFIX_DIFF;

    public static DedupMode parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalStateException("dedup mode is empty");
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown dedup mode '" + raw + "' (expected WATERMARK or PREFIX_DIFF)", e);
        }
    }
}
