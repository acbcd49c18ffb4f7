package com.elssolution.modemmonitor.domain;

import java.util.Locale;

public enum EventPriority {
    CRITICAL, WARNING, NOTICE, OTHER;

    /** Lenient mapping of the modem's lowercase priority names; anything unknown is OTHER. */
    public static EventPriority fromDevice(String raw) {
        if (raw == null) return OTHER;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "critical" -> CRITICAL;
            case "warning" -> WARNING;
            case "notice" -> NOTICE;
            default -> OTHER;
        };
    }

    public String label() { return name().toLowerCase(Locale.ROOT); }
}
