package com.elssolution.modemmonitor.domain;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * One DOCSIS event-log row. {@code time} is device-local, second resolution, no zone.
 * {@code index} restarts when the modem clears its log, so it is not a durable key.
 */
public record EventLogEntry(
        long index,
        String time,
        String type,
        EventPriority priority,
        String message
) {
    public static final DateTimeFormatter DEVICE_TIME = DateTimeFormatter.ofPattern("MM/dd/yy HH:mm:ss");

    /** Empty when {@code time} is not in {@code MM/dd/yy HH:mm:ss} form. */
    public Optional<LocalDateTime> parseTimestamp() {
        if (time == null) return Optional.empty();
        try {
            return Optional.of(LocalDateTime.parse(time.trim(), DEVICE_TIME));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
