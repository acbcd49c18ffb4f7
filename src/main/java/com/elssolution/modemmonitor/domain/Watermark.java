package com.elssolution.modemmonitor.domain;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Objects;

/**
 * Marker of the newest event already reported. Ordered by timestamp first; the device index
 * only breaks ties between events logged in the same second.
 */
public record Watermark(LocalDateTime timestamp, long index) implements Comparable<Watermark> {

    private static final Comparator<Watermark> ORDER =
            Comparator.comparing(Watermark::timestamp).thenComparingLong(Watermark::index);

    public Watermark {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    @Override
    public int compareTo(Watermark other) { return ORDER.compare(this, other); }

    public boolean isNewerThan(Watermark other) { return other == null || compareTo(other) > 0; }

    /** Monotonic advance: keeps {@code current} unless {@code candidate} is strictly newer. */
    public static Watermark advance(Watermark current, Watermark candidate) {
        if (candidate == null) return current;
        return candidate.isNewerThan(current) ? candidate : current;
    }
}
