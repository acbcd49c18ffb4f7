package com.elssolution.modemmonitor.events;

import com.elssolution.modemmonitor.domain.Watermark;

import java.util.List;
import java.util.Optional;

/**
 * What the deduplicator remembers between polls. Immutable; every advance returns a new one.
 *
 * @param watermark       newest event already reported, {@code null} on a cold start
 * @param previousIndexes device indexes of the previous poll, newest first; {@code null} before the first poll
 */
public record DedupState(Watermark watermark, List<Long> previousIndexes) {

    public DedupState {
        previousIndexes = previousIndexes == null ? null : List.copyOf(previousIndexes);
    }

    public static DedupState coldStart() { return new DedupState(null, null); }

    public static DedupState fromWatermark(Watermark watermark) { return new DedupState(watermark, null); }

    public Optional<Watermark> watermarkOpt() { return Optional.ofNullable(watermark); }

    public boolean hasPreviousPoll() { return previousIndexes != null; }
}
