package com.elssolution.modemmonitor.store;

import com.elssolution.modemmonitor.domain.Watermark;

import java.util.Optional;

/** Used when no state file is configured: every restart is a cold start. */
public class InMemoryWatermarkStore implements WatermarkStore {

    private volatile Watermark last;

    @Override public Optional<Watermark> load() { return Optional.empty(); }

    @Override public void save(Watermark watermark) { last = watermark; }

    public Optional<Watermark> lastSaved() { return Optional.ofNullable(last); }

    @Override public String describe() { return "in-memory (no state file)"; }
}
