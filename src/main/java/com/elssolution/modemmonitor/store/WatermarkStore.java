package com.elssolution.modemmonitor.store;

import com.elssolution.modemmonitor.domain.Watermark;

import java.io.IOException;
import java.util.Optional;

/** Durable copy of the event watermark, only used to survive restarts. */
public interface WatermarkStore {

    /** Empty when nothing was stored yet or the stored value cannot be read. Never throws. */
    Optional<Watermark> load();

    void save(Watermark watermark) throws IOException;

    /** For startup logs. */
    String describe();
}
