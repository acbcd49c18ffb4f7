package com.elssolution.modemmonitor.domain.anomaly;

/**
 * A condition found in one poll. Transient: each poll produces a fresh list.
 */
public interface Anomaly {

    /** Identifies the condition across polls, e.g. {@code DS_LOW_SNR:5}. */
    String key();

    /** Short headline for notification titles. */
    String title();

    /** Human readable detail line(s). */
    String describe();

    /** Escalations (error growth) are rendered louder than plain threshold breaches. */
    default boolean escalation() { return false; }
}
