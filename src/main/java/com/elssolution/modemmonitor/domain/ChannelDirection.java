package com.elssolution.modemmonitor.domain;

/** Downstream and upstream channel ids are independent id spaces. */
public enum ChannelDirection {
    DOWNSTREAM("Downstream"),
    UPSTREAM("Upstream");

    private final String label;

    ChannelDirection(String label) { this.label = label; }

    public String label() { return label; }
}
