package com.elssolution.modemmonitor.domain;

public final class Maths {
    private static final double EPS = 1e-9;

    private Maths() {}

    public static double safeDiv(double num, double den) {
        return Math.abs(den) < EPS ? 0.0 : num / den;
    }

    /** Share of {@code part} in {@code part + other}; 0 when both are zero. */
    public static double share(long part, long other) {
        return safeDiv(part, (double) part + other);
    }
}
