package com.elssolution.greenguard.domain;

public final class Maths {
    private static final double EPS = 1e-9;

    private Maths() {}

    public static double safeDiv(double num, double den) {
        return Math.abs(den) < EPS ? 0.0 : num / den;
    }
    public static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
    public static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
    /** Percent with one decimal, e.g. "22.9". */
    public static String pct1(double v) {
        return String.format(java.util.Locale.ROOT, "%.1f", v);
    }
}
