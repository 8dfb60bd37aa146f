package com.curvedigit.server.extraction.scale;

/**
 * Decade axis: equal canvas distances are equal ratios, {@code 10^(log10(min) + f (log10(max) - log10(min)))}.
 */
public class LogAxisScale implements AxisScale {

    private final double logMin;
    private final double logSpan;

    public LogAxisScale(double min, double max) {
        if (min <= 0 || max <= 0) {
            throw new IllegalArgumentException("Log axis bounds must be positive: [" + min + ", " + max + "]");
        }
        this.logMin = Math.log10(min);
        this.logSpan = Math.log10(max) - logMin;
    }

    @Override
    public double valueAt(double fraction) {
        return Math.pow(10.0, logMin + fraction * logSpan);
    }

    @Override
    public String getName() {
        return "log";
    }
}
