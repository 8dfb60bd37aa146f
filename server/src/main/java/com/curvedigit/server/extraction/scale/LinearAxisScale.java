package com.curvedigit.server.extraction.scale;

public class LinearAxisScale implements AxisScale {

    private final double min;
    private final double span;

    public LinearAxisScale(double min, double max) {
        this.min = min;
        this.span = max - min;
    }

    @Override
    public double valueAt(double fraction) {
        return fraction * span + min;
    }

    @Override
    public String getName() {
        return "linear";
    }
}
