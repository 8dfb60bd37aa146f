package com.curvedigit.server.extraction;

/**
 * Raw logical coordinates of every surviving mask pixel of one base color, in row-major pixel order.
 */
public class MappedPoints {
    private final double[] xs;
    private final double[] ys;

    public MappedPoints(double[] xs, double[] ys) {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("x and y arrays differ in length: " + xs.length + " vs " + ys.length);
        }
        this.xs = xs;
        this.ys = ys;
    }

    public double[] getXs() {
        return xs;
    }

    public double[] getYs() {
        return ys;
    }

    public int size() {
        return xs.length;
    }

    public boolean isEmpty() {
        return xs.length == 0;
    }
}
