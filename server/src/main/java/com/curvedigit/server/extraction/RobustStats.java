package com.curvedigit.server.extraction;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;

public class RobustStats {

    public static double median(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("median of an empty sample");
        }
        return new Median().evaluate(values);
    }

    /**
     * Median absolute deviation around {@code center}.
     */
    public static double mad(double[] values, double center) {
        double[] dev = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            dev[i] = Math.abs(values[i] - center);
        }
        return median(dev);
    }

    public static double mean(double[] values) {
        return new Mean().evaluate(values);
    }

    /**
     * Population standard deviation (divides by n, not n - 1).
     */
    public static double populationStd(double[] values) {
        return new StandardDeviation(false).evaluate(values);
    }
}
