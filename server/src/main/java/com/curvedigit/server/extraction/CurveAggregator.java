package com.curvedigit.server.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns the raw point cloud of one base color into a clean series: fixed-width x bins, MAD
 * outlier rejection inside each bin, dispersion gating, then Savitzky-Golay smoothing of y.
 */
public class CurveAggregator {
    private static final Logger logger = LoggerFactory.getLogger(CurveAggregator.class);

    public static final double DEFAULT_BIN_WIDTH = 0.01;
    public static final double DEFAULT_MAX_BIN_STD = 0.3;
    public static final double DEFAULT_MAD_MULTIPLIER = 2.0;
    public static final int DEFAULT_POLY_ORDER = 3;

    private static final double MAD_EPSILON = 1e-6;

    private final double binWidth;
    private final double maxBinStd;
    private final double madMultiplier;
    private final ColorTuningTable tuning;
    private final SavitzkyGolaySmoother smoother;

    public CurveAggregator(ColorTuningTable tuning) {
        this(DEFAULT_BIN_WIDTH, DEFAULT_MAX_BIN_STD, DEFAULT_MAD_MULTIPLIER, DEFAULT_POLY_ORDER, tuning);
    }

    public CurveAggregator(double binWidth, double maxBinStd, double madMultiplier, int polyOrder,
            ColorTuningTable tuning) {
        if (binWidth <= 0) {
            throw new IllegalArgumentException("binWidth must be positive");
        }
        this.binWidth = binWidth;
        this.maxBinStd = maxBinStd;
        this.madMultiplier = madMultiplier;
        this.tuning = tuning != null ? tuning : ColorTuningTable.defaults();
        this.smoother = new SavitzkyGolaySmoother(polyOrder);
    }

    public double getBinWidth() {
        return binWidth;
    }

    public CurveSeries aggregate(String baseColor, MappedPoints points) {
        return aggregate(baseColor, points.getXs(), points.getYs());
    }

    public CurveSeries aggregate(String baseColor, double[] xs, double[] ys) {
        // Nearest-bin rounding, half to even; the TreeMap keeps bins in x order
        Map<Long, List<Double>> bins = new TreeMap<>();
        for (int i = 0; i < xs.length; i++) {
            long key = (long) Math.rint(xs[i] / binWidth);
            bins.computeIfAbsent(key, k -> new ArrayList<>()).add(ys[i]);
        }

        List<CurvePoint> points = new ArrayList<>(bins.size());
        int dropped = 0;
        for (Map.Entry<Long, List<Double>> e : bins.entrySet()) {
            Double y = robustMean(e.getValue());
            if (y == null) {
                dropped++;
                continue;
            }
            points.add(new CurvePoint(e.getKey() * binWidth, y));
        }
        points.sort(Comparator.comparingDouble(CurvePoint::getX));

        int window = tuning.smoothingWindow(baseColor);
        if (points.size() > window) {
            points = smoothY(points, window);
        }

        logger.debug("{}: {} raw points -> {} bins, {} dropped as too dispersed, window={}",
                baseColor, xs.length, points.size(), dropped, window);
        return new CurveSeries(baseColor, baseColor, points, dropped);
    }

    /**
     * Mean of the values within {@code madMultiplier * MAD} of the median, or null when the bin is
     * empty after rejection or still too spread out.
     */
    Double robustMean(List<Double> values) {
        double[] y = new double[values.size()];
        for (int i = 0; i < y.length; i++) {
            y[i] = values.get(i);
        }
        double median = RobustStats.median(y);
        double limit = madMultiplier * (RobustStats.mad(y, median) + MAD_EPSILON);

        double[] kept = new double[y.length];
        int n = 0;
        for (double v : y) {
            if (Math.abs(v - median) < limit) {
                kept[n++] = v;
            }
        }
        if (n == 0) {
            return null;
        }
        double[] filtered = Arrays.copyOf(kept, n);
        if (RobustStats.populationStd(filtered) > maxBinStd) {
            return null;
        }
        return RobustStats.mean(filtered);
    }

    private List<CurvePoint> smoothY(List<CurvePoint> points, int window) {
        double[] y = new double[points.size()];
        for (int i = 0; i < y.length; i++) {
            y[i] = points.get(i).getY();
        }
        double[] smoothed = smoother.smooth(y, window);
        List<CurvePoint> out = new ArrayList<>(points.size());
        for (int i = 0; i < smoothed.length; i++) {
            out.add(new CurvePoint(points.get(i).getX(), smoothed[i]));
        }
        return out;
    }
}
