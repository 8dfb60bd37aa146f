package com.curvedigit.server.extraction;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Estimates how many grid lines the canvas carries from peaks in its magnitude spectrum.
 * The value is informational; no later stage reads it.
 */
public class GridSizeEstimator {
    private static final Logger logger = LoggerFactory.getLogger(GridSizeEstimator.class);

    public static final int DEFAULT_GRID_SIZE = 10;
    public static final int MIN_GRID_SIZE = 5;
    public static final int MAX_GRID_SIZE = 50;

    private static final int CROP_HALF = 100;
    private static final double PEAK_PERCENTILE = 99.5;
    private static final int MIN_PEAKS = 4;

    public int estimate(Mat canvasBgr) {
        return estimateFromSpectrum(shiftedLogMagnitude(canvasBgr));
    }

    /**
     * Peak radii in the central crop of a centred log spectrum, inverted into a grid count.
     */
    int estimateFromSpectrum(double[][] spectrum) {
        int rows = spectrum.length;
        int cols = spectrum[0].length;
        int crow = rows / 2;
        int ccol = cols / 2;
        int half = Math.min(CROP_HALF, Math.min(crow, ccol));
        if (half == 0) {
            logger.warn("Canvas too small for spectral grid detection. Defaulting to {}x{}.",
                    DEFAULT_GRID_SIZE, DEFAULT_GRID_SIZE);
            return DEFAULT_GRID_SIZE;
        }

        int side = 2 * half;
        double[] crop = new double[side * side];
        int idx = 0;
        for (int r = 0; r < side; r++) {
            for (int c = 0; c < side; c++) {
                crop[idx++] = spectrum[crow - half + r][ccol - half + c];
            }
        }

        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        double threshold = percentile.evaluate(crop, PEAK_PERCENTILE);

        List<Double> distances = new ArrayList<>();
        for (int r = 0; r < side; r++) {
            for (int c = 0; c < side; c++) {
                if (crop[r * side + c] > threshold) {
                    distances.add(Math.hypot(r - half, c - half));
                }
            }
        }

        if (distances.size() < MIN_PEAKS) {
            logger.warn("Unable to detect grid frequency reliably. Defaulting to {}x{}.",
                    DEFAULT_GRID_SIZE, DEFAULT_GRID_SIZE);
            return DEFAULT_GRID_SIZE;
        }

        double[] d = new double[distances.size()];
        for (int i = 0; i < d.length; i++) {
            d[i] = distances.get(i);
        }
        double dominantFreq = new Median().evaluate(d) / half;
        double inverted = 1.0 / dominantFreq;
        int gridSize = Double.isFinite(inverted) ? (int) inverted : MAX_GRID_SIZE;
        gridSize = Math.max(MIN_GRID_SIZE, Math.min(MAX_GRID_SIZE, gridSize));
        logger.debug("Detected grid size {}x{} from {} spectral peaks", gridSize, gridSize, d.length);
        return gridSize;
    }

    /**
     * {@code 20 ln(|F| + 1)} of the grayscale canvas with the zero frequency moved to the center.
     */
    static double[][] shiftedLogMagnitude(Mat canvasBgr) {
        Mat gray = new Mat();
        Mat floats = new Mat();
        Mat complex = new Mat();
        Mat magnitude = new Mat();
        List<Mat> planes = new ArrayList<>();
        try {
            if (canvasBgr.channels() == 3) {
                Imgproc.cvtColor(canvasBgr, gray, Imgproc.COLOR_BGR2GRAY);
            } else {
                canvasBgr.copyTo(gray);
            }
            gray.convertTo(floats, CvType.CV_32F);
            Core.dft(floats, complex, Core.DFT_COMPLEX_OUTPUT, 0);
            Core.split(complex, planes);
            Core.magnitude(planes.get(0), planes.get(1), magnitude);

            int rows = magnitude.rows();
            int cols = magnitude.cols();
            float[] raw = new float[rows * cols];
            magnitude.get(0, 0, raw);

            double[][] shifted = new double[rows][cols];
            int dr = rows / 2;
            int dc = cols / 2;
            for (int r = 0; r < rows; r++) {
                int sr = (r + dr) % rows;
                for (int c = 0; c < cols; c++) {
                    shifted[sr][(c + dc) % cols] = 20.0 * Math.log(raw[r * cols + c] + 1.0);
                }
            }
            return shifted;
        } finally {
            gray.release();
            floats.release();
            complex.release();
            magnitude.release();
            for (Mat p : planes) {
                p.release();
            }
        }
    }
}
