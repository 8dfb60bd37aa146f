package com.curvedigit.server.extraction;

import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merges masks per base color and removes speckle: a 3x3 opening followed by dropping
 * 8-connected components smaller than the color's minimum area.
 */
public class ComponentFilter {

    static {
        OpenCV.loadLocally();
    }

    private static final Logger logger = LoggerFactory.getLogger(ComponentFilter.class);

    private static final int KERNEL_SIZE = 3;
    private static final int CONNECTIVITY = 8;

    private final ColorTuningTable tuning;

    public ComponentFilter(ColorTuningTable tuning) {
        this.tuning = tuning != null ? tuning : ColorTuningTable.defaults();
    }

    /**
     * Union of all masks sharing a base color. A pixel matched by several specs is set once.
     * The input masks are left untouched.
     */
    public Map<String, Mat> mergeByBaseColor(Map<ColorSpec, Mat> masks) {
        Map<String, Mat> merged = new LinkedHashMap<>();
        for (Map.Entry<ColorSpec, Mat> e : masks.entrySet()) {
            String base = e.getKey().getBaseColor();
            Mat acc = merged.get(base);
            if (acc == null) {
                merged.put(base, e.getValue().clone());
            } else {
                Core.bitwise_or(acc, e.getValue(), acc);
            }
        }
        return merged;
    }

    /**
     * @return a new cleaned mask; empty (all zero) when nothing survives
     */
    public Mat clean(String baseColor, Mat mask) {
        int minArea = tuning.minComponentArea(baseColor);

        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(KERNEL_SIZE, KERNEL_SIZE));
        Mat opened = new Mat();
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        try {
            Imgproc.morphologyEx(mask, opened, Imgproc.MORPH_OPEN, kernel);
            int numLabels = Imgproc.connectedComponentsWithStats(opened, labels, stats, centroids,
                    CONNECTIVITY, CvType.CV_32S);

            // label 0 is the background
            boolean[] keep = new boolean[numLabels];
            int kept = 0;
            for (int i = 1; i < numLabels; i++) {
                int area = (int) stats.get(i, Imgproc.CC_STAT_AREA)[0];
                if (area >= minArea) {
                    keep[i] = true;
                    kept++;
                }
            }
            logger.debug("{}: kept {} of {} components (minArea={})", baseColor, kept, numLabels - 1, minArea);

            int rows = labels.rows();
            int cols = labels.cols();
            int[] lab = new int[rows * cols];
            labels.get(0, 0, lab);
            byte[] out = new byte[rows * cols];
            for (int i = 0; i < lab.length; i++) {
                if (keep[lab[i]]) {
                    out[i] = (byte) 255;
                }
            }
            Mat filtered = new Mat(rows, cols, CvType.CV_8UC1);
            filtered.put(0, 0, out);
            return filtered;
        } finally {
            kernel.release();
            opened.release();
            labels.release();
            stats.release();
            centroids.release();
        }
    }
}
