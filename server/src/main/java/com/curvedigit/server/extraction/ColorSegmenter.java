package com.curvedigit.server.extraction;

import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thresholds a BGR image into one binary mask (0 or 255) per color spec.
 */
public class ColorSegmenter {

    static {
        OpenCV.loadLocally();
    }

    /**
     * @return masks keyed by spec, in the order of {@code specs}; the caller releases them
     */
    public Map<ColorSpec, Mat> segment(Mat bgr, List<ColorSpec> specs) {
        Mat hsv = toHsv(bgr);
        try {
            Map<ColorSpec, Mat> masks = new LinkedHashMap<>();
            for (ColorSpec spec : specs) {
                masks.put(spec, threshold(hsv, spec));
            }
            return masks;
        } finally {
            hsv.release();
        }
    }

    public static Mat toHsv(Mat bgr) {
        Mat hsv = new Mat();
        Imgproc.cvtColor(bgr, hsv, Imgproc.COLOR_BGR2HSV);
        return hsv;
    }

    public static Mat threshold(Mat hsv, ColorSpec spec) {
        int[] lo = spec.getLower();
        int[] hi = spec.getUpper();
        Mat mask = new Mat();
        Core.inRange(hsv, new Scalar(lo[0], lo[1], lo[2]), new Scalar(hi[0], hi[1], hi[2]), mask);
        return mask;
    }
}
