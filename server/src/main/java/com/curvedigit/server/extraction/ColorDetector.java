package com.curvedigit.server.extraction;

import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reports which configured colors appear in an image, before any boundary detection, so an
 * operator can pick the curves to extract.
 */
public class ColorDetector {

    static {
        OpenCV.loadLocally();
    }

    public static final int DEFAULT_MIN_PIXELS = 500;
    private static final double FULL_CONFIDENCE_PIXELS = 1000.0;

    private final int minPixels;

    public ColorDetector() {
        this(DEFAULT_MIN_PIXELS);
    }

    public ColorDetector(int minPixels) {
        this.minPixels = minPixels;
    }

    /**
     * @return colors with more than {@code minPixels} matching pixels, most frequent first
     */
    public List<DetectedColor> detect(RasterImage image, List<ColorSpec> specs) {
        Mat bgr = image.getMat();
        Mat hsv = ColorSegmenter.toHsv(bgr);
        List<DetectedColor> found = new ArrayList<>();
        try {
            for (ColorSpec spec : specs) {
                Mat mask = ColorSegmenter.threshold(hsv, spec);
                try {
                    int count = Core.countNonZero(mask);
                    if (count <= minPixels) {
                        continue;
                    }
                    Scalar avg = Core.mean(bgr, mask);
                    found.add(new DetectedColor(spec.getName(), spec.getBaseColor(), toHex(avg), count,
                            Math.min(count / FULL_CONFIDENCE_PIXELS, 1.0)));
                } finally {
                    mask.release();
                }
            }
        } finally {
            hsv.release();
        }
        found.sort(Comparator.comparingInt(DetectedColor::getPixelCount).reversed());
        return found;
    }

    static String toHex(Scalar bgr) {
        int b = (int) bgr.val[0];
        int g = (int) bgr.val[1];
        int r = (int) bgr.val[2];
        return String.format("#%02x%02x%02x", r, g, b);
    }
}
