package com.curvedigit.server.extraction;

/**
 * Per-base-color noise thresholds. Public fields so the JSON config maps straight onto it.
 */
public class ColorTuning {
    public static final int DEFAULT_MIN_COMPONENT_AREA = 1400;
    public static final int DEFAULT_SMOOTHING_WINDOW = 11;

    public int minComponentArea = DEFAULT_MIN_COMPONENT_AREA;
    public int smoothingWindow = DEFAULT_SMOOTHING_WINDOW;

    public ColorTuning() {
    }

    public ColorTuning(int minComponentArea, int smoothingWindow) {
        this.minComponentArea = minComponentArea;
        this.smoothingWindow = smoothingWindow;
    }

    public static ColorTuning defaults() {
        return new ColorTuning(DEFAULT_MIN_COMPONENT_AREA, DEFAULT_SMOOTHING_WINDOW);
    }

    public ColorTuning copy() {
        return new ColorTuning(minComponentArea, smoothingWindow);
    }

    @Override
    public String toString() {
        return "ColorTuning{minComponentArea=" + minComponentArea + ", smoothingWindow=" + smoothingWindow + '}';
    }
}
