package com.curvedigit.server.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ExtractionResult {
    private final Map<String, CurveSeries> curves;
    private final AxisCalibration calibration;
    private final int gridSizeEstimate;
    private final List<String> skippedColors;

    public ExtractionResult(Map<String, CurveSeries> curves, AxisCalibration calibration, int gridSizeEstimate,
            List<String> skippedColors) {
        this.curves = Collections.unmodifiableMap(new LinkedHashMap<>(curves));
        this.calibration = calibration;
        this.gridSizeEstimate = gridSizeEstimate;
        this.skippedColors = List.copyOf(skippedColors);
    }

    /**
     * Series keyed by base color, in color-table order.
     */
    public Map<String, CurveSeries> getCurves() {
        return curves;
    }

    public CurveSeries getCurve(String baseColor) {
        return curves.get(baseColor);
    }

    public AxisCalibration getCalibration() {
        return calibration;
    }

    /**
     * Grid lines per axis estimated from the canvas spectrum. Diagnostic only.
     */
    public int getGridSizeEstimate() {
        return gridSizeEstimate;
    }

    /**
     * Base colors that were configured but had no pixels left after filtering.
     */
    public List<String> getSkippedColors() {
        return skippedColors;
    }

    public int getTotalPoints() {
        int total = 0;
        for (CurveSeries s : curves.values()) {
            total += s.size();
        }
        return total;
    }
}
