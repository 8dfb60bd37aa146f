package com.curvedigit.server.extraction.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calibration template for a common datasheet graph, e.g. output characteristics (Id vs Vds).
 * {@code xScale}/{@code yScale} are display multipliers applied to the finished series.
 */
public class GraphPreset {
    public String xAxis = "X";
    public String yAxis = "Y";
    public String thirdColumn = "Label";
    public double xMin = 0;
    public double xMax = 10;
    public double yMin = 0;
    public double yMax = 100;
    public double xScale = 1;
    public double yScale = 1;
    public String xScaleType = "linear";
    public String yScaleType = "linear";
    // base color -> curve label, e.g. red -> "Vgs=5"
    public Map<String, String> labels = new LinkedHashMap<>();

    public GraphPreset() {
    }

    public GraphPreset(String xAxis, String yAxis, String thirdColumn, double xMin, double xMax, double yMin,
            double yMax, double xScale, double yScale, Map<String, String> labels) {
        this.xAxis = xAxis;
        this.yAxis = yAxis;
        this.thirdColumn = thirdColumn;
        this.xMin = xMin;
        this.xMax = xMax;
        this.yMin = yMin;
        this.yMax = yMax;
        this.xScale = xScale;
        this.yScale = yScale;
        this.labels = new LinkedHashMap<>(labels);
    }
}
