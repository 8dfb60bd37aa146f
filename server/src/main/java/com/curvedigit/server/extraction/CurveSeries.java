package com.curvedigit.server.extraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One digitized curve: points ordered by non-decreasing x.
 */
public class CurveSeries {
    private final String baseColor;
    private final String label;
    private final List<CurvePoint> points;
    // bins rejected as too dispersed (curve crossings, legend overlap)
    private final int droppedBins;

    public CurveSeries(String baseColor, String label, List<CurvePoint> points, int droppedBins) {
        this.baseColor = baseColor;
        this.label = label != null ? label : baseColor;
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
        this.droppedBins = droppedBins;
    }

    public String getBaseColor() {
        return baseColor;
    }

    public String getLabel() {
        return label;
    }

    public List<CurvePoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public int getDroppedBins() {
        return droppedBins;
    }

    public CurveSeries withLabel(String newLabel) {
        return new CurveSeries(baseColor, newLabel, points, droppedBins);
    }

    /**
     * Multiplies every coordinate by display factors, e.g. to turn amperes into milliamperes.
     */
    public CurveSeries scaled(double xFactor, double yFactor) {
        List<CurvePoint> out = new ArrayList<>(points.size());
        for (CurvePoint p : points) {
            out.add(new CurvePoint(p.getX() * xFactor, p.getY() * yFactor));
        }
        return new CurveSeries(baseColor, label, out, droppedBins);
    }
}
