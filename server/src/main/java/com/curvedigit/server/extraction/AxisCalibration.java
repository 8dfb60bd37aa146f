package com.curvedigit.server.extraction;

/**
 * Logical bounds of the plot area. The canvas left edge is {@code xMin}, the bottom edge {@code yMin}.
 */
public class AxisCalibration {
    private final double xMin;
    private final double xMax;
    private final double yMin;
    private final double yMax;
    private final ScaleType xScaleType;
    private final ScaleType yScaleType;

    public AxisCalibration(double xMin, double xMax, double yMin, double yMax) {
        this(xMin, xMax, yMin, yMax, ScaleType.LINEAR, ScaleType.LINEAR);
    }

    public AxisCalibration(double xMin, double xMax, double yMin, double yMax,
            ScaleType xScaleType, ScaleType yScaleType) {
        this.xMin = xMin;
        this.xMax = xMax;
        this.yMin = yMin;
        this.yMax = yMax;
        this.xScaleType = xScaleType != null ? xScaleType : ScaleType.LINEAR;
        this.yScaleType = yScaleType != null ? yScaleType : ScaleType.LINEAR;
    }

    /**
     * Checks the bounds before any pixel is touched.
     *
     * @throws CalibrationException if a range is empty, inverted, not finite, or a log axis starts at or below zero
     */
    public void validate() {
        checkAxis("x", xMin, xMax, xScaleType);
        checkAxis("y", yMin, yMax, yScaleType);
    }

    private static void checkAxis(String axis, double min, double max, ScaleType type) {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new CalibrationException(axis + " bounds must be finite: [" + min + ", " + max + "]");
        }
        if (max <= min) {
            throw new CalibrationException(axis + "_max (" + max + ") must be greater than " + axis + "_min (" + min + ")");
        }
        if (type == ScaleType.LOG && min <= 0) {
            throw new CalibrationException("log-scaled " + axis + " axis needs a positive lower bound, got " + min);
        }
    }

    public double getXMin() {
        return xMin;
    }

    public double getXMax() {
        return xMax;
    }

    public double getYMin() {
        return yMin;
    }

    public double getYMax() {
        return yMax;
    }

    public ScaleType getXScaleType() {
        return xScaleType;
    }

    public ScaleType getYScaleType() {
        return yScaleType;
    }

    @Override
    public String toString() {
        return "AxisCalibration{x=[" + xMin + ", " + xMax + "] " + xScaleType +
                ", y=[" + yMin + ", " + yMax + "] " + yScaleType + '}';
    }
}
