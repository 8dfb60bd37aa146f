package com.curvedigit.server.extraction;

public class DetectedColor {
    private final String name;
    private final String baseColor;
    private final String hexColor;
    private final int pixelCount;
    private final double confidence;

    public DetectedColor(String name, String baseColor, String hexColor, int pixelCount, double confidence) {
        this.name = name;
        this.baseColor = baseColor;
        this.hexColor = hexColor;
        this.pixelCount = pixelCount;
        this.confidence = confidence;
    }

    public String getName() {
        return name;
    }

    public String getBaseColor() {
        return baseColor;
    }

    /**
     * Average BGR of the matching pixels rendered as {@code #rrggbb}.
     */
    public String getHexColor() {
        return hexColor;
    }

    public int getPixelCount() {
        return pixelCount;
    }

    public double getConfidence() {
        return confidence;
    }
}
