package com.curvedigit.server.extraction;

import java.util.Arrays;

/**
 * An inclusive HSV range (8-bit convention: H 0..180, S and V 0..255) feeding one base color.
 */
public class ColorSpec {
    private final String name;
    private final int[] lower;
    private final int[] upper;
    private final String baseColor;

    public ColorSpec(String name, int[] lower, int[] upper, String baseColor) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("ColorSpec name must not be empty");
        }
        if (lower == null || lower.length != 3 || upper == null || upper.length != 3) {
            throw new IllegalArgumentException("ColorSpec " + name + " needs 3-component HSV bounds");
        }
        this.name = name;
        this.lower = lower.clone();
        this.upper = upper.clone();
        this.baseColor = baseColor != null && !baseColor.isEmpty() ? baseColor : name;
    }

    public String getName() {
        return name;
    }

    public int[] getLower() {
        return lower.clone();
    }

    public int[] getUpper() {
        return upper.clone();
    }

    public String getBaseColor() {
        return baseColor;
    }

    public boolean contains(int h, int s, int v) {
        return h >= lower[0] && h <= upper[0]
                && s >= lower[1] && s <= upper[1]
                && v >= lower[2] && v <= upper[2];
    }

    @Override
    public String toString() {
        return "ColorSpec{" + name + "->" + baseColor + ", " + Arrays.toString(lower) + ".." + Arrays.toString(upper) + '}';
    }
}
