package com.curvedigit.server.extraction.config;

import com.curvedigit.server.extraction.ColorSpec;

public class ColorSpecConfig {
    public String name;
    public int[] lower;
    public int[] upper;
    public String baseColor;

    public ColorSpecConfig() {
    }

    public ColorSpecConfig(String name, int[] lower, int[] upper, String baseColor) {
        this.name = name;
        this.lower = lower;
        this.upper = upper;
        this.baseColor = baseColor;
    }

    public ColorSpec toColorSpec() {
        return new ColorSpec(name, lower, upper, baseColor);
    }
}
