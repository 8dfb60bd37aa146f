package com.curvedigit.server.extraction;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable per-base-color tuning with a fallback for colors that are not listed.
 */
public class ColorTuningTable {
    private final Map<String, ColorTuning> byColor;
    private final ColorTuning fallback;

    public ColorTuningTable(Map<String, ColorTuning> byColor, ColorTuning fallback) {
        Map<String, ColorTuning> copy = new HashMap<>();
        if (byColor != null) {
            for (Map.Entry<String, ColorTuning> e : byColor.entrySet()) {
                copy.put(e.getKey(), e.getValue().copy());
            }
        }
        this.byColor = Collections.unmodifiableMap(copy);
        this.fallback = fallback != null ? fallback.copy() : ColorTuning.defaults();
    }

    public static ColorTuningTable defaults() {
        return new ColorTuningTable(Map.of(), ColorTuning.defaults());
    }

    public int minComponentArea(String baseColor) {
        return lookup(baseColor).minComponentArea;
    }

    public int smoothingWindow(String baseColor) {
        return lookup(baseColor).smoothingWindow;
    }

    private ColorTuning lookup(String baseColor) {
        ColorTuning t = byColor.get(baseColor);
        return t != null ? t : fallback;
    }
}
