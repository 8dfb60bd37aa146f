package com.curvedigit.server.extraction.config;

import com.curvedigit.server.extraction.ColorDetector;
import com.curvedigit.server.extraction.ColorSpec;
import com.curvedigit.server.extraction.ColorTuning;
import com.curvedigit.server.extraction.ColorTuningTable;
import com.curvedigit.server.extraction.CurveAggregator;
import com.curvedigit.server.extraction.ImageNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of {@code extraction_config.json}. Every field is optional; absent values fall back to the
 * built-in tables.
 */
public class ExtractionConfig {
    public Integer canvasSize;
    public Double binWidth;
    public Double maxBinStd;
    public Double madMultiplier;
    public Integer polyOrder;
    public Integer workerThreads;
    public Integer detectMinPixels;
    public List<ColorSpecConfig> colors;
    public ColorTuning defaultTuning;
    public Map<String, ColorTuning> tuning;
    public Map<String, GraphPreset> presets;

    public int resolveCanvasSize() {
        return canvasSize != null ? canvasSize : ImageNormalizer.DEFAULT_CANVAS_SIZE;
    }

    public double resolveBinWidth() {
        return binWidth != null ? binWidth : CurveAggregator.DEFAULT_BIN_WIDTH;
    }

    public double resolveMaxBinStd() {
        return maxBinStd != null ? maxBinStd : CurveAggregator.DEFAULT_MAX_BIN_STD;
    }

    public double resolveMadMultiplier() {
        return madMultiplier != null ? madMultiplier : CurveAggregator.DEFAULT_MAD_MULTIPLIER;
    }

    public int resolvePolyOrder() {
        return polyOrder != null ? polyOrder : CurveAggregator.DEFAULT_POLY_ORDER;
    }

    public int resolveWorkerThreads() {
        return workerThreads != null && workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }

    public int resolveDetectMinPixels() {
        return detectMinPixels != null ? detectMinPixels : ColorDetector.DEFAULT_MIN_PIXELS;
    }

    public List<ColorSpec> toColorSpecs() {
        List<ColorSpecConfig> source = colors != null && !colors.isEmpty() ? colors : builtIn().colors;
        List<ColorSpec> specs = new ArrayList<>(source.size());
        for (ColorSpecConfig c : source) {
            specs.add(c.toColorSpec());
        }
        return specs;
    }

    public ColorTuningTable toTuningTable() {
        Map<String, ColorTuning> table = tuning != null ? tuning : builtIn().tuning;
        return new ColorTuningTable(table, defaultTuning != null ? defaultTuning : ColorTuning.defaults());
    }

    public Map<String, GraphPreset> resolvePresets() {
        return presets != null ? presets : builtIn().presets;
    }

    /**
     * The stock tables: nine HSV ranges (red split across the hue wrap), thick-line tolerance for
     * red and blue, and the four datasheet graph presets plus a custom one.
     */
    public static ExtractionConfig builtIn() {
        ExtractionConfig cfg = new ExtractionConfig();
        cfg.colors = new ArrayList<>();
        cfg.colors.add(range("red", 0, 10, "red"));
        cfg.colors.add(range("red2", 170, 180, "red"));
        cfg.colors.add(range("blue", 90, 130, "blue"));
        cfg.colors.add(range("green", 40, 80, "green"));
        cfg.colors.add(range("yellow", 15, 40, "yellow"));
        cfg.colors.add(range("cyan", 80, 100, "cyan"));
        cfg.colors.add(range("magenta", 140, 170, "magenta"));
        cfg.colors.add(range("orange", 5, 20, "orange"));
        cfg.colors.add(range("purple", 125, 145, "purple"));

        cfg.defaultTuning = ColorTuning.defaults();
        cfg.tuning = new LinkedHashMap<>();
        cfg.tuning.put("red", new ColorTuning(ColorTuning.DEFAULT_MIN_COMPONENT_AREA, 20));
        cfg.tuning.put("blue", new ColorTuning(ColorTuning.DEFAULT_MIN_COMPONENT_AREA, 17));

        cfg.presets = new LinkedHashMap<>();
        cfg.presets.put("output", new GraphPreset("Vds", "Id", "Vgs", 0, 3, 0, 2.75, 1, 10,
                Map.of("red", "5", "blue", "2", "green", "4", "yellow", "3")));
        cfg.presets.put("transfer", new GraphPreset("Vgs", "Id", "Temperature", 0, 5, 0, 2.75, 1, 10,
                Map.of("red", "25", "blue", "125")));
        cfg.presets.put("capacitance", new GraphPreset("Vds", "C", "Type", 0, 15, 0, 10, 1, 10,
                Map.of("red", "Coss", "green", "Ciss", "yellow", "Crss")));
        cfg.presets.put("resistance", new GraphPreset("Vgs", "Rds", "Temp", 0, 5, 0, 8, 1, 10,
                Map.of("red", "25", "blue", "125")));
        cfg.presets.put("custom", new GraphPreset("X", "Y", "Label", 0, 10, 0, 100, 1, 1, Map.of()));
        return cfg;
    }

    private static ColorSpecConfig range(String name, int hueLow, int hueHigh, String base) {
        return new ColorSpecConfig(name, new int[] { hueLow, 100, 100 }, new int[] { hueHigh, 255, 255 }, base);
    }
}
