package com.curvedigit.server.service;

import com.curvedigit.server.extraction.AxisCalibration;
import com.curvedigit.server.extraction.ColorDetector;
import com.curvedigit.server.extraction.ColorTuningTable;
import com.curvedigit.server.extraction.ComponentFilter;
import com.curvedigit.server.extraction.CurveAggregator;
import com.curvedigit.server.extraction.CurveExtractionEngine;
import com.curvedigit.server.extraction.CurveSeries;
import com.curvedigit.server.extraction.DetectedColor;
import com.curvedigit.server.extraction.ExtractionResult;
import com.curvedigit.server.extraction.GridSizeEstimator;
import com.curvedigit.server.extraction.ImageNormalizer;
import com.curvedigit.server.extraction.QuadCorners;
import com.curvedigit.server.extraction.RasterImage;
import com.curvedigit.server.extraction.ScaleType;
import com.curvedigit.server.extraction.config.ExtractionConfig;
import com.curvedigit.server.extraction.config.GraphPreset;
import com.curvedigit.server.util.ExtractionConfigLoader;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

@Service
public class CurveExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(CurveExtractionService.class);

    private static final String DEFAULT_PRESET = "custom";

    private ExtractionConfig config;
    private ImageNormalizer normalizer;
    private CurveExtractionEngine engine;
    private ColorDetector colorDetector;
    private ExecutorService workers;

    public CurveExtractionService() {
    }

    public CurveExtractionService(ExtractionConfig config) {
        this.config = config;
    }

    @PostConstruct
    public synchronized void init() {
        if (engine != null) {
            return;
        }
        if (config == null) {
            config = ExtractionConfigLoader.load();
        }
        ColorTuningTable tuning = config.toTuningTable();
        int threads = config.resolveWorkerThreads();
        workers = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "curve-worker");
            t.setDaemon(true);
            return t;
        });

        normalizer = new ImageNormalizer(config.resolveCanvasSize(), new GridSizeEstimator());
        CurveAggregator aggregator = new CurveAggregator(config.resolveBinWidth(), config.resolveMaxBinStd(),
                config.resolveMadMultiplier(), config.resolvePolyOrder(), tuning);
        engine = new CurveExtractionEngine(config.toColorSpecs(), normalizer, new ComponentFilter(tuning),
                aggregator, workers);
        colorDetector = new ColorDetector(config.resolveDetectMinPixels());

        logger.info("Curve extraction ready: {} color specs, canvas {}px, bin width {}, {} worker threads",
                engine.getColorSpecs().size(), config.resolveCanvasSize(), config.resolveBinWidth(), threads);
    }

    @PreDestroy
    public void shutdown() {
        if (workers == null) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public Map<String, GraphPreset> getPresets() {
        init();
        return config.resolvePresets();
    }

    public GraphPreset getPresetOrDefault(String name) {
        Map<String, GraphPreset> presets = getPresets();
        String key = name != null && !name.isEmpty() ? name : DEFAULT_PRESET;
        GraphPreset preset = presets.get(key);
        if (preset == null) {
            if (name != null && !name.isEmpty()) {
                throw new IllegalArgumentException("Unknown graph preset: " + name);
            }
            return new GraphPreset();
        }
        return preset;
    }

    /**
     * Request values win over preset values, field by field.
     */
    public AxisCalibration resolveCalibration(ExtractionRequest request) {
        GraphPreset preset = getPresetOrDefault(request.preset);
        double xMin = request.xMin != null ? request.xMin : preset.xMin;
        double xMax = request.xMax != null ? request.xMax : preset.xMax;
        double yMin = request.yMin != null ? request.yMin : preset.yMin;
        double yMax = request.yMax != null ? request.yMax : preset.yMax;
        ScaleType xType = request.xScaleType != null ? ScaleType.parse(request.xScaleType) : presetScale(preset.xScaleType);
        ScaleType yType = request.yScaleType != null ? ScaleType.parse(request.yScaleType) : presetScale(preset.yScaleType);
        return new AxisCalibration(xMin, xMax, yMin, yMax, xType, yType);
    }

    // config-supplied values; unknown types fall back to linear
    private static ScaleType presetScale(String value) {
        try {
            return ScaleType.parse(value);
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown scale type '{}' in preset, defaulting to 'linear'", value);
            return ScaleType.LINEAR;
        }
    }

    /**
     * Runs the engine and applies the preset's labels and display multipliers.
     */
    public ExtractionResult extract(RasterImage image, ExtractionRequest request) {
        init();
        GraphPreset preset = getPresetOrDefault(request.preset);
        AxisCalibration calibration = resolveCalibration(request);

        Map<String, String> labels = new LinkedHashMap<>(preset.labels);
        if (request.labels != null) {
            labels.putAll(request.labels);
        }
        logger.info("Extracting curves: preset={}, {}, colors={}", request.preset, calibration, request.colors);
        ExtractionResult raw = engine.extract(image, calibration, request.colors, labels);

        double xFactor = request.xScale != null ? request.xScale : preset.xScale;
        double yFactor = request.yScale != null ? request.yScale : preset.yScale;
        if (xFactor == 1.0 && yFactor == 1.0) {
            return raw;
        }
        Map<String, CurveSeries> scaled = new LinkedHashMap<>();
        for (Map.Entry<String, CurveSeries> e : raw.getCurves().entrySet()) {
            scaled.put(e.getKey(), e.getValue().scaled(xFactor, yFactor));
        }
        return new ExtractionResult(scaled, raw.getCalibration(), raw.getGridSizeEstimate(), raw.getSkippedColors());
    }

    /**
     * Plot boundary corners in source-image pixels, ordered top-left, top-right, bottom-right, bottom-left.
     */
    public QuadCorners detectBoundary(RasterImage image) {
        init();
        return normalizer.detectCorners(image.getMat());
    }

    public List<DetectedColor> detectColors(RasterImage image) {
        init();
        return colorDetector.detect(image, engine.getColorSpecs());
    }
}
