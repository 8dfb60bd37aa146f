package com.curvedigit.server.extraction;

import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Digitizes one graph image: normalize, segment, filter, map, aggregate.
 * <p>
 * Holds only immutable configuration, so one instance serves concurrent calls. Base colors are
 * independent after segmentation; with an executor they are processed in parallel and gathered
 * in color-table order.
 */
public class CurveExtractionEngine {
    private static final Logger logger = LoggerFactory.getLogger(CurveExtractionEngine.class);

    private final List<ColorSpec> colorSpecs;
    private final ImageNormalizer normalizer;
    private final ColorSegmenter segmenter;
    private final ComponentFilter componentFilter;
    private final CoordinateMapper mapper;
    private final CurveAggregator aggregator;
    private final Executor executor;

    public CurveExtractionEngine(List<ColorSpec> colorSpecs, ImageNormalizer normalizer, ComponentFilter componentFilter,
            CurveAggregator aggregator, Executor executor) {
        if (colorSpecs == null || colorSpecs.isEmpty()) {
            throw new IllegalArgumentException("At least one color spec is required");
        }
        this.colorSpecs = List.copyOf(colorSpecs);
        this.normalizer = normalizer;
        this.segmenter = new ColorSegmenter();
        this.componentFilter = componentFilter;
        this.mapper = new CoordinateMapper();
        this.aggregator = aggregator;
        this.executor = executor;
    }

    /**
     * Engine with default thresholds, running colors on the calling thread.
     */
    public static CurveExtractionEngine withDefaults(List<ColorSpec> colorSpecs, ColorTuningTable tuning) {
        return new CurveExtractionEngine(colorSpecs, new ImageNormalizer(), new ComponentFilter(tuning),
                new CurveAggregator(tuning), null);
    }

    public List<ColorSpec> getColorSpecs() {
        return colorSpecs;
    }

    public ExtractionResult extract(RasterImage image, AxisCalibration calibration) {
        return extract(image, calibration, null, Map.of());
    }

    /**
     * @param baseColors base colors to extract, or null/empty for every configured color
     * @param labels     curve labels keyed by base color; missing entries use the color name
     * @throws CalibrationException   before any pixel is processed if the calibration is invalid
     * @throws GridDetectionException if the plot boundary is not a quadrilateral
     */
    public ExtractionResult extract(RasterImage image, AxisCalibration calibration, List<String> baseColors,
            Map<String, String> labels) {
        calibration.validate();
        List<ColorSpec> specs = selectSpecs(baseColors);

        long start = System.currentTimeMillis();
        try (NormalizedCanvas canvas = normalizer.normalize(image)) {
            Map<ColorSpec, Mat> specMasks = segmenter.segment(canvas.getCanvas(), specs);
            Map<String, Mat> merged;
            try {
                merged = componentFilter.mergeByBaseColor(specMasks);
            } finally {
                specMasks.values().forEach(Mat::release);
            }

            Map<String, CompletableFuture<CurveSeries>> pending = new LinkedHashMap<>();
            Map<String, CurveSeries> curves = new LinkedHashMap<>();
            List<String> skipped = new ArrayList<>();
            try {
                for (Map.Entry<String, Mat> e : merged.entrySet()) {
                    String base = e.getKey();
                    Mat mask = e.getValue();
                    pending.put(base, submit(() -> processColor(base, mask, calibration)));
                }
                for (Map.Entry<String, CompletableFuture<CurveSeries>> e : pending.entrySet()) {
                    CurveSeries series = join(e.getValue());
                    if (series == null) {
                        skipped.add(e.getKey());
                        continue;
                    }
                    String label = labels != null ? labels.get(e.getKey()) : null;
                    curves.put(e.getKey(), label != null ? series.withLabel(label) : series);
                }
            } finally {
                // masks are native memory; no worker may still be reading them
                for (CompletableFuture<CurveSeries> f : pending.values()) {
                    f.handle((r, t) -> null).join();
                }
                merged.values().forEach(Mat::release);
            }

            logger.info("Extracted {} curves ({} colors empty) in {} ms", curves.size(), skipped.size(),
                    System.currentTimeMillis() - start);
            return new ExtractionResult(curves, calibration, canvas.getGridSizeEstimate(), skipped);
        }
    }

    /**
     * @return the series, or null when nothing of this color survives filtering
     */
    private CurveSeries processColor(String baseColor, Mat merged, AxisCalibration calibration) {
        Mat cleaned = componentFilter.clean(baseColor, merged);
        MappedPoints points;
        try {
            points = mapper.map(cleaned, calibration);
        } finally {
            cleaned.release();
        }
        if (points.isEmpty()) {
            logger.debug("No points detected for color {}", baseColor);
            return null;
        }
        logger.debug("Detected {} points for color {}", points.size(), baseColor);
        CurveSeries series = aggregator.aggregate(baseColor, points);
        return series.size() > 0 ? series : null;
    }

    private List<ColorSpec> selectSpecs(List<String> baseColors) {
        if (baseColors == null || baseColors.isEmpty()) {
            return colorSpecs;
        }
        List<ColorSpec> selected = new ArrayList<>();
        for (ColorSpec spec : colorSpecs) {
            if (baseColors.contains(spec.getBaseColor()) || baseColors.contains(spec.getName())) {
                selected.add(spec);
            }
        }
        if (selected.isEmpty()) {
            throw new IllegalArgumentException("None of the requested colors are configured: " + baseColors);
        }
        return selected;
    }

    private CompletableFuture<CurveSeries> submit(Supplier<CurveSeries> task) {
        if (executor == null) {
            return CompletableFuture.completedFuture(task.get());
        }
        return CompletableFuture.supplyAsync(task, executor);
    }

    private static CurveSeries join(CompletableFuture<CurveSeries> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new CurveExtractionException("Color processing failed", cause);
        }
    }
}
