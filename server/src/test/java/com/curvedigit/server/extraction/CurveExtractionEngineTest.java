package com.curvedigit.server.extraction;

import com.curvedigit.server.extraction.config.ExtractionConfig;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.DoubleUnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

public class CurveExtractionEngineTest {

    private static final DoubleUnaryOperator SINE = x -> 50 + 5 * Math.sin(x);
    private static final AxisCalibration CALIBRATION = new AxisCalibration(0, 10, 0, 100);

    private static ExtractionConfig config;
    private static CurveExtractionEngine engine;
    private static ExecutorService workers;

    @BeforeAll
    public static void setup() {
        config = ExtractionConfig.builtIn();
        engine = CurveExtractionEngine.withDefaults(config.toColorSpecs(), config.toTuningTable());
        workers = Executors.newFixedThreadPool(4);
    }

    @AfterAll
    public static void teardown() {
        workers.shutdownNow();
    }

    private static BufferedImage sinePlot() {
        BufferedImage img = SyntheticGraphs.framedPage();
        SyntheticGraphs.drawCurve(img, SINE, 0.5, 9.5, 10, 100, new Color(0, 0, 255), 5f);
        return img;
    }

    @Test
    public void testSinusoidIsDigitized() {
        ExtractionResult result;
        try (RasterImage image = RasterImage.fromBufferedImage(sinePlot())) {
            result = engine.extract(image, CALIBRATION);
        }

        assertEquals(List.of("blue"), List.copyOf(result.getCurves().keySet()));
        assertTrue(result.getSkippedColors().containsAll(List.of("red", "green", "yellow")));
        assertFalse(result.getSkippedColors().contains("blue"));

        CurveSeries blue = result.getCurve("blue");
        assertEquals("blue", blue.getLabel());
        assertTrue(blue.size() > 800, "only " + blue.size() + " points");
        assertEquals(blue.size(), result.getTotalPoints());

        double prev = Double.NEGATIVE_INFINITY;
        for (CurvePoint p : blue.getPoints()) {
            assertFalse(Double.isNaN(p.getY()));
            assertTrue(p.getX() > prev, "x must increase");
            prev = p.getX();
            if (p.getX() > 0.8 && p.getX() < 9.2) {
                assertEquals(SINE.applyAsDouble(p.getX()), p.getY(), 0.6, "at x=" + p.getX());
            }
        }
    }

    @Test
    public void testOnePointPerOccupiedBin() {
        CurveSeries blue;
        Set<Long> bins = new HashSet<>();
        try (RasterImage image = RasterImage.fromBufferedImage(sinePlot())) {
            blue = engine.extract(image, CALIBRATION).getCurve("blue");

            // replay the stages to count the bins the cleaned mask spans
            ComponentFilter filter = new ComponentFilter(config.toTuningTable());
            try (NormalizedCanvas canvas = new ImageNormalizer().normalize(image)) {
                Map<ColorSpec, Mat> masks = new ColorSegmenter().segment(canvas.getCanvas(), config.toColorSpecs());
                Map<String, Mat> merged = filter.mergeByBaseColor(masks);
                Mat cleaned = filter.clean("blue", merged.get("blue"));
                MappedPoints points = new CoordinateMapper().map(cleaned, CALIBRATION);
                for (double x : points.getXs()) {
                    bins.add((long) Math.rint(x / CurveAggregator.DEFAULT_BIN_WIDTH));
                }
                cleaned.release();
                masks.values().forEach(Mat::release);
                merged.values().forEach(Mat::release);
            }
        }

        assertEquals(0, blue.getDroppedBins());
        assertEquals(bins.size(), blue.size());
    }

    @Test
    public void testParallelMatchesSequential() {
        CurveExtractionEngine parallel = new CurveExtractionEngine(config.toColorSpecs(), new ImageNormalizer(),
                new ComponentFilter(config.toTuningTable()), new CurveAggregator(config.toTuningTable()), workers);

        BufferedImage img = sinePlot();
        SyntheticGraphs.drawCurve(img, x -> 20 + 2 * x, 1, 9, 10, 100, new Color(255, 0, 0), 5f);

        ExtractionResult seq;
        ExtractionResult par;
        try (RasterImage image = RasterImage.fromBufferedImage(img)) {
            seq = engine.extract(image, CALIBRATION);
            par = parallel.extract(image, CALIBRATION);
        }

        assertEquals(List.of("red", "blue"), List.copyOf(par.getCurves().keySet()));
        assertEquals(seq.getCurves().keySet(), par.getCurves().keySet());
        for (String color : seq.getCurves().keySet()) {
            List<CurvePoint> a = seq.getCurve(color).getPoints();
            List<CurvePoint> b = par.getCurve(color).getPoints();
            assertEquals(a.size(), b.size());
            for (int i = 0; i < a.size(); i++) {
                assertEquals(a.get(i).getX(), b.get(i).getX(), 0.0);
                assertEquals(a.get(i).getY(), b.get(i).getY(), 0.0);
            }
        }
    }

    @Test
    public void testColorSelectionAndLabels() {
        ExtractionResult result;
        try (RasterImage image = RasterImage.fromBufferedImage(sinePlot())) {
            result = engine.extract(image, CALIBRATION, List.of("blue"), Map.of("blue", "Vgs 2V"));
        }
        assertEquals(1, result.getCurves().size());
        assertEquals("Vgs 2V", result.getCurve("blue").getLabel());
        assertTrue(result.getSkippedColors().isEmpty());

        try (RasterImage image = RasterImage.fromBufferedImage(sinePlot())) {
            assertThrows(IllegalArgumentException.class,
                    () -> engine.extract(image, CALIBRATION, List.of("teal"), Map.of()));
        }
    }

    @Test
    public void testCalibrationIsCheckedBeforeImage() {
        // a blank page would fail boundary detection; the calibration error must come first
        try (RasterImage image = RasterImage.fromBufferedImage(SyntheticGraphs.page())) {
            assertThrows(CalibrationException.class,
                    () -> engine.extract(image, new AxisCalibration(10, 0, 0, 100)));
            assertThrows(CalibrationException.class,
                    () -> engine.extract(image, new AxisCalibration(0, 10, 0, 100, ScaleType.LINEAR, ScaleType.LOG)));
        }
    }

    @Test
    public void testNonRectangularBoundaryFails() {
        int[] xs = { 200, 1000, 600 };
        int[] ys = { 1000, 1000, 200 };
        try (RasterImage image = RasterImage.fromBufferedImage(SyntheticGraphs.filledPolygon(xs, ys))) {
            assertThrows(GridDetectionException.class, () -> engine.extract(image, CALIBRATION));
        }
    }
}
