package com.curvedigit.server.extraction;

import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;
import org.opencv.core.Point;

import static org.junit.jupiter.api.Assertions.*;

public class ImageNormalizerTest {

    private final ImageNormalizer normalizer = new ImageNormalizer();

    @Test
    public void testFrameCornersAreFound() {
        try (RasterImage image = RasterImage.fromBufferedImage(SyntheticGraphs.framedPage())) {
            QuadCorners q = normalizer.detectCorners(image.getMat());

            int lo = SyntheticGraphs.MARGIN;
            int hi = SyntheticGraphs.MARGIN + SyntheticGraphs.PLOT;
            assertNear(lo, lo, q.getTopLeft(), 4);
            assertNear(hi, lo, q.getTopRight(), 4);
            assertNear(hi, hi, q.getBottomRight(), 4);
            assertNear(lo, hi, q.getBottomLeft(), 4);
        }
    }

    @Test
    public void testCornersLandOnCanvasCorners() {
        try (RasterImage image = RasterImage.fromBufferedImage(SyntheticGraphs.framedPage());
             NormalizedCanvas canvas = normalizer.normalize(image)) {
            int s = ImageNormalizer.DEFAULT_CANVAS_SIZE;
            assertEquals(s, canvas.getWidth());
            assertEquals(s, canvas.getHeight());

            QuadCorners q = canvas.getCorners();
            assertNear(0, 0, canvas.toCanvas(q.getTopLeft()), 1);
            assertNear(s, 0, canvas.toCanvas(q.getTopRight()), 1);
            assertNear(s, s, canvas.toCanvas(q.getBottomRight()), 1);
            assertNear(0, s, canvas.toCanvas(q.getBottomLeft()), 1);

            int grid = canvas.getGridSizeEstimate();
            assertTrue(grid >= GridSizeEstimator.MIN_GRID_SIZE && grid <= GridSizeEstimator.MAX_GRID_SIZE);
        }
    }

    @Test
    public void testSmallerCanvasSize() {
        ImageNormalizer small = new ImageNormalizer(400, new GridSizeEstimator());
        try (RasterImage image = RasterImage.fromBufferedImage(SyntheticGraphs.framedPage());
             NormalizedCanvas canvas = small.normalize(image)) {
            assertEquals(400, canvas.getWidth());
            assertEquals(400, canvas.getHeight());
        }
    }

    @Test
    public void testTriangleIsRejected() {
        int[] xs = { 200, 1000, 600 };
        int[] ys = { 1000, 1000, 200 };
        try (RasterImage image = RasterImage.fromBufferedImage(SyntheticGraphs.filledPolygon(xs, ys))) {
            GridDetectionException e = assertThrows(GridDetectionException.class, () -> normalizer.normalize(image));
            assertEquals(3, e.getVertexCount());
        }
    }

    @Test
    public void testPentagonIsRejected() {
        try (RasterImage image = RasterImage.fromBufferedImage(SyntheticGraphs.regularPolygon(5, 400))) {
            GridDetectionException e = assertThrows(GridDetectionException.class, () -> normalizer.normalize(image));
            assertEquals(5, e.getVertexCount());
        }
    }

    @Test
    public void testDiamondBoundaryIsRejected() {
        int[] xs = { 600, 1100, 600, 100 };
        int[] ys = { 100, 600, 1100, 600 };
        try (RasterImage image = RasterImage.fromBufferedImage(SyntheticGraphs.filledPolygon(xs, ys))) {
            assertThrows(GridDetectionException.class, () -> normalizer.normalize(image));
        }
    }

    @Test
    public void testBlankImageHasNoBoundary() {
        try (RasterImage image = RasterImage.fromBufferedImage(SyntheticGraphs.page())) {
            GridDetectionException e = assertThrows(GridDetectionException.class, () -> normalizer.normalize(image));
            assertEquals(0, e.getVertexCount());
        }
    }

    @Test
    public void testCanvasIsReleasedWhenGridEstimateFails() {
        Mat[] seen = new Mat[1];
        GridSizeEstimator failing = new GridSizeEstimator() {
            @Override
            public int estimate(Mat canvasBgr) {
                seen[0] = canvasBgr;
                throw new IllegalStateException("spectrum failed");
            }
        };
        ImageNormalizer n = new ImageNormalizer(ImageNormalizer.DEFAULT_CANVAS_SIZE, failing);
        try (RasterImage image = RasterImage.fromBufferedImage(SyntheticGraphs.framedPage())) {
            assertThrows(IllegalStateException.class, () -> n.normalize(image));
        }
        assertNotNull(seen[0]);
        assertTrue(seen[0].empty(), "warped canvas should be released");
    }

    @Test
    public void testCanvasSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ImageNormalizer(0, new GridSizeEstimator()));
    }

    private static void assertNear(double x, double y, Point p, double tol) {
        assertEquals(x, p.x, tol, "x of " + p);
        assertEquals(y, p.y, tol, "y of " + p);
    }
}
