package com.curvedigit.server.extraction;

import org.junit.jupiter.api.Test;
import org.opencv.core.Point;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QuadCornersTest {

    static {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    public void testAxisAlignedRectangle() {
        List<Point> pts = List.of(new Point(900, 700), new Point(100, 80), new Point(100, 700), new Point(900, 80));
        QuadCorners q = QuadCorners.order(pts);

        assertPoint(100, 80, q.getTopLeft());
        assertPoint(900, 80, q.getTopRight());
        assertPoint(900, 700, q.getBottomRight());
        assertPoint(100, 700, q.getBottomLeft());
    }

    @Test
    public void testOrderIsIndependentOfVertexOrder() {
        // Photographed plot: slightly rotated and skewed
        List<Point> base = List.of(new Point(120, 95), new Point(910, 60), new Point(940, 720), new Point(90, 760));
        QuadCorners expected = QuadCorners.order(base);

        for (List<Point> perm : permutations(base)) {
            QuadCorners q = QuadCorners.order(perm);
            assertPoint(expected.getTopLeft().x, expected.getTopLeft().y, q.getTopLeft());
            assertPoint(expected.getTopRight().x, expected.getTopRight().y, q.getTopRight());
            assertPoint(expected.getBottomRight().x, expected.getBottomRight().y, q.getBottomRight());
            assertPoint(expected.getBottomLeft().x, expected.getBottomLeft().y, q.getBottomLeft());
        }
        assertPoint(120, 95, expected.getTopLeft());
        assertPoint(910, 60, expected.getTopRight());
        assertPoint(940, 720, expected.getBottomRight());
        assertPoint(90, 760, expected.getBottomLeft());
    }

    @Test
    public void testDiamondIsRejectedForAnyVertexOrder() {
        // A square rotated by 45 degrees ties both the sum and the difference rule
        List<Point> diamond = List.of(new Point(500, 100), new Point(900, 500), new Point(500, 900), new Point(100, 500));
        for (List<Point> perm : permutations(diamond)) {
            GridDetectionException e = assertThrows(GridDetectionException.class, () -> QuadCorners.order(perm));
            assertEquals(4, e.getVertexCount());
        }
    }

    @Test
    public void testRepeatedVertexIsRejected() {
        List<Point> pts = List.of(new Point(100, 100), new Point(100, 100), new Point(900, 900), new Point(100, 900));
        assertThrows(GridDetectionException.class, () -> QuadCorners.order(pts));
    }

    @Test
    public void testWrongVertexCountIsRejected() {
        GridDetectionException e = assertThrows(GridDetectionException.class,
                () -> QuadCorners.order(List.of(new Point(0, 0), new Point(1, 0), new Point(0, 1))));
        assertEquals(3, e.getVertexCount());
    }

    private static void assertPoint(double x, double y, Point actual) {
        assertEquals(x, actual.x, 1e-9);
        assertEquals(y, actual.y, 1e-9);
    }

    private static List<List<Point>> permutations(List<Point> items) {
        List<List<Point>> out = new ArrayList<>();
        permute(new ArrayList<>(items), 0, out);
        return out;
    }

    private static void permute(List<Point> items, int k, List<List<Point>> out) {
        if (k == items.size()) {
            out.add(new ArrayList<>(items));
            return;
        }
        for (int i = k; i < items.size(); i++) {
            Collections.swap(items, k, i);
            permute(items, k + 1, out);
            Collections.swap(items, k, i);
        }
    }
}
