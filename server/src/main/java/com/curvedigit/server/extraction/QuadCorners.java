package com.curvedigit.server.extraction;

import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;

/**
 * The four corners of a plot boundary in canonical order.
 */
public class QuadCorners {

    // Coordinate sum picks the top-left/bottom-right diagonal, the (y - x) difference the other one.
    // Ties fall back to y then x so the result never depends on vertex order.
    private static final Comparator<Point> BY_SUM = Comparator
            .comparingDouble((Point p) -> p.x + p.y)
            .thenComparingDouble(p -> p.y)
            .thenComparingDouble(p -> p.x);

    private static final Comparator<Point> BY_DIFF = Comparator
            .comparingDouble((Point p) -> p.y - p.x)
            .thenComparingDouble(p -> p.y)
            .thenComparingDouble(p -> p.x);

    private final Point topLeft;
    private final Point topRight;
    private final Point bottomRight;
    private final Point bottomLeft;

    public QuadCorners(Point topLeft, Point topRight, Point bottomRight, Point bottomLeft) {
        this.topLeft = topLeft;
        this.topRight = topRight;
        this.bottomRight = bottomRight;
        this.bottomLeft = bottomLeft;
    }

    /**
     * @throws GridDetectionException if there are not four vertices or they do not resolve to four distinct corners
     */
    public static QuadCorners order(List<Point> vertices) {
        if (vertices == null || vertices.size() != 4) {
            int n = vertices == null ? 0 : vertices.size();
            throw new GridDetectionException("Expected 4 boundary vertices, got " + n, n);
        }
        Point tl = vertices.stream().min(BY_SUM).get();
        Point br = vertices.stream().max(BY_SUM).get();
        Point tr = vertices.stream().min(BY_DIFF).get();
        Point bl = vertices.stream().max(BY_DIFF).get();
        // a 45-degree quadrilateral ties both rules and hands one vertex two roles
        if (new HashSet<>(Arrays.asList(tl, tr, br, bl)).size() != 4) {
            throw new GridDetectionException("Boundary corners are ambiguous: tl=" + tl + ", tr=" + tr
                    + ", br=" + br + ", bl=" + bl, vertices.size());
        }
        return new QuadCorners(tl.clone(), tr.clone(), br.clone(), bl.clone());
    }

    public Point getTopLeft() {
        return topLeft;
    }

    public Point getTopRight() {
        return topRight;
    }

    public Point getBottomRight() {
        return bottomRight;
    }

    public Point getBottomLeft() {
        return bottomLeft;
    }

    /**
     * Clockwise from top-left, the order the perspective transform expects.
     */
    public MatOfPoint2f toMat() {
        return new MatOfPoint2f(topLeft, topRight, bottomRight, bottomLeft);
    }

    @Override
    public String toString() {
        return "QuadCorners{tl=" + topLeft + ", tr=" + topRight + ", br=" + bottomRight + ", bl=" + bottomLeft + '}';
    }
}
