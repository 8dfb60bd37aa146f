package com.curvedigit.server.extraction;

import nu.pattern.OpenCV;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Finds the rectangular plot boundary of a photographed or scanned graph and warps it onto a
 * square canvas.
 */
public class ImageNormalizer {

    static {
        OpenCV.loadLocally();
    }

    private static final Logger logger = LoggerFactory.getLogger(ImageNormalizer.class);

    public static final int DEFAULT_CANVAS_SIZE = 1000;

    private static final double CANNY_LOW = 50;
    private static final double CANNY_HIGH = 150;
    // polygon tolerance as a fraction of the contour perimeter
    private static final double APPROX_EPSILON = 0.02;

    private final int canvasSize;
    private final GridSizeEstimator gridSizeEstimator;

    public ImageNormalizer() {
        this(DEFAULT_CANVAS_SIZE, new GridSizeEstimator());
    }

    public ImageNormalizer(int canvasSize, GridSizeEstimator gridSizeEstimator) {
        if (canvasSize <= 0) {
            throw new IllegalArgumentException("canvasSize must be positive");
        }
        this.canvasSize = canvasSize;
        this.gridSizeEstimator = gridSizeEstimator;
    }

    public int getCanvasSize() {
        return canvasSize;
    }

    /**
     * @throws GridDetectionException if the boundary does not approximate to exactly four vertices
     */
    public NormalizedCanvas normalize(RasterImage image) {
        QuadCorners corners = detectCorners(image.getMat());
        logger.debug("Plot boundary: {}", corners);

        MatOfPoint2f src = corners.toMat();
        MatOfPoint2f dst = canvasCorners(canvasSize);
        Mat homography = Imgproc.getPerspectiveTransform(src, dst);
        src.release();
        dst.release();

        Mat canvas = new Mat();
        int gridSize;
        try {
            Imgproc.warpPerspective(image.getMat(), canvas, homography, new Size(canvasSize, canvasSize),
                    Imgproc.INTER_LINEAR);
            gridSize = gridSizeEstimator.estimate(canvas);
        } catch (RuntimeException e) {
            canvas.release();
            homography.release();
            throw e;
        }
        logger.info("Estimated grid size: {}x{}", gridSize, gridSize);
        return new NormalizedCanvas(canvas, homography, corners, gridSize);
    }

    /**
     * Edges, largest external contour, polygon approximation, canonical corner order.
     */
    public QuadCorners detectCorners(Mat bgr) {
        Mat gray = new Mat();
        Mat edges = new Mat();
        Mat hierarchy = new Mat();
        List<MatOfPoint> contours = new ArrayList<>();
        try {
            Imgproc.cvtColor(bgr, gray, Imgproc.COLOR_BGR2GRAY);
            Imgproc.Canny(gray, edges, CANNY_LOW, CANNY_HIGH);
            Imgproc.findContours(edges, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);

            if (contours.isEmpty()) {
                throw new GridDetectionException("No contours found in image", 0);
            }

            MatOfPoint largest = contours.get(0);
            double largestArea = Imgproc.contourArea(largest);
            for (MatOfPoint c : contours) {
                double area = Imgproc.contourArea(c);
                if (area > largestArea) {
                    largest = c;
                    largestArea = area;
                }
            }

            Point[] vertices = approximate(largest);
            if (vertices.length != 4) {
                throw new GridDetectionException(
                        "Failed to detect rectangular grid: boundary approximates to " + vertices.length + " vertices",
                        vertices.length);
            }
            return QuadCorners.order(Arrays.asList(vertices));
        } finally {
            gray.release();
            edges.release();
            hierarchy.release();
            for (MatOfPoint c : contours) {
                c.release();
            }
        }
    }

    private static Point[] approximate(MatOfPoint contour) {
        MatOfPoint2f curve = new MatOfPoint2f(contour.toArray());
        MatOfPoint2f approx = new MatOfPoint2f();
        try {
            double epsilon = APPROX_EPSILON * Imgproc.arcLength(curve, true);
            Imgproc.approxPolyDP(curve, approx, epsilon, true);
            return approx.toArray();
        } finally {
            curve.release();
            approx.release();
        }
    }

    static MatOfPoint2f canvasCorners(int size) {
        return new MatOfPoint2f(
                new Point(0, 0),
                new Point(size, 0),
                new Point(size, size),
                new Point(0, size));
    }
}
