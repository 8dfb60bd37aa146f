package com.curvedigit.server.extraction;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;

/**
 * The rectified square plot area plus the transform that produced it.
 * Read-only for every stage after normalization.
 */
public class NormalizedCanvas implements AutoCloseable {
    private final Mat canvas;
    private final Mat homography;
    private final QuadCorners corners;
    private final int gridSizeEstimate;

    public NormalizedCanvas(Mat canvas, Mat homography, QuadCorners corners, int gridSizeEstimate) {
        this.canvas = canvas;
        this.homography = homography;
        this.corners = corners;
        this.gridSizeEstimate = gridSizeEstimate;
    }

    public Mat getCanvas() {
        return canvas;
    }

    public Mat getHomography() {
        return homography;
    }

    public QuadCorners getCorners() {
        return corners;
    }

    public int getGridSizeEstimate() {
        return gridSizeEstimate;
    }

    public int getWidth() {
        return canvas.cols();
    }

    public int getHeight() {
        return canvas.rows();
    }

    /**
     * Projects a point of the source image into canvas coordinates.
     */
    public Point toCanvas(Point source) {
        MatOfPoint2f src = new MatOfPoint2f(source);
        MatOfPoint2f dst = new MatOfPoint2f();
        try {
            Core.perspectiveTransform(src, dst, homography);
            return dst.toArray()[0];
        } finally {
            src.release();
            dst.release();
        }
    }

    @Override
    public void close() {
        canvas.release();
        homography.release();
    }
}
