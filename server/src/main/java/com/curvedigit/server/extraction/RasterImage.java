package com.curvedigit.server.extraction;

import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A decoded color image of a plotted graph, stored as an 8-bit BGR matrix.
 * The caller owns the image for the duration of one extraction call.
 */
public class RasterImage implements AutoCloseable {

    static {
        OpenCV.loadLocally();
    }

    private final Mat bgr;

    private RasterImage(Mat bgr) {
        this.bgr = bgr;
    }

    public static RasterImage fromBufferedImage(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("image must not be null");
        }
        BufferedImage converted = image;
        if (image.getType() != BufferedImage.TYPE_3BYTE_BGR) {
            converted = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
            Graphics2D g = converted.createGraphics();
            try {
                g.drawImage(image, 0, 0, null);
            } finally {
                g.dispose();
            }
        }
        byte[] data = ((DataBufferByte) converted.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(converted.getHeight(), converted.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, data);
        return new RasterImage(mat);
    }

    /**
     * Decodes PNG, JPEG, BMP or any other format OpenCV understands.
     */
    public static RasterImage decode(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            throw new IllegalArgumentException("Image data is empty");
        }
        Mat mat = Imgcodecs.imdecode(new MatOfByte(encoded), Imgcodecs.IMREAD_COLOR);
        if (mat.empty()) {
            throw new IllegalArgumentException("Could not decode image data (" + encoded.length + " bytes)");
        }
        return new RasterImage(mat);
    }

    public static RasterImage read(Path path) throws IOException {
        BufferedImage image;
        try (InputStream in = Files.newInputStream(path)) {
            image = ImageIO.read(in);
        }
        if (image == null) {
            throw new IOException("Unsupported image format: " + path);
        }
        return fromBufferedImage(image);
    }

    public Mat getMat() {
        return bgr;
    }

    public int getWidth() {
        return bgr.cols();
    }

    public int getHeight() {
        return bgr.rows();
    }

    @Override
    public void close() {
        bgr.release();
    }
}
