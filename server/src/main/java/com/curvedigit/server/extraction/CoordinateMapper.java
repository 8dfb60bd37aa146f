package com.curvedigit.server.extraction;

import com.curvedigit.server.extraction.scale.AxisScale;
import com.curvedigit.server.extraction.scale.AxisScaleFactory;
import org.opencv.core.Mat;

/**
 * Converts mask pixels on a W x H canvas into logical graph coordinates.
 * Canvas rows grow downwards while the graph y axis grows upwards, hence {@code H - py}.
 */
public class CoordinateMapper {

    public MappedPoints map(Mat mask, AxisCalibration calibration) {
        int w = mask.cols();
        int h = mask.rows();
        byte[] data = new byte[w * h];
        mask.get(0, 0, data);

        int count = 0;
        for (byte b : data) {
            if (b != 0) {
                count++;
            }
        }

        AxisScale xScale = AxisScaleFactory.create(calibration.getXScaleType(), calibration.getXMin(), calibration.getXMax());
        AxisScale yScale = AxisScaleFactory.create(calibration.getYScaleType(), calibration.getYMin(), calibration.getYMax());

        double[] xs = new double[count];
        double[] ys = new double[count];
        int idx = 0;
        for (int py = 0; py < h; py++) {
            int rowOffset = py * w;
            for (int px = 0; px < w; px++) {
                if (data[rowOffset + px] != 0) {
                    xs[idx] = xScale.valueAt((double) px / w);
                    ys[idx] = yScale.valueAt((double) (h - py) / h);
                    idx++;
                }
            }
        }
        return new MappedPoints(xs, ys);
    }

    /**
     * Maps a single canvas pixel.
     */
    public CurvePoint mapPixel(int px, int py, int width, int height, AxisCalibration calibration) {
        AxisScale xScale = AxisScaleFactory.create(calibration.getXScaleType(), calibration.getXMin(), calibration.getXMax());
        AxisScale yScale = AxisScaleFactory.create(calibration.getYScaleType(), calibration.getYMin(), calibration.getYMax());
        return new CurvePoint(xScale.valueAt((double) px / width), yScale.valueAt((double) (height - py) / height));
    }
}
