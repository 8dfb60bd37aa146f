package com.curvedigit.server.extraction.scale;

import com.curvedigit.server.extraction.ScaleType;

public class AxisScaleFactory {

    public static AxisScale create(ScaleType type, double min, double max) {
        if (type == null) {
            return new LinearAxisScale(min, max);
        }
        switch (type) {
            case LOG:
                return new LogAxisScale(min, max);
            case LINEAR:
            default:
                return new LinearAxisScale(min, max);
        }
    }
}
