package com.curvedigit.server.extraction.scale;

public interface AxisScale {
    /**
     * Maps a position along the axis, 0 at the lower bound and 1 at the upper bound, to a logical value.
     */
    double valueAt(double fraction);

    String getName();
}
