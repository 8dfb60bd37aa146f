package com.curvedigit.server.extraction;

/**
 * The plot boundary could not be resolved to exactly four corners.
 */
public class GridDetectionException extends CurveExtractionException {
    private final int vertexCount;

    public GridDetectionException(String message, int vertexCount) {
        super(message);
        this.vertexCount = vertexCount;
    }

    /**
     * Vertices of the approximated boundary polygon, 0 when no contour was found.
     */
    public int getVertexCount() {
        return vertexCount;
    }
}
