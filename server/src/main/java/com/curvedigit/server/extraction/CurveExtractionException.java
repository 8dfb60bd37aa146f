package com.curvedigit.server.extraction;

/**
 * Structural failure that aborts a whole extraction run.
 */
public class CurveExtractionException extends RuntimeException {

    public CurveExtractionException(String message) {
        super(message);
    }

    public CurveExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
