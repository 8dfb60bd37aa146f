package com.curvedigit.server.extraction;

public class CalibrationException extends CurveExtractionException {

    public CalibrationException(String message) {
        super(message);
    }
}
