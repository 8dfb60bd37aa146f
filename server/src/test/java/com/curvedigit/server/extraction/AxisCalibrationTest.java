package com.curvedigit.server.extraction;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AxisCalibrationTest {

    @Test
    public void testValidCalibration() {
        assertDoesNotThrow(() -> new AxisCalibration(0, 3, 0, 2.75).validate());
        assertDoesNotThrow(() -> new AxisCalibration(-5, 5, -1, 1).validate());
        assertDoesNotThrow(() -> new AxisCalibration(0.1, 100, 1, 10, ScaleType.LOG, ScaleType.LOG).validate());
    }

    @Test
    public void testEmptyOrInvertedRangesAreRejected() {
        assertThrows(CalibrationException.class, () -> new AxisCalibration(5, 5, 0, 1).validate());
        assertThrows(CalibrationException.class, () -> new AxisCalibration(0, 1, 10, 0).validate());
        assertThrows(CalibrationException.class, () -> new AxisCalibration(0, Double.NaN, 0, 1).validate());
        assertThrows(CalibrationException.class,
                () -> new AxisCalibration(0, 1, 0, Double.POSITIVE_INFINITY).validate());
    }

    @Test
    public void testLogAxisNeedsPositiveMinimum() {
        CalibrationException e = assertThrows(CalibrationException.class,
                () -> new AxisCalibration(0, 10, 1, 10, ScaleType.LOG, ScaleType.LINEAR).validate());
        assertTrue(e.getMessage().contains("x"));
        assertThrows(CalibrationException.class,
                () -> new AxisCalibration(0, 10, -1, 10, ScaleType.LINEAR, ScaleType.LOG).validate());
    }

    @Test
    public void testScaleTypeParsing() {
        assertEquals(ScaleType.LINEAR, ScaleType.parse(null));
        assertEquals(ScaleType.LINEAR, ScaleType.parse(" "));
        assertEquals(ScaleType.LINEAR, ScaleType.parse("Linear"));
        assertEquals(ScaleType.LOG, ScaleType.parse("log"));
        assertEquals(ScaleType.LOG, ScaleType.parse("LOGARITHMIC"));
        assertThrows(IllegalArgumentException.class, () -> ScaleType.parse("exp"));
    }
}
