package com.questrail.opendrive.units;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class QuantityTest
{
    @Test
    void quantitiesRejectNonFiniteMagnitudes()
    {
        assertThrows(IllegalArgumentException.class, () -> Length.of(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> Angle.ofRadians(Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> Curvature.of(Double.NEGATIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> Speed.of(Double.NaN, SpeedUnit.METERS_PER_SECOND));
    }

    @Test
    void negativeLengthIsRepresentableButFlagged()
    {
        Length offset = Length.of(-1.5);
        assertTrue(offset.isNegative());
        assertFalse(Length.ZERO.isNegative());
        assertEquals(Length.of(1.0), offset.plus(Length.of(2.5)));
    }

    @Test
    void degreesConvertOnlyOnRequest()
    {
        Angle half = Angle.ofDegrees(180.0);
        assertEquals(Math.PI, half.radians(), 1e-15);
        assertEquals(90.0, Angle.ofRadians(Math.PI / 2.0).toDegrees(), 1e-12);
    }

    @Test
    void curvatureRadius()
    {
        assertEquals(100.0, Curvature.of(0.01).radius(), 1e-12);
        assertEquals(Double.POSITIVE_INFINITY, Curvature.ZERO.radius());
    }

    @Test
    void speedConversion()
    {
        Speed urban = Speed.of(36.0, SpeedUnit.KILOMETERS_PER_HOUR);
        assertEquals(10.0, urban.toMetersPerSecond(), 1e-12);
        assertEquals(10.0, urban.convertTo(SpeedUnit.METERS_PER_SECOND).value(), 1e-12);
        assertSame(urban, urban.convertTo(SpeedUnit.KILOMETERS_PER_HOUR));
        assertEquals(SpeedUnit.MILES_PER_HOUR, Speed.of(30.0, SpeedUnit.MILES_PER_HOUR).unit());
    }
}
