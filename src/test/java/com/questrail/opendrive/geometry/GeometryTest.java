package com.questrail.opendrive.geometry;

import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.api.OpenDriveException;
import com.questrail.opendrive.units.Curvature;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class GeometryTest
{
    @Test
    void evaluatesLineAtLocalOffset()
    {
        Geometry line = Geometry.of(0.0, 0.0, 0.0, 0.0, 10.0, new Line());
        Pose pose = line.evaluate(5.0);
        assertEquals(5.0, pose.x(), 1e-12);
        assertEquals(0.0, pose.y(), 1e-12);
        assertEquals(0.0, pose.heading(), 1e-12);
    }

    @Test
    void offsetOutsideSegmentIsRejected()
    {
        Geometry line = Geometry.of(0.0, 0.0, 0.0, 0.0, 10.0, new Line());
        OpenDriveException beyond = assertThrows(OpenDriveException.class, () -> line.evaluate(10.5));
        assertEquals(ErrorKind.OFFSET_OUT_OF_RANGE, beyond.kind());
        OpenDriveException before = assertThrows(OpenDriveException.class, () -> line.evaluate(-0.1));
        assertEquals(ErrorKind.OFFSET_OUT_OF_RANGE, before.kind());
        assertThrows(OpenDriveException.class, () -> line.evaluate(Double.NaN));
    }

    @Test
    void segmentEndpointsAreInclusive()
    {
        Geometry arc = Geometry.of(5.0, 1.0, 1.0, 0.0, 10.0, new Arc(Curvature.of(0.05)));
        assertTrue(arc.evaluate(0.0).isCloseTo(arc.startPose(), 1e-12));
        assertTrue(arc.evaluate(10.0).isCloseTo(arc.endPose(), 1e-12));
        assertEquals(15.0, arc.end(), 0.0);
    }

    @Test
    void negativeLengthIsAProgrammingError()
    {
        assertThrows(IllegalArgumentException.class,
                () -> Geometry.of(0.0, 0.0, 0.0, 0.0, -1.0, new Line()));
        assertThrows(IllegalArgumentException.class,
                () -> Geometry.of(-1.0, 0.0, 0.0, 0.0, 1.0, new Line()));
    }

    @Test
    void zeroLengthSegmentEvaluatesOnlyAtItsStart()
    {
        Geometry point = Geometry.of(0.0, 3.0, 4.0, 1.0, 0.0, new Spiral(Curvature.of(0.1), Curvature.of(0.2)));
        assertTrue(point.evaluate(0.0).isCloseTo(new Pose(3.0, 4.0, 1.0), 1e-12));
        assertThrows(OpenDriveException.class, () -> point.evaluate(1e-9));
    }

    @Test
    void startingAtChainsFromPreviousEnd()
    {
        Geometry first = Geometry.of(0.0, 0.0, 0.0, 0.0, 20.0, new Arc(Curvature.of(0.02)));
        Geometry second = Geometry.startingAt(first.end(), first.endPose(), 5.0, new Line());
        assertEquals(first.endPose(), second.startPose());
        assertEquals(20.0, second.s().meters(), 0.0);
    }
}
