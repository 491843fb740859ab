package com.questrail.opendrive.geometry;

import com.questrail.opendrive.units.Curvature;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Evaluation of the five reference-line shapes against closed-form results.
 */
final class GeometryShapeTest
{
    private static final double EPS = 1e-9;
    private static final Pose ORIGIN = new Pose(0.0, 0.0, 0.0);

    @Test
    void lineAdvancesAlongHeading()
    {
        Pose pose = new Line().advance(new Pose(1.0, 2.0, Math.PI / 2.0), 3.0, 10.0);
        assertEquals(1.0, pose.x(), EPS);
        assertEquals(5.0, pose.y(), EPS);
        assertEquals(Math.PI / 2.0, pose.heading(), EPS);
    }

    @Test
    void quarterArcEndsAtRadiusOffset()
    {
        double k = 0.01;
        double quarter = Math.PI / 2.0 / k;
        Pose pose = new Arc(Curvature.of(k)).advance(ORIGIN, quarter, quarter);
        assertEquals(100.0, pose.x(), 1e-9);
        assertEquals(100.0, pose.y(), 1e-9);
        assertEquals(Math.PI / 2.0, pose.heading(), EPS);
    }

    @Test
    void negativeCurvatureTurnsRight()
    {
        Pose pose = new Arc(Curvature.of(-0.1)).advance(ORIGIN, 1.0, 1.0);
        assertTrue(pose.y() < 0.0);
        assertEquals(-0.1, pose.heading(), EPS);
    }

    @Test
    void zeroCurvatureArcIsALine()
    {
        Pose pose = new Arc(Curvature.ZERO).advance(ORIGIN, 7.0, 7.0);
        assertTrue(pose.isCloseTo(new Pose(7.0, 0.0, 0.0), EPS));
    }

    @Test
    void constantCurvatureSpiralMatchesArc()
    {
        Curvature k = Curvature.of(0.02);
        Pose spiral = new Spiral(k, k).advance(ORIGIN, 60.0, 80.0);
        Pose arc = new Arc(k).advance(ORIGIN, 60.0, 80.0);
        assertTrue(spiral.isCloseTo(arc, 1e-9), () -> spiral + " vs " + arc);
    }

    @Test
    void flatSpiralIsALine()
    {
        Pose pose = new Spiral(Curvature.ZERO, Curvature.ZERO).advance(ORIGIN, 12.0, 20.0);
        assertTrue(pose.isCloseTo(new Pose(12.0, 0.0, 0.0), EPS));
    }

    @Test
    void clothoidHeadingGrowsQuadratically()
    {
        double length = 50.0;
        double kEnd = 0.04;
        Pose end = new Spiral(Curvature.ZERO, Curvature.of(kEnd)).advance(ORIGIN, length, length);
        assertEquals(kEnd * length / 2.0, end.heading(), EPS);
        Pose half = new Spiral(Curvature.ZERO, Curvature.of(kEnd)).advance(ORIGIN, length / 2.0, length);
        assertEquals(kEnd * length / 8.0, half.heading(), EPS);
        assertTrue(end.y() > 0.0);
        assertTrue(end.x() < length);
    }

    @Test
    void poly3OffsetIsArcLengthNotLocalU()
    {
        Poly3 diagonal = Poly3.of(0.0, 1.0, 0.0, 0.0);
        Pose pose = diagonal.advance(ORIGIN, Math.sqrt(2.0), 10.0);
        assertEquals(1.0, pose.x(), 1e-9);
        assertEquals(1.0, pose.y(), 1e-9);
        assertEquals(Math.PI / 4.0, pose.heading(), 1e-9);
    }

    @Test
    void curvedPoly3CurveLengthMatchesOffset()
    {
        Poly3 curve = Poly3.of(0.0, 0.0, 0.01, 0.0005);
        double offset = 30.0;
        Pose pose = curve.advance(ORIGIN, offset, 40.0);
        double u = pose.x();
        assertEquals(offset, curve.curveLength(u), 1e-9);
        assertEquals(curve.v().valueAt(u), pose.y(), 1e-9);
    }

    @Test
    void normalizedParamPoly3ScalesOffsetByLength()
    {
        ParamPoly3 straight = new ParamPoly3(
                new CubicPolynomial(0.0, 20.0, 0.0, 0.0),
                CubicPolynomial.ZERO,
                ParamPoly3Range.NORMALIZED);
        Pose pose = straight.advance(ORIGIN, 10.0, 20.0);
        assertTrue(pose.isCloseTo(new Pose(10.0, 0.0, 0.0), EPS));
    }

    @Test
    void arcLengthParamPoly3UsesOffsetDirectly()
    {
        ParamPoly3 curve = new ParamPoly3(
                new CubicPolynomial(0.0, 1.0, 0.0, 0.0),
                new CubicPolynomial(0.0, 0.0, 0.1, 0.0),
                ParamPoly3Range.ARC_LENGTH);
        Pose pose = curve.advance(new Pose(0.0, 0.0, Math.PI / 2.0), 2.0, 5.0);
        // local (u, v) = (2, 0.4) rotated by 90 degrees
        assertEquals(-0.4, pose.x(), EPS);
        assertEquals(2.0, pose.y(), EPS);
        assertEquals(Math.PI / 2.0 + Math.atan2(0.4, 1.0), pose.heading(), EPS);
    }

    @Test
    void poseComparisonWrapsHeading()
    {
        Pose a = new Pose(0.0, 0.0, Math.PI - 1e-12);
        Pose b = new Pose(0.0, 0.0, -Math.PI + 1e-12);
        assertTrue(a.isCloseTo(b, 1e-9));
        assertFalse(a.isCloseTo(new Pose(0.1, 0.0, a.heading()), 1e-9));
    }
}
