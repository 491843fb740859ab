package com.questrail.opendrive.geometry;

import com.questrail.opendrive.units.Curvature;

import java.util.Objects;

/**
 * Spiral
 * -----------------------------------------------------------------------------
 * An Euler spiral (clothoid): curvature changes linearly from
 * {@code curvStart} to {@code curvEnd} over the segment length.
 *
 * <p>The heading is the quadratic
 * {@code h(s) = h0 + k0*s + (k1 - k0) * s^2 / (2L)} and the position is obtained
 * by integrating {@code (cos h, sin h)} numerically. Quadrature is used instead of
 * a Fresnel-integral series because the series form divides by the curvature
 * rate and becomes unstable when either end curvature, or the difference between
 * them, approaches zero. The integrand here is always bounded and smooth.</p>
 */
public record Spiral(Curvature curvStart, Curvature curvEnd) implements GeometryShape
{
    private static final double MAX_TURN_PER_PANEL = 0.05;
    private static final double MAX_SPAN_PER_PANEL = 25.0;

    public Spiral {
        Objects.requireNonNull(curvStart, "curvStart");
        Objects.requireNonNull(curvEnd, "curvEnd");
    }

    @Override
    public Pose advance(Pose start, double offset, double length) {
        double k0 = curvStart.perMeter();
        double rate = length > 0.0 ? (curvEnd.perMeter() - k0) / length : 0.0;
        double h0 = start.heading();

        double maxCurvature = Math.max(Math.abs(k0), Math.abs(k0 + rate * offset));
        int panels = GaussLegendre.panelsFor(offset, maxCurvature * offset,
                MAX_TURN_PER_PANEL, MAX_SPAN_PER_PANEL);

        double dx = GaussLegendre.integrate(
                s -> Math.cos(heading(h0, k0, rate, s)), 0.0, offset, panels);
        double dy = GaussLegendre.integrate(
                s -> Math.sin(heading(h0, k0, rate, s)), 0.0, offset, panels);

        return new Pose(start.x() + dx, start.y() + dy, heading(h0, k0, rate, offset));
    }

    private static double heading(double h0, double k0, double rate, double s) {
        return h0 + k0 * s + 0.5 * rate * s * s;
    }

    @Override
    public String elementName() {
        return "spiral";
    }
}
