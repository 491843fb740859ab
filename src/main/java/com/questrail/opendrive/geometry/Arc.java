package com.questrail.opendrive.geometry;

import com.questrail.opendrive.units.Curvature;

import java.util.Objects;

/**
 * A circular arc of constant curvature.
 *
 * <p>Evaluated in closed form. When the curvature is so small that the closed
 * form loses precision the arc is evaluated as a line, which it is
 * indistinguishable from at that scale.</p>
 */
public record Arc(Curvature curvature) implements GeometryShape
{
    static final double STRAIGHT_THRESHOLD = 1e-12;

    public Arc {
        Objects.requireNonNull(curvature, "curvature");
    }

    @Override
    public Pose advance(Pose start, double offset, double length) {
        double k = curvature.perMeter();
        double h = start.heading();
        if (Math.abs(k) < STRAIGHT_THRESHOLD) {
            return new Pose(
                    start.x() + offset * Math.cos(h),
                    start.y() + offset * Math.sin(h),
                    h + k * offset);
        }
        double end = h + k * offset;
        return new Pose(
                start.x() + (Math.sin(end) - Math.sin(h)) / k,
                start.y() + (Math.cos(h) - Math.cos(end)) / k,
                end);
    }

    @Override
    public String elementName() {
        return "arc";
    }
}
