package com.questrail.opendrive.geometry;

import java.util.Objects;

/**
 * Two independent cubics {@code u(p)} and {@code v(p)} in the local frame of the
 * start pose.
 *
 * <p>An arc-length offset {@code s} maps to {@code p = s} for
 * {@link ParamPoly3Range#ARC_LENGTH} and to {@code p = s / length} for
 * {@link ParamPoly3Range#NORMALIZED}. The heading is the start heading plus the
 * direction of the tangent {@code (u'(p), v'(p))}.</p>
 */
public record ParamPoly3(CubicPolynomial u, CubicPolynomial v, ParamPoly3Range pRange) implements GeometryShape
{
    public ParamPoly3 {
        Objects.requireNonNull(u, "u");
        Objects.requireNonNull(v, "v");
        Objects.requireNonNull(pRange, "pRange");
    }

    @Override
    public Pose advance(Pose start, double offset, double length) {
        double p = parameterAt(offset, length);
        double lu = u.valueAt(p);
        double lv = v.valueAt(p);
        double du = u.derivativeAt(p);
        double dv = v.derivativeAt(p);
        double cos = Math.cos(start.heading());
        double sin = Math.sin(start.heading());
        double tangent = (du == 0.0 && dv == 0.0) ? 0.0 : Math.atan2(dv, du);
        return new Pose(
                start.x() + lu * cos - lv * sin,
                start.y() + lu * sin + lv * cos,
                start.heading() + tangent);
    }

    double parameterAt(double offset, double length) {
        if (pRange == ParamPoly3Range.ARC_LENGTH) {
            return offset;
        }
        return length > 0.0 ? offset / length : 0.0;
    }

    @Override
    public String elementName() {
        return "paramPoly3";
    }
}
