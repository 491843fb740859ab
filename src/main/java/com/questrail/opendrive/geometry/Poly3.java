package com.questrail.opendrive.geometry;

import java.util.Objects;

/**
 * Poly3
 * -----------------------------------------------------------------------------
 * A cubic polynomial {@code v(u) = a + b*u + c*u^2 + d*u^3} in a local frame whose
 * {@code u} axis points along the start heading.
 *
 * <p>The evaluation offset is an arc length along the curve, so it is first
 * mapped to the local {@code u} that has that curve length by solving
 * {@code integral(0..u) sqrt(1 + v'(t)^2) dt = offset}. Newton iteration is used,
 * with a bisection fallback on {@code [0, offset]} (the curve is never shorter
 * than its chord, so the root cannot lie beyond {@code offset}).</p>
 *
 * <p>Poly3 is deprecated in OpenDRIVE 1.7 in favour of {@link ParamPoly3} but is
 * still read and written.</p>
 */
public record Poly3(CubicPolynomial v) implements GeometryShape
{
    private static final int MAX_ITERATIONS = 64;
    private static final double SOLVE_TOLERANCE = 1e-12;

    public Poly3 {
        Objects.requireNonNull(v, "v");
    }

    public static Poly3 of(double a, double b, double c, double d) {
        return new Poly3(new CubicPolynomial(a, b, c, d));
    }

    @Override
    public Pose advance(Pose start, double offset, double length) {
        double u = solveU(offset);
        double vu = v.valueAt(u);
        double cos = Math.cos(start.heading());
        double sin = Math.sin(start.heading());
        return new Pose(
                start.x() + u * cos - vu * sin,
                start.y() + u * sin + vu * cos,
                start.heading() + Math.atan(v.derivativeAt(u)));
    }

    double curveLength(double u) {
        double slope = Math.max(Math.abs(v.derivativeAt(0.0)), Math.abs(v.derivativeAt(u)));
        int panels = GaussLegendre.panelsFor(u, Math.atan(slope) + u / 10.0, 0.05, 10.0);
        return GaussLegendre.integrate(this::speed, 0.0, u, panels);
    }

    private double speed(double u) {
        double dv = v.derivativeAt(u);
        return Math.sqrt(1.0 + dv * dv);
    }

    private double solveU(double offset) {
        if (offset <= 0.0) {
            return 0.0;
        }
        double tolerance = SOLVE_TOLERANCE * Math.max(1.0, offset);

        double u = offset;
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double error = curveLength(u) - offset;
            if (Math.abs(error) <= tolerance) {
                return u;
            }
            double next = u - error / speed(u);
            if (!(next >= 0.0 && next <= offset)) {
                return bisect(offset, tolerance);
            }
            u = next;
        }
        return bisect(offset, tolerance);
    }

    private double bisect(double offset, double tolerance) {
        double lo = 0.0;
        double hi = offset;
        for (int i = 0; i < 200 && hi - lo > tolerance * 1e-3; i++) {
            double mid = 0.5 * (lo + hi);
            if (curveLength(mid) < offset) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return 0.5 * (lo + hi);
    }

    @Override
    public String elementName() {
        return "poly3";
    }
}
