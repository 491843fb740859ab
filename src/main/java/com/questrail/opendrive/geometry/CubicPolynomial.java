package com.questrail.opendrive.geometry;

/**
 * {@code a + b*x + c*x^2 + d*x^3}, the polynomial form shared by elevation,
 * superelevation, lane offset, lane width and lane border records.
 */
public record CubicPolynomial(double a, double b, double c, double d)
{
    public static final CubicPolynomial ZERO = new CubicPolynomial(0.0, 0.0, 0.0, 0.0);

    public static CubicPolynomial constant(double a) {
        return new CubicPolynomial(a, 0.0, 0.0, 0.0);
    }

    public double valueAt(double x) {
        return a + x * (b + x * (c + x * d));
    }

    public double derivativeAt(double x) {
        return b + x * (2.0 * c + x * 3.0 * d);
    }
}
