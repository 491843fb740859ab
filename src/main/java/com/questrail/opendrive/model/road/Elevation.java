package com.questrail.opendrive.model.road;

import com.questrail.opendrive.geometry.CubicPolynomial;
import com.questrail.opendrive.units.Length;

import java.util.Objects;

/**
 * {@code <elevation>} record valid from road coordinate {@code s}; the polynomial
 * argument is {@code ds = s' - s}.
 */
public record Elevation(Length s, CubicPolynomial polynomial)
{
    public Elevation {
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(polynomial, "polynomial");
    }

    public double valueAt(double roadS) {
        return polynomial.valueAt(roadS - s.meters());
    }
}
