package com.questrail.opendrive.model.road;

import com.questrail.opendrive.geometry.CubicPolynomial;
import com.questrail.opendrive.units.Length;

import java.util.Objects;

/**
 * {@code <shape>} of a lateral profile: height offset across the road at {@code s},
 * as a cubic in {@code dt = t' - t}.
 */
public record LateralShape(Length s, Length t, CubicPolynomial polynomial)
{
    public LateralShape {
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(t, "t");
        Objects.requireNonNull(polynomial, "polynomial");
    }
}
