package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.geometry.CubicPolynomial;
import com.questrail.opendrive.units.Length;

import java.util.Objects;

/**
 * {@code <border>}: outer lane border as a cubic distance from the reference line.
 */
public record LaneBorder(Length sOffset, CubicPolynomial polynomial) implements LaneBoundary
{
    public LaneBorder {
        Objects.requireNonNull(sOffset, "sOffset");
        Objects.requireNonNull(polynomial, "polynomial");
    }

    @Override
    public String elementName() {
        return "border";
    }
}
