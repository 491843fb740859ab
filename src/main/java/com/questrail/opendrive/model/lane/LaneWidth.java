package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.geometry.CubicPolynomial;
import com.questrail.opendrive.units.Length;

import java.util.Objects;

/**
 * {@code <width>}: lane width as a cubic in {@code ds} from {@code sOffset}.
 */
public record LaneWidth(Length sOffset, CubicPolynomial polynomial) implements LaneBoundary
{
    public LaneWidth {
        Objects.requireNonNull(sOffset, "sOffset");
        Objects.requireNonNull(polynomial, "polynomial");
    }

    public static LaneWidth constant(double sOffset, double width) {
        return new LaneWidth(Length.of(sOffset), CubicPolynomial.constant(width));
    }

    @Override
    public String elementName() {
        return "width";
    }
}
