package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.geometry.CubicPolynomial;
import com.questrail.opendrive.units.Length;

import java.util.Objects;

/**
 * {@code <laneOffset>}: lateral shift of the center lane from the reference line,
 * valid from road coordinate {@code s}.
 */
public record LaneOffset(Length s, CubicPolynomial polynomial)
{
    public LaneOffset {
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(polynomial, "polynomial");
    }
}
