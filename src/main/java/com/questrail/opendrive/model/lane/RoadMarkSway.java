package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.geometry.CubicPolynomial;
import com.questrail.opendrive.units.Length;

import java.util.Objects;

/**
 * {@code <sway>}: lateral displacement of a road mark, a cubic in the distance
 * from {@code ds}, which is measured from the start of the road mark.
 */
public record RoadMarkSway(Length ds, CubicPolynomial polynomial)
{
    public RoadMarkSway {
        Objects.requireNonNull(ds, "ds");
        Objects.requireNonNull(polynomial, "polynomial");
    }
}
