package com.questrail.opendrive.model;

import com.questrail.opendrive.units.Angle;
import com.questrail.opendrive.units.Length;

import java.util.Objects;

/**
 * {@code <offset>} of the header: inertial shift and rotation applied to all
 * coordinates relative to the geographic reference.
 */
public record HeaderOffset(Length x, Length y, Length z, Angle hdg)
{
    public HeaderOffset {
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
        Objects.requireNonNull(z, "z");
        Objects.requireNonNull(hdg, "hdg");
    }
}
