package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.units.Length;

import java.util.Objects;

/**
 * {@code <height>} of a lane surface above the road surface. Both offsets default to zero.
 */
public record LaneHeight(Length sOffset, Length inner, Length outer)
{
    public LaneHeight {
        Objects.requireNonNull(sOffset, "sOffset");
        Objects.requireNonNull(inner, "inner");
        Objects.requireNonNull(outer, "outer");
    }
}
