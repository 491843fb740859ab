package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.units.Length;
import com.questrail.opendrive.units.Speed;
import com.questrail.opendrive.units.SpeedUnit;

import java.util.Objects;

/**
 * {@code <speed>} limit of a lane. The unit defaults to m/s.
 */
public record LaneSpeed(Length sOffset, Speed max)
{
    public static final SpeedUnit DEFAULT_UNIT = SpeedUnit.METERS_PER_SECOND;

    public LaneSpeed {
        Objects.requireNonNull(sOffset, "sOffset");
        Objects.requireNonNull(max, "max");
    }
}
