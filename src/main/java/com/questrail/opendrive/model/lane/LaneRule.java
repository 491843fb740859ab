package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.units.Length;

import java.util.Objects;

/**
 * {@code <rule>}: free-text traffic rule for a lane.
 */
public record LaneRule(Length sOffset, String value)
{
    public LaneRule {
        Objects.requireNonNull(sOffset, "sOffset");
        Objects.requireNonNull(value, "value");
    }
}
