package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.units.Length;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <access>} restriction of a lane.
 */
public record LaneAccess(Length sOffset, AccessRestriction restriction, Optional<AccessRule> rule)
{
    public LaneAccess {
        Objects.requireNonNull(sOffset, "sOffset");
        Objects.requireNonNull(restriction, "restriction");
        Objects.requireNonNull(rule, "rule");
    }
}
