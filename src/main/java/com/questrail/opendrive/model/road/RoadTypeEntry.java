package com.questrail.opendrive.model.road;

import com.questrail.opendrive.units.Length;

import java.util.Objects;
import java.util.Optional;

/**
 * One {@code <type>} record: the road classification valid from {@code s} onwards.
 */
public record RoadTypeEntry(Length s, RoadType type, Optional<String> country, Optional<RoadSpeed> speed)
{
    public RoadTypeEntry {
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(country, "country");
        Objects.requireNonNull(speed, "speed");
    }
}
