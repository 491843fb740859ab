package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.units.Length;

import java.util.Objects;
import java.util.Optional;

/**
 * One {@code <line>} of an explicit road mark, placed {@code sOffset} after the
 * start of the road mark.
 */
public record RoadMarkExplicitLine(
        Length length,
        Length tOffset,
        Length sOffset,
        Optional<RoadMarkRule> rule,
        Optional<Length> width
) {
    public RoadMarkExplicitLine {
        Objects.requireNonNull(length, "length");
        Objects.requireNonNull(tOffset, "tOffset");
        Objects.requireNonNull(sOffset, "sOffset");
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(width, "width");
    }
}
