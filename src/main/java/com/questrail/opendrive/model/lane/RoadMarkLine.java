package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.units.Length;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <line>} of a detailed road mark type.
 */
public record RoadMarkLine(
        Length length,
        Length space,
        Length tOffset,
        Length sOffset,
        Optional<RoadMarkRule> rule,
        Optional<Length> width,
        Optional<RoadMarkColor> color
) {
    public RoadMarkLine {
        Objects.requireNonNull(length, "length");
        Objects.requireNonNull(space, "space");
        Objects.requireNonNull(tOffset, "tOffset");
        Objects.requireNonNull(sOffset, "sOffset");
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(width, "width");
        Objects.requireNonNull(color, "color");
    }
}
