package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.model.AdditionalData;

import java.util.List;
import java.util.Objects;

/**
 * {@code <explicit>}: irregular road mark geometry given line by line instead
 * of as a repeating pattern. At least one line is required.
 */
public record RoadMarkExplicit(List<RoadMarkExplicitLine> lines, AdditionalData additionalData)
{
    public RoadMarkExplicit {
        Objects.requireNonNull(additionalData, "additionalData");
        lines = List.copyOf(lines);
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("explicit road mark requires at least one line");
        }
    }
}
