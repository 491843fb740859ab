package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.units.Length;

import java.util.List;
import java.util.Objects;

/**
 * The optional {@code <type>} child of a road mark describing its individual lines.
 */
public record RoadMarkTypeDetail(String name, Length width, List<RoadMarkLine> lines)
{
    public RoadMarkTypeDetail {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(width, "width");
        lines = List.copyOf(lines);
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("road mark type requires at least one line");
        }
    }
}
