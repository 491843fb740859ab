package com.questrail.opendrive.model.lane;

import java.util.List;

/**
 * {@code <lanes>}: lane offsets followed by at least one lane section.
 */
public record Lanes(List<LaneOffset> laneOffsets, List<LaneSection> laneSections)
{
    public Lanes {
        laneOffsets = List.copyOf(laneOffsets);
        laneSections = List.copyOf(laneSections);
        if (laneSections.isEmpty()) {
            throw new IllegalArgumentException("lanes requires at least one laneSection");
        }
    }

    public static Lanes of(LaneSection... sections) {
        return new Lanes(List.of(), List.of(sections));
    }
}
