package com.questrail.opendrive.model.road;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <link>} of a road.
 */
public record RoadLink(Optional<RoadLinkTarget> predecessor, Optional<RoadLinkTarget> successor)
{
    public RoadLink {
        Objects.requireNonNull(predecessor, "predecessor");
        Objects.requireNonNull(successor, "successor");
    }
}
