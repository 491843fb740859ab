package com.questrail.opendrive.model.object;

import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.model.lane.LaneType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code <outline>}: the polygonal footprint of an object, in corner order.
 *
 * <p>All corners of one outline use the same coordinate frame in practice,
 * but the schema does not require it and neither does this type.
 * {@code outer} marks the outer outline of an object with holes;
 * {@code laneType} lets an outline act as an area of that lane type.</p>
 */
public record Outline(
        Optional<Integer> id,
        Optional<OutlineFillType> fillType,
        Optional<Boolean> outer,
        Optional<Boolean> closed,
        Optional<LaneType> laneType,
        List<OutlineCorner> corners,
        AdditionalData additionalData
) {
    public Outline {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fillType, "fillType");
        Objects.requireNonNull(outer, "outer");
        Objects.requireNonNull(closed, "closed");
        Objects.requireNonNull(laneType, "laneType");
        Objects.requireNonNull(additionalData, "additionalData");
        corners = List.copyOf(corners);
        if (corners.isEmpty()) {
            throw new IllegalArgumentException("outline requires at least one corner");
        }
    }

    public static Outline of(List<OutlineCorner> corners) {
        return new Outline(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
                corners, AdditionalData.EMPTY);
    }
}
