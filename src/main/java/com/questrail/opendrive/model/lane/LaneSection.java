package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.units.Length;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@code <laneSection>}: the lane layout valid from road coordinate {@code s}
 * until the next section begins.
 *
 * <p>Left and right lanes are held in document order. {@code singleSide}
 * defaults to {@code false}.</p>
 */
public record LaneSection(
        Length s,
        boolean singleSide,
        List<Lane> left,
        Lane center,
        List<Lane> right,
        AdditionalData additionalData
) {
    public LaneSection {
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(center, "center");
        Objects.requireNonNull(additionalData, "additionalData");
        left = List.copyOf(left);
        right = List.copyOf(right);
    }

    public List<Lane> lanes(LaneSide side) {
        return switch (side) {
            case LEFT -> left;
            case CENTER -> List.of(center);
            case RIGHT -> right;
        };
    }

    /**
     * Looks a lane up by id across all three sides.
     */
    public Optional<Lane> lane(int id) {
        return Stream.concat(Stream.concat(left.stream(), Stream.of(center)), right.stream())
                .filter(l -> l.id() == id)
                .findFirst();
    }
}
