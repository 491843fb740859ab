package com.questrail.opendrive.model.object;

import com.questrail.opendrive.model.lane.RoadMarkColor;
import com.questrail.opendrive.model.lane.RoadMarkWeight;
import com.questrail.opendrive.units.Length;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ObjectMarking
 * -----------------------------------------------------------------------------
 * {@code <marking>} painted on or around an object, for example the stripes of
 * a crosswalk.
 *
 * <p>The marking runs either along one {@code side} of the object's bounding
 * box or along the outline corners listed in {@code cornerReferences}. Dashes
 * are {@code lineLength} long with {@code spaceLength} between them, starting
 * {@code startOffset} after the first corner and ending {@code stopOffset}
 * before the last.</p>
 */
public record ObjectMarking(
        RoadMarkColor color,
        Length lineLength,
        Length spaceLength,
        Length startOffset,
        Length stopOffset,
        Optional<SideType> side,
        Optional<RoadMarkWeight> weight,
        Optional<Length> width,
        Optional<Length> zOffset,
        List<Integer> cornerReferences
) {
    public ObjectMarking {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(lineLength, "lineLength");
        Objects.requireNonNull(spaceLength, "spaceLength");
        Objects.requireNonNull(startOffset, "startOffset");
        Objects.requireNonNull(stopOffset, "stopOffset");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(weight, "weight");
        Objects.requireNonNull(width, "width");
        Objects.requireNonNull(zOffset, "zOffset");
        cornerReferences = List.copyOf(cornerReferences);
    }
}
