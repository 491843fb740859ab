package com.questrail.opendrive.model.road;

import com.questrail.opendrive.model.ContactPoint;
import com.questrail.opendrive.model.ElementDir;
import com.questrail.opendrive.units.Length;

import java.util.Objects;
import java.util.Optional;

/**
 * A road's {@code <predecessor>} or {@code <successor>}. The target is named by id only.
 */
public record RoadLinkTarget(
        String elementId,
        Optional<LinkElementType> elementType,
        Optional<ContactPoint> contactPoint,
        Optional<ElementDir> elementDir,
        Optional<Length> elementS
) {
    public RoadLinkTarget {
        Objects.requireNonNull(elementId, "elementId");
        Objects.requireNonNull(elementType, "elementType");
        Objects.requireNonNull(contactPoint, "contactPoint");
        Objects.requireNonNull(elementDir, "elementDir");
        Objects.requireNonNull(elementS, "elementS");
    }

    public static RoadLinkTarget road(String roadId, ContactPoint contactPoint) {
        return new RoadLinkTarget(roadId, Optional.of(LinkElementType.ROAD), Optional.of(contactPoint),
                Optional.empty(), Optional.empty());
    }

    public static RoadLinkTarget junction(String junctionId) {
        return new RoadLinkTarget(junctionId, Optional.of(LinkElementType.JUNCTION), Optional.empty(),
                Optional.empty(), Optional.empty());
    }
}
