package com.questrail.opendrive.model.junction;

import com.questrail.opendrive.model.ElementDir;
import com.questrail.opendrive.model.road.LinkElementType;
import com.questrail.opendrive.units.Length;

import java.util.Objects;

/**
 * {@code <predecessor>} / {@code <successor>} of a connection in a virtual junction.
 */
public record ConnectionLink(String elementId, LinkElementType elementType, Length elementS, ElementDir elementDir)
{
    public ConnectionLink {
        Objects.requireNonNull(elementId, "elementId");
        Objects.requireNonNull(elementType, "elementType");
        Objects.requireNonNull(elementS, "elementS");
        Objects.requireNonNull(elementDir, "elementDir");
    }
}
