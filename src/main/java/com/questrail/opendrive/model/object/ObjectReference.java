package com.questrail.opendrive.model.object;

import com.questrail.opendrive.model.Orientation;
import com.questrail.opendrive.model.signal.LaneValidity;
import com.questrail.opendrive.units.Length;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code <objectReference>}: places an object defined on another road onto this
 * road. {@code id} names the referenced object.
 */
public record ObjectReference(
        String id,
        Length s,
        Length t,
        Optional<Length> zOffset,
        Optional<Length> validLength,
        Orientation orientation,
        List<LaneValidity> validities
) {
    public ObjectReference {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(t, "t");
        Objects.requireNonNull(zOffset, "zOffset");
        Objects.requireNonNull(validLength, "validLength");
        Objects.requireNonNull(orientation, "orientation");
        validities = List.copyOf(validities);
    }
}
