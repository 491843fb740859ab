package com.questrail.opendrive.model.signal;

import com.questrail.opendrive.model.Orientation;
import com.questrail.opendrive.units.Length;

import java.util.List;
import java.util.Objects;

/**
 * {@code <signalReference>}: places a signal defined on another road onto this road.
 * {@code id} names the referenced signal.
 */
public record SignalReference(String id, Length s, Length t, Orientation orientation, List<LaneValidity> validities)
{
    public SignalReference {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(t, "t");
        Objects.requireNonNull(orientation, "orientation");
        validities = List.copyOf(validities);
    }
}
