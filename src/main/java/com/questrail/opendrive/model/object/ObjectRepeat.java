package com.questrail.opendrive.model.object;

import com.questrail.opendrive.units.Length;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <repeat>}: repeats the parent object along the road from {@code s}
 * over {@code length}, every {@code distance} metres ({@code 0} for a
 * continuous object such as a guard rail).
 *
 * <p>Position and size are interpolated linearly between the {@code *Start}
 * and {@code *End} values. Absent size pairs keep the parent object's
 * size.</p>
 */
public record ObjectRepeat(
        Length s,
        Length length,
        Length distance,
        Length tStart,
        Length tEnd,
        Length heightStart,
        Length heightEnd,
        Optional<Length> zOffsetStart,
        Optional<Length> zOffsetEnd,
        Optional<Length> widthStart,
        Optional<Length> widthEnd,
        Optional<Length> lengthStart,
        Optional<Length> lengthEnd,
        Optional<Length> radiusStart,
        Optional<Length> radiusEnd
) {
    public ObjectRepeat {
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(length, "length");
        Objects.requireNonNull(distance, "distance");
        Objects.requireNonNull(tStart, "tStart");
        Objects.requireNonNull(tEnd, "tEnd");
        Objects.requireNonNull(heightStart, "heightStart");
        Objects.requireNonNull(heightEnd, "heightEnd");
        Objects.requireNonNull(zOffsetStart, "zOffsetStart");
        Objects.requireNonNull(zOffsetEnd, "zOffsetEnd");
        Objects.requireNonNull(widthStart, "widthStart");
        Objects.requireNonNull(widthEnd, "widthEnd");
        Objects.requireNonNull(lengthStart, "lengthStart");
        Objects.requireNonNull(lengthEnd, "lengthEnd");
        Objects.requireNonNull(radiusStart, "radiusStart");
        Objects.requireNonNull(radiusEnd, "radiusEnd");
    }

    /**
     * A repeat with constant lateral offset and height and no size overrides.
     */
    public static ObjectRepeat along(double s, double length, double distance, double t, double height) {
        return new ObjectRepeat(Length.of(s), Length.of(length), Length.of(distance), Length.of(t), Length.of(t),
                Length.of(height), Length.of(height), Optional.empty(), Optional.empty(), Optional.empty(),
                Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }
}
