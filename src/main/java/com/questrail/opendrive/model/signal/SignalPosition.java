package com.questrail.opendrive.model.signal;

import com.questrail.opendrive.units.Angle;
import com.questrail.opendrive.units.Length;

import java.util.Objects;
import java.util.Optional;

/**
 * SignalPosition
 * -----------------------------------------------------------------------------
 * Where a signal is physically mounted, when that differs from where it
 * applies.
 *
 * <p>A signal's own {@code s}/{@code t} give the position of validity. A
 * {@link Road} position ({@code <positionRoad>}) places the physical signal on
 * any road by reference-line coordinates; an {@link Inertial} position
 * ({@code <positionInertial>}) places it in the inertial frame.</p>
 */
public sealed interface SignalPosition permits SignalPosition.Road, SignalPosition.Inertial
{
    record Road(
            String roadId,
            Length s,
            Length t,
            Length zOffset,
            Angle hOffset,
            Optional<Angle> pitch,
            Optional<Angle> roll
    ) implements SignalPosition {
        public Road {
            Objects.requireNonNull(roadId, "roadId");
            Objects.requireNonNull(s, "s");
            Objects.requireNonNull(t, "t");
            Objects.requireNonNull(zOffset, "zOffset");
            Objects.requireNonNull(hOffset, "hOffset");
            Objects.requireNonNull(pitch, "pitch");
            Objects.requireNonNull(roll, "roll");
        }
    }

    record Inertial(
            Length x,
            Length y,
            Length z,
            Angle hdg,
            Optional<Angle> pitch,
            Optional<Angle> roll
    ) implements SignalPosition {
        public Inertial {
            Objects.requireNonNull(x, "x");
            Objects.requireNonNull(y, "y");
            Objects.requireNonNull(z, "z");
            Objects.requireNonNull(hdg, "hdg");
            Objects.requireNonNull(pitch, "pitch");
            Objects.requireNonNull(roll, "roll");
        }
    }
}
