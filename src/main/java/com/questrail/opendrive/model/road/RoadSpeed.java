package com.questrail.opendrive.model.road;

import com.questrail.opendrive.units.Speed;
import com.questrail.opendrive.units.SpeedUnit;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <speed>} inside a road {@code <type>}. The unit defaults to m/s.
 */
public record RoadSpeed(MaxSpeed max, SpeedUnit unit)
{
    public static final SpeedUnit DEFAULT_UNIT = SpeedUnit.METERS_PER_SECOND;

    public RoadSpeed {
        Objects.requireNonNull(max, "max");
        Objects.requireNonNull(unit, "unit");
    }

    /**
     * @return the limit as a speed, or empty for {@code no limit} / {@code undefined}
     */
    public Optional<Speed> asSpeed() {
        if (max.kind() != MaxSpeed.Kind.VALUE) {
            return Optional.empty();
        }
        return Optional.of(Speed.of(max.value(), unit));
    }
}
