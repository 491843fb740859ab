package com.questrail.opendrive.units;

import java.util.Objects;

/**
 * A speed magnitude together with the unit it was declared in.
 *
 * <p>Unlike lengths and angles, OpenDRIVE lets each speed record name its own
 * unit, so the unit is part of the value. Two speeds are equal only if both the
 * magnitude and the declared unit match; use {@link #toMetersPerSecond()} to
 * compare physically.</p>
 */
public record Speed(double value, SpeedUnit unit)
{
    public Speed {
        Objects.requireNonNull(unit, "unit");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Speed must be finite (was " + value + ")");
        }
    }

    public static Speed of(double value, SpeedUnit unit) {
        return new Speed(value, unit);
    }

    public double toMetersPerSecond() {
        return value * unit.metersPerSecond();
    }

    public Speed convertTo(SpeedUnit target) {
        Objects.requireNonNull(target, "target");
        if (target == unit) {
            return this;
        }
        return new Speed(toMetersPerSecond() / target.metersPerSecond(), target);
    }

    @Override
    public String toString() {
        return NumericText.format(value) + " " + unit.xmlValue();
    }
}
