package com.questrail.opendrive.units;

/**
 * A length (or signed coordinate / offset) in meters.
 *
 * <p>The magnitude must be finite. Whether a negative length is meaningful
 * depends on the field: coordinates and lateral offsets may be negative, arc
 * lengths and segment lengths may not. That range check belongs to the reader
 * and validator, not to this type.</p>
 */
public record Length(double meters)
{
    public static final Length ZERO = new Length(0.0);

    public Length {
        if (!Double.isFinite(meters)) {
            throw new IllegalArgumentException("Length must be finite (was " + meters + ")");
        }
    }

    public static Length of(double meters) {
        return new Length(meters);
    }

    public boolean isNegative() {
        return meters < 0.0;
    }

    public Length plus(Length other) {
        return new Length(meters + other.meters);
    }

    @Override
    public String toString() {
        return NumericText.format(meters) + " m";
    }
}
