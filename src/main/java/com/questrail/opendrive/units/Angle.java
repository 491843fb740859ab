package com.questrail.opendrive.units;

/**
 * A plane angle stored in radians, the unit every angular OpenDRIVE attribute uses.
 *
 * <p>Degrees exist only through the explicit {@link #ofDegrees(double)} and
 * {@link #toDegrees()} conversions; reading and writing never convert.</p>
 */
public record Angle(double radians)
{
    public static final Angle ZERO = new Angle(0.0);

    public Angle {
        if (!Double.isFinite(radians)) {
            throw new IllegalArgumentException("Angle must be finite (was " + radians + ")");
        }
    }

    public static Angle ofRadians(double radians) {
        return new Angle(radians);
    }

    public static Angle ofDegrees(double degrees) {
        return new Angle(Math.toRadians(degrees));
    }

    public double toDegrees() {
        return Math.toDegrees(radians);
    }

    @Override
    public String toString() {
        return NumericText.format(radians) + " rad";
    }
}
