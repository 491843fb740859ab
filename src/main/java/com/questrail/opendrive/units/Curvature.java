package com.questrail.opendrive.units;

/**
 * Curvature in 1/m. Positive values turn left (counter-clockwise).
 */
public record Curvature(double perMeter)
{
    public static final Curvature ZERO = new Curvature(0.0);

    public Curvature {
        if (!Double.isFinite(perMeter)) {
            throw new IllegalArgumentException("Curvature must be finite (was " + perMeter + ")");
        }
    }

    public static Curvature of(double perMeter) {
        return new Curvature(perMeter);
    }

    /**
     * @return the signed radius in meters, infinite for a straight line
     */
    public double radius() {
        return perMeter == 0.0 ? Double.POSITIVE_INFINITY : 1.0 / perMeter;
    }

    @Override
    public String toString() {
        return NumericText.format(perMeter) + " 1/m";
    }
}
