package com.questrail.opendrive.geometry;

/**
 * A point on a reference line: inertial position in meters and heading in radians.
 */
public record Pose(double x, double y, double heading)
{
    /**
     * @return true if both positions and headings agree within {@code tolerance};
     *         headings are compared modulo 2&pi;
     */
    public boolean isCloseTo(Pose other, double tolerance) {
        return Math.abs(x - other.x) <= tolerance
                && Math.abs(y - other.y) <= tolerance
                && Math.abs(normalizeAngle(heading - other.heading)) <= tolerance;
    }

    static double normalizeAngle(double radians) {
        double a = Math.IEEEremainder(radians, 2.0 * Math.PI);
        return a == -Math.PI ? Math.PI : a;
    }
}
