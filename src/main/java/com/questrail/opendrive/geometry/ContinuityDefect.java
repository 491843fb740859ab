package com.questrail.opendrive.geometry;

/**
 * A discontinuity between segment {@code index - 1} and segment {@code index}
 * of a reference line.
 *
 * @param index    index of the segment whose declared start does not match
 * @param expected pose at the end of the previous segment
 * @param declared declared start pose of segment {@code index}
 */
public record ContinuityDefect(int index, Pose expected, Pose declared)
{
    public double positionGap() {
        return Math.hypot(declared.x() - expected.x(), declared.y() - expected.y());
    }

    public double headingGap() {
        return Math.abs(Pose.normalizeAngle(declared.heading() - expected.heading()));
    }
}
