package com.questrail.opendrive.geometry;

/**
 * A straight line.
 */
public record Line() implements GeometryShape
{
    @Override
    public Pose advance(Pose start, double offset, double length) {
        return new Pose(
                start.x() + offset * Math.cos(start.heading()),
                start.y() + offset * Math.sin(start.heading()),
                start.heading());
    }

    @Override
    public String elementName() {
        return "line";
    }
}
