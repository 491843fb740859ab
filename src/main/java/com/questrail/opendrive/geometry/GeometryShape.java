package com.questrail.opendrive.geometry;

/**
 * The shape-specific part of a {@link Geometry} record.
 *
 * <p>The set of shapes is closed; every consumer handles all five variants.
 * A shape only knows how to advance a start pose along itself. Start position,
 * start heading and segment length belong to the enclosing {@link Geometry}.</p>
 */
public sealed interface GeometryShape permits Line, Arc, Spiral, Poly3, ParamPoly3
{
    /**
     * Evaluates the shape at local arc-length {@code offset} from {@code start}.
     *
     * @param start  start pose of the segment
     * @param offset local offset, already checked to lie in {@code [0, length]}
     * @param length declared segment length
     * @return the pose at {@code offset}
     */
    Pose advance(Pose start, double offset, double length);

    /**
     * @return the XML element name of this shape inside {@code <geometry>}
     */
    String elementName();
}
