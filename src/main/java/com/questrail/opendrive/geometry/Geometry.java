package com.questrail.opendrive.geometry;

import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.api.OpenDriveException;
import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.units.Angle;
import com.questrail.opendrive.units.Length;

import java.util.Objects;

/**
 * Geometry
 * -----------------------------------------------------------------------------
 * One {@code <geometry>} record of a road's plan view: a reference-line segment
 * starting at road coordinate {@code s}, at inertial position {@code (x, y)} with
 * heading {@code hdg}, extending for {@code length} meters along a
 * {@link GeometryShape}.
 *
 * <h2>Evaluation contract</h2>
 * <p>{@link #evaluate(double)} maps a <em>local</em> arc-length offset in
 * {@code [0, length]} to a {@link Pose}. Any other offset is a caller defect
 * reported as {@link ErrorKind#OFFSET_OUT_OF_RANGE}.</p>
 *
 * <h2>Construction</h2>
 * <p>A negative start offset or length is a programming error and fails with
 * {@link IllegalArgumentException}; the reader reports the equivalent document
 * defect as {@link ErrorKind#VALUE_OUT_OF_DOMAIN} before constructing.</p>
 */
public record Geometry(
        Length s,
        Length x,
        Length y,
        Angle hdg,
        Length length,
        GeometryShape shape,
        AdditionalData additionalData
) {
    public Geometry {
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
        Objects.requireNonNull(hdg, "hdg");
        Objects.requireNonNull(length, "length");
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(additionalData, "additionalData");
        if (s.isNegative()) {
            throw new IllegalArgumentException("geometry s must be non-negative (was " + s + ")");
        }
        if (length.isNegative()) {
            throw new IllegalArgumentException("geometry length must be non-negative (was " + length + ")");
        }
    }

    public static Geometry of(double s, double x, double y, double hdg, double length, GeometryShape shape) {
        return new Geometry(Length.of(s), Length.of(x), Length.of(y), Angle.ofRadians(hdg),
                Length.of(length), shape, AdditionalData.EMPTY);
    }

    /**
     * Creates a segment that starts exactly where {@code pose} is.
     */
    public static Geometry startingAt(double s, Pose pose, double length, GeometryShape shape) {
        return of(s, pose.x(), pose.y(), pose.heading(), length, shape);
    }

    public Pose startPose() {
        return new Pose(x.meters(), y.meters(), hdg.radians());
    }

    public Pose endPose() {
        return evaluate(length.meters());
    }

    /**
     * @return road coordinate at which this segment ends
     */
    public double end() {
        return s.meters() + length.meters();
    }

    /**
     * Evaluates the segment at a local arc-length offset.
     *
     * @param offset distance from the segment start, in {@code [0, length]}
     * @return position and heading at that offset
     * @throws OpenDriveException with {@link ErrorKind#OFFSET_OUT_OF_RANGE} outside the segment
     */
    public Pose evaluate(double offset) {
        if (!(offset >= 0.0 && offset <= length.meters())) {
            throw new OpenDriveException(ErrorKind.OFFSET_OUT_OF_RANGE,
                    "offset " + offset + " outside [0, " + length.meters() + "] of " + shape.elementName());
        }
        return shape.advance(startPose(), offset, length.meters());
    }

    public Geometry withAdditionalData(AdditionalData additionalData) {
        return new Geometry(s, x, y, hdg, length, shape, additionalData);
    }
}
