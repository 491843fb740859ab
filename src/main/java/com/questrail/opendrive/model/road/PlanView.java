package com.questrail.opendrive.model.road;

import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.api.OpenDriveException;
import com.questrail.opendrive.geometry.ContinuityDefect;
import com.questrail.opendrive.geometry.Geometry;
import com.questrail.opendrive.geometry.Pose;

import java.util.ArrayList;
import java.util.List;

/**
 * PlanView
 * -----------------------------------------------------------------------------
 * The reference line of a road: a non-empty, ordered list of {@link Geometry}
 * segments.
 *
 * <p>Extent ordering (first segment at {@code s = 0}, each segment starting where
 * the previous one ends) is enforced by the structural validator when a document
 * is read or written. Pose continuity across segment boundaries is a correctness
 * property of well-built data rather than a schema rule, so it is exposed as a
 * query through {@link #continuityDefects(double)}.</p>
 */
public record PlanView(List<Geometry> geometries)
{
    public PlanView {
        geometries = List.copyOf(geometries);
        if (geometries.isEmpty()) {
            throw new IllegalArgumentException("planView requires at least one geometry");
        }
    }

    public static PlanView of(Geometry... geometries) {
        return new PlanView(List.of(geometries));
    }

    /**
     * @return road coordinate where the last segment ends
     */
    public double length() {
        return geometries.get(geometries.size() - 1).end();
    }

    /**
     * Evaluates the reference line at road coordinate {@code s}.
     *
     * <p>At a shared boundary the later segment wins, except at the very end of the
     * line, which belongs to the last segment.</p>
     */
    public Pose evaluate(double s) {
        for (int i = geometries.size() - 1; i >= 0; i--) {
            Geometry g = geometries.get(i);
            double start = g.s().meters();
            if (s >= start && s <= g.end()) {
                return g.evaluate(Math.min(s - start, g.length().meters()));
            }
        }
        throw new OpenDriveException(ErrorKind.OFFSET_OUT_OF_RANGE,
                "s " + s + " not covered by any geometry of the plan view");
    }

    /**
     * Compares each segment's declared start pose with the end pose of its
     * predecessor.
     *
     * @param tolerance absolute tolerance in meters and radians
     * @return every boundary where the two disagree; empty for a continuous line
     */
    public List<ContinuityDefect> continuityDefects(double tolerance) {
        List<ContinuityDefect> defects = new ArrayList<>();
        for (int i = 1; i < geometries.size(); i++) {
            Pose expected = geometries.get(i - 1).endPose();
            Pose declared = geometries.get(i).startPose();
            if (!expected.isCloseTo(declared, tolerance)) {
                defects.add(new ContinuityDefect(i, expected, declared));
            }
        }
        return defects;
    }
}
