package com.questrail.opendrive.validation;

import com.questrail.opendrive.OpenDriveVersion;
import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.geometry.Geometry;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.model.Header;
import com.questrail.opendrive.model.junction.Connection;
import com.questrail.opendrive.model.junction.Junction;
import com.questrail.opendrive.model.junction.JunctionGroup;
import com.questrail.opendrive.model.lane.Lane;
import com.questrail.opendrive.model.lane.LaneBoundary;
import com.questrail.opendrive.model.lane.LaneSection;
import com.questrail.opendrive.model.lane.LaneSide;
import com.questrail.opendrive.model.lane.RoadMark;
import com.questrail.opendrive.model.object.Bridge;
import com.questrail.opendrive.model.object.ObjectReference;
import com.questrail.opendrive.model.object.RoadObject;
import com.questrail.opendrive.model.object.Tunnel;
import com.questrail.opendrive.model.road.Road;
import com.questrail.opendrive.model.road.RoadLinkTarget;
import com.questrail.opendrive.model.signal.Controller;
import com.questrail.opendrive.model.signal.Signal;
import com.questrail.opendrive.model.signal.SignalPosition;
import com.questrail.opendrive.model.signal.SignalReference;
import com.questrail.opendrive.units.Length;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * StructuralValidator
 * -----------------------------------------------------------------------------
 * Per-element structural invariants of the model.
 *
 * <p>The reader runs these checks on every road it builds and the writer runs
 * them before producing output, so a document that fails here can neither be
 * read nor written. Checks cover:</p>
 * <ul>
 *   <li>reference line extents: the first geometry starts at {@code s = 0},
 *       every geometry starts where its predecessor ends, and the last one ends
 *       at the road length</li>
 *   <li>lane sections start at {@code s = 0} and never go backwards</li>
 *   <li>lane ids are unique per side and carry the sign of their side</li>
 *   <li>width, border and road mark offsets never go backwards within a lane</li>
 *   <li>id syntax of ids and id references</li>
 * </ul>
 *
 * <p>Offsets are compared with a tolerance of {@value #RELATIVE_TOLERANCE}
 * relative to their magnitude (absolute below 1 m). Nothing here resolves a
 * reference across the document.</p>
 */
public final class StructuralValidator
{
    public static final double RELATIVE_TOLERANCE = 1e-6;

    /**
     * @return every violation in {@code road}, in document order; empty if valid
     */
    public List<Violation> check(Road road) {
        List<Violation> violations = new ArrayList<>();
        String path = "road[" + road.id() + "]";

        checkId(violations, path, "id", road.id());
        road.junction().ifPresent(j -> checkId(violations, path, "junction", j));
        road.link().ifPresent(link -> {
            link.predecessor().ifPresent(t -> checkLinkTarget(violations, path + "/link/predecessor", t));
            link.successor().ifPresent(t -> checkLinkTarget(violations, path + "/link/successor", t));
        });

        checkGeometryExtents(violations, path, road);
        checkLaneSections(violations, path, road);

        road.signals().ifPresent(signals -> {
            for (Signal signal : signals.signals()) {
                checkSignal(violations, path + "/signals/signal[" + signal.id() + "]", signal);
            }
            for (SignalReference reference : signals.references()) {
                checkId(violations, path + "/signals/signalReference", "id", reference.id());
            }
        });
        road.objects().ifPresent(objects -> {
            for (RoadObject object : objects.objects()) {
                checkId(violations, path + "/objects/object", "id", object.id());
            }
            for (ObjectReference reference : objects.references()) {
                checkId(violations, path + "/objects/objectReference", "id", reference.id());
            }
            for (Tunnel tunnel : objects.tunnels()) {
                checkId(violations, path + "/objects/tunnel", "id", tunnel.id());
            }
            for (Bridge bridge : objects.bridges()) {
                checkId(violations, path + "/objects/bridge", "id", bridge.id());
            }
        });
        return violations;
    }

    private static void checkSignal(List<Violation> violations, String path, Signal signal) {
        checkId(violations, path, "id", signal.id());
        signal.dependencies().forEach(d -> checkId(violations, path + "/dependency", "id", d.id()));
        signal.references().forEach(r -> checkId(violations, path + "/reference", "elementId", r.elementId()));
        signal.position()
                .filter(SignalPosition.Road.class::isInstance)
                .map(SignalPosition.Road.class::cast)
                .ifPresent(p -> checkId(violations, path + "/positionRoad", "roadId", p.roadId()));
    }

    /**
     * Checks the whole document: header revision, every road, controller,
     * junction and junction group.
     */
    public List<Violation> check(Document document) {
        List<Violation> violations = new ArrayList<>();
        Header header = document.header();
        if (!OpenDriveVersion.isSupported(header.revMajor(), header.revMinor())) {
            violations.add(new Violation(ErrorKind.UNSUPPORTED_VERSION, "header", "revMinor",
                    "revision " + header.revMajor() + "." + header.revMinor() + " is not "
                            + OpenDriveVersion.STANDARD_VERSION + " or an earlier 1.x revision"));
        }
        for (Road road : document.roads()) {
            violations.addAll(check(road));
        }
        for (Controller controller : document.controllers()) {
            String path = "controller[" + controller.id() + "]";
            checkId(violations, path, "id", controller.id());
            controller.controls().forEach(c -> checkId(violations, path + "/control", "signalId", c.signalId()));
        }
        for (Junction junction : document.junctions()) {
            violations.addAll(check(junction));
        }
        for (JunctionGroup group : document.junctionGroups()) {
            String path = "junctionGroup[" + group.id() + "]";
            checkId(violations, path, "id", group.id());
            group.junctionReferences().forEach(j -> checkId(violations, path + "/junctionReference", "junction", j));
        }
        return violations;
    }

    public List<Violation> check(Junction junction) {
        List<Violation> violations = new ArrayList<>();
        String path = "junction[" + junction.id() + "]";
        checkId(violations, path, "id", junction.id());
        junction.mainRoad().ifPresent(r -> checkId(violations, path, "mainRoad", r));
        for (Connection c : junction.connections()) {
            String cPath = path + "/connection[" + c.id() + "]";
            checkId(violations, cPath, "id", c.id());
            c.incomingRoad().ifPresent(r -> checkId(violations, cPath, "incomingRoad", r));
            c.connectingRoad().ifPresent(r -> checkId(violations, cPath, "connectingRoad", r));
            c.linkedRoad().ifPresent(r -> checkId(violations, cPath, "linkedRoad", r));
            c.predecessor().ifPresent(l -> checkId(violations, cPath + "/predecessor", "elementId", l.elementId()));
            c.successor().ifPresent(l -> checkId(violations, cPath + "/successor", "elementId", l.elementId()));
        }
        junction.controllers().forEach(c -> checkId(violations, path + "/controller", "id", c.id()));
        return violations;
    }

    /**
     * @return the first violation in {@code road}, if any
     */
    public Optional<Violation> firstViolation(Road road) {
        List<Violation> violations = check(road);
        return violations.isEmpty() ? Optional.empty() : Optional.of(violations.get(0));
    }

    private static void checkLinkTarget(List<Violation> violations, String path, RoadLinkTarget target) {
        checkId(violations, path, "elementId", target.elementId());
    }

    private static void checkId(List<Violation> violations, String path, String field, String id) {
        if (!Ids.isWellFormed(id)) {
            violations.add(new Violation(ErrorKind.UNRESOLVED_REFERENCE, path, field,
                    "'" + id + "' is not a well-formed id (empty or contains whitespace)"));
        }
    }

    private static void checkGeometryExtents(List<Violation> violations, String path, Road road) {
        List<Geometry> geometries = road.planView().geometries();
        Geometry first = geometries.get(0);
        if (!approximately(first.s().meters(), 0.0)) {
            violations.add(new Violation(ErrorKind.STRUCTURAL_VIOLATION, path + "/planView/geometry[0]", "s",
                    "reference line must start at s=0 (starts at " + first.s().meters() + ")"));
        }
        for (int i = 1; i < geometries.size(); i++) {
            Geometry previous = geometries.get(i - 1);
            Geometry current = geometries.get(i);
            double expected = previous.end();
            double actual = current.s().meters();
            if (!approximately(expected, actual)) {
                String what = actual > expected ? "gap" : "overlap";
                violations.add(new Violation(ErrorKind.STRUCTURAL_VIOLATION,
                        path + "/planView/geometry[" + i + "]", "s",
                        what + " in reference line: geometry " + (i - 1) + " ends at " + expected
                                + " but geometry " + i + " starts at " + actual));
            }
        }
        double end = geometries.get(geometries.size() - 1).end();
        Length length = road.length();
        if (length.isNegative()) {
            violations.add(new Violation(ErrorKind.VALUE_OUT_OF_DOMAIN, path, "length",
                    "road length must be non-negative (was " + length.meters() + ")"));
        } else if (!approximately(end, length.meters())) {
            violations.add(new Violation(ErrorKind.STRUCTURAL_VIOLATION, path, "length",
                    "road length " + length.meters() + " differs from reference line end " + end));
        }
    }

    private static void checkLaneSections(List<Violation> violations, String path, Road road) {
        List<LaneSection> sections = road.lanes().laneSections();
        double previous = 0.0;
        for (int i = 0; i < sections.size(); i++) {
            LaneSection section = sections.get(i);
            String sPath = path + "/lanes/laneSection[" + i + "]";
            double s = section.s().meters();
            if (i == 0 && !approximately(s, 0.0)) {
                violations.add(new Violation(ErrorKind.STRUCTURAL_VIOLATION, sPath, "s",
                        "first lane section must start at s=0 (starts at " + s + ")"));
            } else if (s < previous && !approximately(s, previous)) {
                violations.add(new Violation(ErrorKind.STRUCTURAL_VIOLATION, sPath, "s",
                        "lane section starts at " + s + " before previous section at " + previous));
            }
            previous = s;

            for (LaneSide side : LaneSide.values()) {
                checkLaneIds(violations, sPath + "/" + side.elementName(), side, section.lanes(side));
            }
            for (LaneSide side : LaneSide.values()) {
                for (Lane lane : section.lanes(side)) {
                    checkLaneOffsets(violations, sPath + "/" + side.elementName() + "/lane[" + lane.id() + "]", lane);
                }
            }
        }
    }

    private static void checkLaneIds(List<Violation> violations, String path, LaneSide side, List<Lane> lanes) {
        Set<Integer> seen = new HashSet<>();
        for (Lane lane : lanes) {
            if (!seen.add(lane.id())) {
                violations.add(new Violation(ErrorKind.STRUCTURAL_VIOLATION, path, "id",
                        "duplicate lane id " + lane.id() + " on " + side.elementName() + " side"));
            }
        }
        for (Lane lane : lanes) {
            if (!side.accepts(lane.id())) {
                violations.add(new Violation(ErrorKind.STRUCTURAL_VIOLATION, path, "id",
                        "lane id " + lane.id() + " does not belong on the " + side.elementName() + " side"));
            }
        }
    }

    private static void checkLaneOffsets(List<Violation> violations, String path, Lane lane) {
        double previous = Double.NEGATIVE_INFINITY;
        for (LaneBoundary boundary : lane.boundaries()) {
            double sOffset = boundary.sOffset().meters();
            if (sOffset < previous && !approximately(sOffset, previous)) {
                violations.add(new Violation(ErrorKind.STRUCTURAL_VIOLATION, path + "/" + boundary.elementName(),
                        "sOffset", "sOffset " + sOffset + " precedes previous record at " + previous));
            }
            previous = sOffset;
        }
        previous = Double.NEGATIVE_INFINITY;
        for (RoadMark mark : lane.roadMarks()) {
            double sOffset = mark.sOffset().meters();
            if (sOffset < previous && !approximately(sOffset, previous)) {
                violations.add(new Violation(ErrorKind.STRUCTURAL_VIOLATION, path + "/roadMark",
                        "sOffset", "sOffset " + sOffset + " precedes previous road mark at " + previous));
            }
            previous = sOffset;
        }
    }

    static boolean approximately(double a, double b) {
        double scale = Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
        return Math.abs(a - b) <= RELATIVE_TOLERANCE * scale;
    }
}
