package com.questrail.opendrive.internal.decode;

import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.model.ContactPoint;
import com.questrail.opendrive.model.ElementDir;
import com.questrail.opendrive.model.lane.Lanes;
import com.questrail.opendrive.model.object.RoadObjects;
import com.questrail.opendrive.model.road.CrgMode;
import com.questrail.opendrive.model.road.CrgOrientation;
import com.questrail.opendrive.model.road.CrgPurpose;
import com.questrail.opendrive.model.road.Elevation;
import com.questrail.opendrive.model.road.ElevationProfile;
import com.questrail.opendrive.model.road.LateralProfile;
import com.questrail.opendrive.model.road.LateralShape;
import com.questrail.opendrive.model.road.LinkElementType;
import com.questrail.opendrive.model.road.MaxSpeed;
import com.questrail.opendrive.model.road.PlanView;
import com.questrail.opendrive.model.road.Road;
import com.questrail.opendrive.model.road.RoadCrg;
import com.questrail.opendrive.model.road.RoadLink;
import com.questrail.opendrive.model.road.RoadLinkTarget;
import com.questrail.opendrive.model.road.RoadSpeed;
import com.questrail.opendrive.model.road.RoadSurface;
import com.questrail.opendrive.model.road.RoadType;
import com.questrail.opendrive.model.road.RoadTypeEntry;
import com.questrail.opendrive.model.road.Superelevation;
import com.questrail.opendrive.model.road.TrafficRule;
import com.questrail.opendrive.model.signal.Signals;
import com.questrail.opendrive.units.Length;
import com.questrail.opendrive.units.SpeedUnit;
import com.questrail.opendrive.validation.Violation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes {@code <road>} elements.
 *
 * <p>Every road is checked by the structural validator as soon as it has been
 * built; a violation aborts the read at the road element.</p>
 */
final class RoadDecoder
{
    private final GeometryDecoder geometryDecoder = new GeometryDecoder();
    private final LaneDecoder laneDecoder = new LaneDecoder();
    private final ObjectDecoder objectDecoder = new ObjectDecoder();
    private final SignalDecoder signalDecoder = new SignalDecoder();

    private static final class RoadParts
    {
        RoadLink link;
        final List<RoadTypeEntry> types = new ArrayList<>();
        PlanView planView;
        ElevationProfile elevationProfile;
        LateralProfile lateralProfile;
        Lanes lanes;
        RoadObjects objects;
        Signals signals;
        RoadSurface surface;
        final AdditionalDataCollector additional = new AdditionalDataCollector();
    }

    Road decodeRoad(ElementReader element) {
        String id = element.requiredId("id");
        Optional<String> name = element.optionalText("name");
        Length length = element.requiredNonNegativeLength("length");
        Optional<String> junction = decodeJunctionMembership(element);
        TrafficRule rule = element.optionalEnum("rule", TrafficRule.class, Road.DEFAULT_RULE);

        RoadParts parts = new RoadParts();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "link" -> {
                    element.requireAbsent(parts.link, "link");
                    parts.link = decodeLink(child);
                }
                case "type" -> parts.types.add(decodeType(child));
                case "planView" -> {
                    element.requireAbsent(parts.planView, "planView");
                    parts.planView = geometryDecoder.decodePlanView(child);
                }
                case "elevationProfile" -> {
                    element.requireAbsent(parts.elevationProfile, "elevationProfile");
                    parts.elevationProfile = decodeElevationProfile(child);
                }
                case "lateralProfile" -> {
                    element.requireAbsent(parts.lateralProfile, "lateralProfile");
                    parts.lateralProfile = decodeLateralProfile(child);
                }
                case "lanes" -> {
                    element.requireAbsent(parts.lanes, "lanes");
                    parts.lanes = laneDecoder.decodeLanes(child);
                }
                case "objects" -> {
                    element.requireAbsent(parts.objects, "objects");
                    parts.objects = objectDecoder.decodeObjects(child);
                }
                case "signals" -> {
                    element.requireAbsent(parts.signals, "signals");
                    parts.signals = signalDecoder.decodeSignals(child);
                }
                case "surface" -> {
                    element.requireAbsent(parts.surface, "surface");
                    parts.surface = decodeSurface(child);
                }
                default -> parts.additional.acceptOrSkip(child);
            }
        });

        if (parts.planView == null) {
            throw element.missingChild("planView");
        }
        if (parts.lanes == null) {
            throw element.missingChild("lanes");
        }

        AdditionalData additionalData = parts.additional.build();
        Road road = new Road(id, name, length, junction, rule, Optional.ofNullable(parts.link), parts.types,
                parts.planView, Optional.ofNullable(parts.elevationProfile), Optional.ofNullable(parts.lateralProfile),
                parts.lanes, Optional.ofNullable(parts.objects), Optional.ofNullable(parts.signals),
                Optional.ofNullable(parts.surface), additionalData);

        Optional<Violation> violation = element.context().validator().firstViolation(road);
        if (violation.isPresent()) {
            Violation v = violation.get();
            throw element.error(v.kind(), v.field(), null, v.element() + ": " + v.message());
        }
        return road;
    }

    private static Optional<String> decodeJunctionMembership(ElementReader element) {
        String raw = element.requiredText("junction");
        if (Road.NO_JUNCTION.equals(raw.strip())) {
            return Optional.empty();
        }
        return Optional.of(element.requiredId("junction"));
    }

    private static RoadSurface decodeSurface(ElementReader element) {
        List<RoadCrg> crgs = new ArrayList<>();
        element.forEachChild(child -> {
            if (child.name().equals("CRG")) {
                crgs.add(new RoadCrg(
                        child.requiredText("file"),
                        child.requiredNonNegativeLength("sStart"),
                        child.requiredNonNegativeLength("sEnd"),
                        child.requiredEnum("orientation", CrgOrientation.class),
                        child.requiredEnum("mode", CrgMode.class),
                        child.optionalEnum("purpose", CrgPurpose.class),
                        child.optionalLength("sOffset"),
                        child.optionalLength("tOffset"),
                        child.optionalLength("zOffset"),
                        child.optionalDouble("zScale"),
                        child.optionalAngle("hOffset")));
            } else {
                child.skipUnknown();
            }
        });
        return new RoadSurface(crgs);
    }

    private static RoadLink decodeLink(ElementReader element) {
        List<RoadLinkTarget> predecessor = new ArrayList<>(1);
        List<RoadLinkTarget> successor = new ArrayList<>(1);
        element.forEachChild(child -> {
            switch (child.name()) {
                case "predecessor" -> {
                    element.requireAbsent(predecessor.isEmpty() ? null : predecessor, "predecessor");
                    predecessor.add(decodeLinkTarget(child));
                }
                case "successor" -> {
                    element.requireAbsent(successor.isEmpty() ? null : successor, "successor");
                    successor.add(decodeLinkTarget(child));
                }
                default -> child.skipUnknown();
            }
        });
        return new RoadLink(predecessor.stream().findFirst(), successor.stream().findFirst());
    }

    private static RoadLinkTarget decodeLinkTarget(ElementReader element) {
        return new RoadLinkTarget(
                element.requiredId("elementId"),
                element.optionalEnum("elementType", LinkElementType.class),
                element.optionalEnum("contactPoint", ContactPoint.class),
                element.optionalEnum("elementDir", ElementDir.class),
                element.optionalNonNegativeLength("elementS"));
    }

    private static RoadTypeEntry decodeType(ElementReader element) {
        Length s = element.requiredNonNegativeLength("s");
        RoadType type = element.requiredEnum("type", RoadType.class);
        Optional<String> country = element.optionalText("country");

        List<RoadSpeed> speed = new ArrayList<>(1);
        element.forEachChild(child -> {
            if (child.name().equals("speed")) {
                element.requireAbsent(speed.isEmpty() ? null : speed, "speed");
                speed.add(decodeSpeed(child));
            } else {
                child.skipUnknown();
            }
        });
        return new RoadTypeEntry(s, type, country, speed.stream().findFirst());
    }

    private static RoadSpeed decodeSpeed(ElementReader element) {
        String raw = element.requiredText("max");
        MaxSpeed max = switch (raw.strip()) {
            case MaxSpeed.NO_LIMIT_TOKEN -> MaxSpeed.noLimit();
            case MaxSpeed.UNDEFINED_TOKEN -> MaxSpeed.undefined();
            default -> MaxSpeed.of(element.requiredFinite("max"));
        };
        SpeedUnit unit = element.optionalEnum("unit", SpeedUnit.class, RoadSpeed.DEFAULT_UNIT);
        return new RoadSpeed(max, unit);
    }

    private static ElevationProfile decodeElevationProfile(ElementReader element) {
        List<Elevation> elevations = new ArrayList<>();
        element.forEachChild(child -> {
            if (child.name().equals("elevation")) {
                elevations.add(new Elevation(child.requiredNonNegativeLength("s"), child.polynomial("")));
            } else {
                child.skipUnknown();
            }
        });
        return new ElevationProfile(elevations);
    }

    private static LateralProfile decodeLateralProfile(ElementReader element) {
        List<Superelevation> superelevations = new ArrayList<>();
        List<LateralShape> shapes = new ArrayList<>();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "superelevation" -> superelevations.add(
                        new Superelevation(child.requiredNonNegativeLength("s"), child.polynomial("")));
                case "shape" -> shapes.add(new LateralShape(
                        child.requiredNonNegativeLength("s"), child.requiredLength("t"), child.polynomial("")));
                default -> child.skipUnknown();
            }
        });
        return new LateralProfile(superelevations, shapes);
    }
}
