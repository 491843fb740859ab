package com.questrail.opendrive.internal.decode;

import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.model.Orientation;
import com.questrail.opendrive.model.lane.LaneType;
import com.questrail.opendrive.model.lane.RoadMarkColor;
import com.questrail.opendrive.model.lane.RoadMarkWeight;
import com.questrail.opendrive.model.object.BorderType;
import com.questrail.opendrive.model.object.Bridge;
import com.questrail.opendrive.model.object.BridgeType;
import com.questrail.opendrive.model.object.ObjectBorder;
import com.questrail.opendrive.model.object.ObjectMarking;
import com.questrail.opendrive.model.object.ObjectMaterial;
import com.questrail.opendrive.model.object.ObjectReference;
import com.questrail.opendrive.model.object.ObjectRepeat;
import com.questrail.opendrive.model.object.ObjectSurface;
import com.questrail.opendrive.model.object.ObjectType;
import com.questrail.opendrive.model.object.Outline;
import com.questrail.opendrive.model.object.OutlineCorner;
import com.questrail.opendrive.model.object.OutlineFillType;
import com.questrail.opendrive.model.object.ParkingAccess;
import com.questrail.opendrive.model.object.ParkingSpace;
import com.questrail.opendrive.model.object.RoadObject;
import com.questrail.opendrive.model.object.RoadObjects;
import com.questrail.opendrive.model.object.SideType;
import com.questrail.opendrive.model.object.Tunnel;
import com.questrail.opendrive.model.object.TunnelType;
import com.questrail.opendrive.model.signal.LaneValidity;
import com.questrail.opendrive.units.Angle;
import com.questrail.opendrive.units.Length;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes road {@code <objects>}: objects with their outlines, repeats,
 * markings and borders, object references, tunnels and bridges.
 */
final class ObjectDecoder
{
    RoadObjects decodeObjects(ElementReader element) {
        List<RoadObject> objects = new ArrayList<>();
        List<ObjectReference> references = new ArrayList<>();
        List<Tunnel> tunnels = new ArrayList<>();
        List<Bridge> bridges = new ArrayList<>();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "object" -> objects.add(decodeObject(child));
                case "objectReference" -> references.add(decodeReference(child));
                case "tunnel" -> tunnels.add(decodeTunnel(child));
                case "bridge" -> bridges.add(decodeBridge(child));
                default -> child.skipUnknown();
            }
        });
        return new RoadObjects(objects, references, tunnels, bridges);
    }

    private static RoadObject decodeObject(ElementReader element) {
        String id = element.requiredId("id");
        Length s = element.requiredNonNegativeLength("s");
        Length t = element.requiredLength("t");
        Length zOffset = element.requiredLength("zOffset");
        Optional<ObjectType> type = element.optionalEnum("type", ObjectType.class);
        Optional<String> subtype = element.optionalText("subtype");
        Optional<String> name = element.optionalText("name");
        boolean dynamic = element.optionalYesNo("dynamic", false);
        Optional<Orientation> orientation = element.optionalEnum("orientation", Orientation.class);
        Optional<Angle> hdg = element.optionalAngle("hdg");
        Optional<Angle> pitch = element.optionalAngle("pitch");
        Optional<Angle> roll = element.optionalAngle("roll");
        Optional<Length> height = element.optionalLength("height");
        Optional<Length> length = element.optionalLength("length");
        Optional<Length> width = element.optionalLength("width");
        Optional<Length> radius = element.optionalLength("radius");
        Optional<Length> validLength = element.optionalNonNegativeLength("validLength");
        Optional<Boolean> perpToRoad = element.optionalBoolean("perpToRoad");

        ObjectParts parts = new ObjectParts();
        AdditionalDataCollector additional = new AdditionalDataCollector();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "repeat" -> parts.repeats.add(decodeRepeat(child));
                case "outline" -> {
                    element.requireAbsent(parts.outline, "outline");
                    parts.outline = decodeOutline(child);
                }
                case "outlines" -> {
                    element.requireAbsent(parts.outlinesSeen, "outlines");
                    parts.outlinesSeen = Boolean.TRUE;
                    child.forEachChild(outline -> {
                        if (outline.name().equals("outline")) {
                            parts.outlines.add(decodeOutline(outline));
                        } else {
                            outline.skipUnknown();
                        }
                    });
                }
                case "material" -> parts.materials.add(new ObjectMaterial(child.optionalText("surface"),
                        child.optionalDouble("friction"), child.optionalDouble("roughness")));
                case "validity" -> parts.validities.add(SignalDecoder.decodeValidity(child));
                case "parkingSpace" -> {
                    element.requireAbsent(parts.parkingSpace, "parkingSpace");
                    parts.parkingSpace = new ParkingSpace(child.requiredEnum("access", ParkingAccess.class),
                            child.optionalText("restrictions"));
                }
                case "markings" -> child.forEachChild(marking -> {
                    if (marking.name().equals("marking")) {
                        parts.markings.add(decodeMarking(marking));
                    } else {
                        marking.skipUnknown();
                    }
                });
                case "borders" -> child.forEachChild(border -> {
                    if (border.name().equals("border")) {
                        parts.borders.add(decodeBorder(border));
                    } else {
                        border.skipUnknown();
                    }
                });
                case "surface" -> {
                    element.requireAbsent(parts.surface, "surface");
                    parts.surface = decodeSurface(child);
                }
                default -> additional.acceptOrSkip(child);
            }
        });
        AdditionalData additionalData = additional.build();
        return new RoadObject(id, s, t, zOffset, type, subtype, name, dynamic, orientation, hdg, pitch, roll,
                height, length, width, radius, validLength, perpToRoad, parts.repeats,
                Optional.ofNullable(parts.outline), parts.outlines, parts.materials, parts.validities,
                Optional.ofNullable(parts.parkingSpace), parts.markings, parts.borders,
                Optional.ofNullable(parts.surface), additionalData);
    }

    private static ObjectRepeat decodeRepeat(ElementReader element) {
        return new ObjectRepeat(
                element.requiredNonNegativeLength("s"),
                element.requiredNonNegativeLength("length"),
                element.requiredNonNegativeLength("distance"),
                element.requiredLength("tStart"),
                element.requiredLength("tEnd"),
                element.requiredLength("heightStart"),
                element.requiredLength("heightEnd"),
                element.optionalLength("zOffsetStart"),
                element.optionalLength("zOffsetEnd"),
                element.optionalLength("widthStart"),
                element.optionalLength("widthEnd"),
                element.optionalLength("lengthStart"),
                element.optionalLength("lengthEnd"),
                element.optionalLength("radiusStart"),
                element.optionalLength("radiusEnd"));
    }

    private static Outline decodeOutline(ElementReader element) {
        Optional<Integer> id = element.optionalInt("id");
        Optional<OutlineFillType> fillType = element.optionalEnum("fillType", OutlineFillType.class);
        Optional<Boolean> outer = element.optionalBoolean("outer");
        Optional<Boolean> closed = element.optionalBoolean("closed");
        Optional<LaneType> laneType = element.optionalEnum("laneType", LaneType.class);
        List<OutlineCorner> corners = new ArrayList<>();
        AdditionalDataCollector additional = new AdditionalDataCollector();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "cornerRoad" -> corners.add(new OutlineCorner.Road(
                        child.requiredNonNegativeLength("s"),
                        child.requiredLength("t"),
                        child.requiredLength("dz"),
                        child.requiredLength("height"),
                        child.optionalInt("id")));
                case "cornerLocal" -> corners.add(new OutlineCorner.Local(
                        child.requiredLength("u"),
                        child.requiredLength("v"),
                        child.requiredLength("z"),
                        child.requiredLength("height"),
                        child.optionalInt("id")));
                default -> additional.acceptOrSkip(child);
            }
        });
        if (corners.isEmpty()) {
            throw element.missingChild("cornerRoad");
        }
        return new Outline(id, fillType, outer, closed, laneType, corners, additional.build());
    }

    private static ObjectMarking decodeMarking(ElementReader element) {
        RoadMarkColor color = element.requiredEnum("color", RoadMarkColor.class);
        Length lineLength = element.requiredNonNegativeLength("lineLength");
        Length spaceLength = element.requiredNonNegativeLength("spaceLength");
        Length startOffset = element.requiredLength("startOffset");
        Length stopOffset = element.requiredLength("stopOffset");
        Optional<SideType> side = element.optionalEnum("side", SideType.class);
        Optional<RoadMarkWeight> weight = element.optionalEnum("weight", RoadMarkWeight.class);
        Optional<Length> width = element.optionalNonNegativeLength("width");
        Optional<Length> zOffset = element.optionalLength("zOffset");
        List<Integer> corners = decodeCornerReferences(element);
        return new ObjectMarking(color, lineLength, spaceLength, startOffset, stopOffset, side, weight, width,
                zOffset, corners);
    }

    private static ObjectBorder decodeBorder(ElementReader element) {
        BorderType type = element.requiredEnum("type", BorderType.class);
        Length width = element.requiredNonNegativeLength("width");
        int outlineId = element.requiredInt("outlineId");
        Optional<Boolean> useCompleteOutline = element.optionalBoolean("useCompleteOutline");
        List<Integer> corners = decodeCornerReferences(element);
        return new ObjectBorder(type, width, outlineId, useCompleteOutline, corners);
    }

    private static List<Integer> decodeCornerReferences(ElementReader element) {
        List<Integer> corners = new ArrayList<>();
        element.forEachChild(child -> {
            if (child.name().equals("cornerReference")) {
                corners.add(child.requiredInt("id"));
            } else {
                child.skipUnknown();
            }
        });
        return corners;
    }

    private static ObjectSurface decodeSurface(ElementReader element) {
        ObjectSurface.Crg[] crg = new ObjectSurface.Crg[1];
        element.forEachChild(child -> {
            if (child.name().equals("CRG")) {
                element.requireAbsent(crg[0], "CRG");
                crg[0] = new ObjectSurface.Crg(child.optionalText("file"),
                        child.optionalBoolean("hideRoadSurfaceCRG"), child.optionalDouble("zScale"));
            } else {
                child.skipUnknown();
            }
        });
        return new ObjectSurface(Optional.ofNullable(crg[0]));
    }

    private static ObjectReference decodeReference(ElementReader element) {
        String id = element.requiredId("id");
        Length s = element.requiredNonNegativeLength("s");
        Length t = element.requiredLength("t");
        Optional<Length> zOffset = element.optionalLength("zOffset");
        Optional<Length> validLength = element.optionalNonNegativeLength("validLength");
        Orientation orientation = element.requiredEnum("orientation", Orientation.class);
        List<LaneValidity> validities = SignalDecoder.decodeValidities(element);
        return new ObjectReference(id, s, t, zOffset, validLength, orientation, validities);
    }

    private static Tunnel decodeTunnel(ElementReader element) {
        String id = element.requiredId("id");
        Length s = element.requiredNonNegativeLength("s");
        Length length = element.requiredNonNegativeLength("length");
        Optional<String> name = element.optionalText("name");
        TunnelType type = element.requiredEnum("type", TunnelType.class);
        Optional<Double> lighting = element.optionalDouble("lighting");
        Optional<Double> daylight = element.optionalDouble("daylight");
        List<LaneValidity> validities = SignalDecoder.decodeValidities(element);
        return new Tunnel(id, s, length, name, type, lighting, daylight, validities);
    }

    private static Bridge decodeBridge(ElementReader element) {
        String id = element.requiredId("id");
        Length s = element.requiredNonNegativeLength("s");
        Length length = element.requiredNonNegativeLength("length");
        Optional<String> name = element.optionalText("name");
        BridgeType type = element.requiredEnum("type", BridgeType.class);
        List<LaneValidity> validities = SignalDecoder.decodeValidities(element);
        return new Bridge(id, s, length, name, type, validities);
    }

    private static final class ObjectParts
    {
        final List<ObjectRepeat> repeats = new ArrayList<>();
        Outline outline;
        Boolean outlinesSeen;
        final List<Outline> outlines = new ArrayList<>();
        final List<ObjectMaterial> materials = new ArrayList<>();
        final List<LaneValidity> validities = new ArrayList<>();
        ParkingSpace parkingSpace;
        final List<ObjectMarking> markings = new ArrayList<>();
        final List<ObjectBorder> borders = new ArrayList<>();
        ObjectSurface surface;
    }
}
