package com.questrail.opendrive.internal.encode;

import com.questrail.opendrive.model.object.Bridge;
import com.questrail.opendrive.model.object.ObjectBorder;
import com.questrail.opendrive.model.object.ObjectMarking;
import com.questrail.opendrive.model.object.ObjectMaterial;
import com.questrail.opendrive.model.object.ObjectReference;
import com.questrail.opendrive.model.object.ObjectRepeat;
import com.questrail.opendrive.model.object.ObjectSurface;
import com.questrail.opendrive.model.object.Outline;
import com.questrail.opendrive.model.object.OutlineCorner;
import com.questrail.opendrive.model.object.RoadObject;
import com.questrail.opendrive.model.object.RoadObjects;
import com.questrail.opendrive.model.object.Tunnel;

import java.util.List;

/**
 * Encodes road {@code <objects>}. Children of an object follow the schema
 * sequence: repeats, outline, outlines, materials, validities, parking space,
 * markings, borders, surface.
 */
final class ObjectEncoder
{
    XmlNode encodeObjects(RoadObjects objects) {
        XmlNode node = XmlNode.element("objects");
        objects.objects().forEach(object -> node.child(encodeObject(object)));
        objects.references().forEach(reference -> node.child(encodeReference(reference)));
        objects.tunnels().forEach(tunnel -> node.child(encodeTunnel(tunnel)));
        objects.bridges().forEach(bridge -> node.child(encodeBridge(bridge)));
        return node;
    }

    private static XmlNode encodeObject(RoadObject object) {
        XmlNode node = XmlNode.element("object");
        if (object.dynamic()) {
            node.yesNo("dynamic", true);
        }
        node.optionalAngle("hdg", object.hdg())
                .optionalLength("height", object.height())
                .attribute("id", object.id())
                .optionalLength("length", object.length())
                .optionalText("name", object.name())
                .optionalEnum("orientation", object.orientation())
                .optionalBoolean("perpToRoad", object.perpToRoad())
                .optionalAngle("pitch", object.pitch())
                .optionalLength("radius", object.radius())
                .optionalAngle("roll", object.roll())
                .attribute("s", object.s())
                .optionalText("subtype", object.subtype())
                .attribute("t", object.t())
                .optionalEnum("type", object.type())
                .optionalLength("validLength", object.validLength())
                .optionalLength("width", object.width())
                .attribute("zOffset", object.zOffset());

        object.repeats().forEach(repeat -> node.child(encodeRepeat(repeat)));
        object.outline().ifPresent(outline -> node.child(encodeOutline(outline)));
        if (!object.outlines().isEmpty()) {
            XmlNode outlines = XmlNode.element("outlines");
            object.outlines().forEach(outline -> outlines.child(encodeOutline(outline)));
            node.child(outlines);
        }
        for (ObjectMaterial material : object.materials()) {
            node.child(XmlNode.element("material")
                    .optionalDouble("friction", material.friction())
                    .optionalDouble("roughness", material.roughness())
                    .optionalText("surface", material.surface()));
        }
        SignalEncoder.appendValidities(node, object.validities());
        object.parkingSpace().ifPresent(parking -> node.child(XmlNode.element("parkingSpace")
                .attribute("access", parking.access())
                .optionalText("restrictions", parking.restrictions())));
        if (!object.markings().isEmpty()) {
            XmlNode markings = XmlNode.element("markings");
            object.markings().forEach(marking -> markings.child(encodeMarking(marking)));
            node.child(markings);
        }
        if (!object.borders().isEmpty()) {
            XmlNode borders = XmlNode.element("borders");
            object.borders().forEach(border -> borders.child(encodeBorder(border)));
            node.child(borders);
        }
        object.surface().ifPresent(surface -> node.child(encodeSurface(surface)));
        AdditionalDataEncoder.appendTo(node, object.additionalData());
        return node;
    }

    private static XmlNode encodeRepeat(ObjectRepeat repeat) {
        return XmlNode.element("repeat")
                .attribute("distance", repeat.distance())
                .attribute("heightEnd", repeat.heightEnd())
                .attribute("heightStart", repeat.heightStart())
                .attribute("length", repeat.length())
                .optionalLength("lengthEnd", repeat.lengthEnd())
                .optionalLength("lengthStart", repeat.lengthStart())
                .optionalLength("radiusEnd", repeat.radiusEnd())
                .optionalLength("radiusStart", repeat.radiusStart())
                .attribute("s", repeat.s())
                .attribute("tEnd", repeat.tEnd())
                .attribute("tStart", repeat.tStart())
                .optionalLength("widthEnd", repeat.widthEnd())
                .optionalLength("widthStart", repeat.widthStart())
                .optionalLength("zOffsetEnd", repeat.zOffsetEnd())
                .optionalLength("zOffsetStart", repeat.zOffsetStart());
    }

    private static XmlNode encodeOutline(Outline outline) {
        XmlNode node = XmlNode.element("outline")
                .optionalBoolean("closed", outline.closed())
                .optionalEnum("fillType", outline.fillType())
                .optionalInt("id", outline.id())
                .optionalEnum("laneType", outline.laneType())
                .optionalBoolean("outer", outline.outer());
        for (OutlineCorner corner : outline.corners()) {
            node.child(encodeCorner(corner));
        }
        AdditionalDataEncoder.appendTo(node, outline.additionalData());
        return node;
    }

    private static XmlNode encodeCorner(OutlineCorner corner) {
        if (corner instanceof OutlineCorner.Road road) {
            return XmlNode.element("cornerRoad")
                    .attribute("dz", road.dz())
                    .attribute("height", road.height())
                    .optionalInt("id", road.id())
                    .attribute("s", road.s())
                    .attribute("t", road.t());
        }
        OutlineCorner.Local local = (OutlineCorner.Local) corner;
        return XmlNode.element("cornerLocal")
                .attribute("height", local.height())
                .optionalInt("id", local.id())
                .attribute("u", local.u())
                .attribute("v", local.v())
                .attribute("z", local.z());
    }

    private static XmlNode encodeMarking(ObjectMarking marking) {
        XmlNode node = XmlNode.element("marking")
                .attribute("color", marking.color())
                .attribute("lineLength", marking.lineLength())
                .optionalEnum("side", marking.side())
                .attribute("spaceLength", marking.spaceLength())
                .attribute("startOffset", marking.startOffset())
                .attribute("stopOffset", marking.stopOffset())
                .optionalEnum("weight", marking.weight())
                .optionalLength("width", marking.width())
                .optionalLength("zOffset", marking.zOffset());
        appendCornerReferences(node, marking.cornerReferences());
        return node;
    }

    private static XmlNode encodeBorder(ObjectBorder border) {
        XmlNode node = XmlNode.element("border")
                .attribute("outlineId", border.outlineId())
                .attribute("type", border.type())
                .optionalBoolean("useCompleteOutline", border.useCompleteOutline())
                .attribute("width", border.width());
        appendCornerReferences(node, border.cornerReferences());
        return node;
    }

    private static void appendCornerReferences(XmlNode parent, List<Integer> corners) {
        for (int corner : corners) {
            parent.child(XmlNode.element("cornerReference").attribute("id", corner));
        }
    }

    private static XmlNode encodeSurface(ObjectSurface surface) {
        XmlNode node = XmlNode.element("surface");
        surface.crg().ifPresent(crg -> node.child(XmlNode.element("CRG")
                .optionalText("file", crg.file())
                .optionalBoolean("hideRoadSurfaceCRG", crg.hideRoadSurfaceCrg())
                .optionalDouble("zScale", crg.zScale())));
        return node;
    }

    private static XmlNode encodeReference(ObjectReference reference) {
        XmlNode node = XmlNode.element("objectReference")
                .attribute("id", reference.id())
                .attribute("orientation", reference.orientation())
                .attribute("s", reference.s())
                .attribute("t", reference.t())
                .optionalLength("validLength", reference.validLength())
                .optionalLength("zOffset", reference.zOffset());
        SignalEncoder.appendValidities(node, reference.validities());
        return node;
    }

    private static XmlNode encodeTunnel(Tunnel tunnel) {
        XmlNode node = XmlNode.element("tunnel")
                .optionalDouble("daylight", tunnel.daylight())
                .attribute("id", tunnel.id())
                .attribute("length", tunnel.length())
                .optionalDouble("lighting", tunnel.lighting())
                .optionalText("name", tunnel.name())
                .attribute("s", tunnel.s())
                .attribute("type", tunnel.type());
        SignalEncoder.appendValidities(node, tunnel.validities());
        return node;
    }

    private static XmlNode encodeBridge(Bridge bridge) {
        XmlNode node = XmlNode.element("bridge")
                .attribute("id", bridge.id())
                .attribute("length", bridge.length())
                .optionalText("name", bridge.name())
                .attribute("s", bridge.s())
                .attribute("type", bridge.type());
        SignalEncoder.appendValidities(node, bridge.validities());
        return node;
    }
}
