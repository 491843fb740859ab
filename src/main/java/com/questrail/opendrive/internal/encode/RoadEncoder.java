package com.questrail.opendrive.internal.encode;

import com.questrail.opendrive.model.road.Elevation;
import com.questrail.opendrive.model.road.LateralProfile;
import com.questrail.opendrive.model.road.LateralShape;
import com.questrail.opendrive.model.road.Road;
import com.questrail.opendrive.model.road.RoadCrg;
import com.questrail.opendrive.model.road.RoadLink;
import com.questrail.opendrive.model.road.RoadLinkTarget;
import com.questrail.opendrive.model.road.RoadSpeed;
import com.questrail.opendrive.model.road.RoadSurface;
import com.questrail.opendrive.model.road.RoadTypeEntry;
import com.questrail.opendrive.model.road.Superelevation;

/**
 * Encodes {@code <road>} elements. An absent junction membership is written as
 * {@code junction="-1"}, since the attribute itself is required.
 */
final class RoadEncoder
{
    private final GeometryEncoder geometryEncoder = new GeometryEncoder();
    private final LaneEncoder laneEncoder = new LaneEncoder();
    private final ObjectEncoder objectEncoder = new ObjectEncoder();
    private final SignalEncoder signalEncoder = new SignalEncoder();

    XmlNode encodeRoad(Road road) {
        XmlNode node = XmlNode.element("road")
                .attribute("id", road.id())
                .attribute("junction", road.junction().orElse(Road.NO_JUNCTION))
                .attribute("length", road.length())
                .optionalText("name", road.name())
                .unlessDefault("rule", road.rule(), Road.DEFAULT_RULE);

        road.link().ifPresent(link -> node.child(encodeLink(link)));
        road.types().forEach(type -> node.child(encodeType(type)));
        node.child(geometryEncoder.encodePlanView(road.planView()));
        road.elevationProfile().ifPresent(profile -> {
            XmlNode elevationProfile = XmlNode.element("elevationProfile");
            for (Elevation elevation : profile.elevations()) {
                elevationProfile.child(XmlNode.element("elevation")
                        .polynomial("", elevation.polynomial())
                        .attribute("s", elevation.s()));
            }
            node.child(elevationProfile);
        });
        road.lateralProfile().ifPresent(profile -> node.child(encodeLateralProfile(profile)));
        node.child(laneEncoder.encodeLanes(road.lanes()));
        road.objects().ifPresent(objects -> node.child(objectEncoder.encodeObjects(objects)));
        road.signals().ifPresent(signals -> node.child(signalEncoder.encodeSignals(signals)));
        road.surface().ifPresent(surface -> node.child(encodeSurface(surface)));
        AdditionalDataEncoder.appendTo(node, road.additionalData());
        return node;
    }

    private static XmlNode encodeSurface(RoadSurface surface) {
        XmlNode node = XmlNode.element("surface");
        for (RoadCrg crg : surface.crgs()) {
            node.child(XmlNode.element("CRG")
                    .attribute("file", crg.file())
                    .optionalAngle("hOffset", crg.hOffset())
                    .attribute("mode", crg.mode())
                    .attribute("orientation", crg.orientation())
                    .optionalEnum("purpose", crg.purpose())
                    .attribute("sEnd", crg.sEnd())
                    .optionalLength("sOffset", crg.sOffset())
                    .attribute("sStart", crg.sStart())
                    .optionalLength("tOffset", crg.tOffset())
                    .optionalLength("zOffset", crg.zOffset())
                    .optionalDouble("zScale", crg.zScale()));
        }
        return node;
    }

    private static XmlNode encodeLink(RoadLink link) {
        XmlNode node = XmlNode.element("link");
        link.predecessor().ifPresent(target -> node.child(encodeLinkTarget("predecessor", target)));
        link.successor().ifPresent(target -> node.child(encodeLinkTarget("successor", target)));
        return node;
    }

    private static XmlNode encodeLinkTarget(String elementName, RoadLinkTarget target) {
        return XmlNode.element(elementName)
                .optionalEnum("contactPoint", target.contactPoint())
                .optionalEnum("elementDir", target.elementDir())
                .attribute("elementId", target.elementId())
                .optionalLength("elementS", target.elementS())
                .optionalEnum("elementType", target.elementType());
    }

    private static XmlNode encodeType(RoadTypeEntry entry) {
        XmlNode node = XmlNode.element("type")
                .optionalText("country", entry.country())
                .attribute("s", entry.s())
                .attribute("type", entry.type());
        entry.speed().ifPresent(speed -> node.child(encodeSpeed(speed)));
        return node;
    }

    private static XmlNode encodeSpeed(RoadSpeed speed) {
        return XmlNode.element("speed")
                .attribute("max", speed.max().toXml())
                .unlessDefault("unit", speed.unit(), RoadSpeed.DEFAULT_UNIT);
    }

    private static XmlNode encodeLateralProfile(LateralProfile profile) {
        XmlNode node = XmlNode.element("lateralProfile");
        for (Superelevation superelevation : profile.superelevations()) {
            node.child(XmlNode.element("superelevation")
                    .polynomial("", superelevation.polynomial())
                    .attribute("s", superelevation.s()));
        }
        for (LateralShape shape : profile.shapes()) {
            node.child(XmlNode.element("shape")
                    .polynomial("", shape.polynomial())
                    .attribute("s", shape.s())
                    .attribute("t", shape.t()));
        }
        return node;
    }
}
