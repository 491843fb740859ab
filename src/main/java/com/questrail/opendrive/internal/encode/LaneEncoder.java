package com.questrail.opendrive.internal.encode;

import com.questrail.opendrive.model.lane.Lane;
import com.questrail.opendrive.model.lane.LaneAccess;
import com.questrail.opendrive.model.lane.LaneBoundary;
import com.questrail.opendrive.model.lane.LaneHeight;
import com.questrail.opendrive.model.lane.LaneLink;
import com.questrail.opendrive.model.lane.LaneMaterial;
import com.questrail.opendrive.model.lane.LaneOffset;
import com.questrail.opendrive.model.lane.LaneRule;
import com.questrail.opendrive.model.lane.LaneSection;
import com.questrail.opendrive.model.lane.LaneSide;
import com.questrail.opendrive.model.lane.LaneSpeed;
import com.questrail.opendrive.model.lane.Lanes;
import com.questrail.opendrive.model.lane.RoadMark;
import com.questrail.opendrive.model.lane.RoadMarkExplicit;
import com.questrail.opendrive.model.lane.RoadMarkExplicitLine;
import com.questrail.opendrive.model.lane.RoadMarkLine;
import com.questrail.opendrive.model.lane.RoadMarkSway;
import com.questrail.opendrive.model.lane.RoadMarkTypeDetail;
import com.questrail.opendrive.units.Length;

import java.util.List;

/**
 * Encodes {@code <lanes>} and everything below it.
 *
 * <p>Road-mark {@code color} is written for every road mark in every
 * configuration: the attribute is required by the schema and some consumers
 * mis-default it when absent.</p>
 */
final class LaneEncoder
{
    XmlNode encodeLanes(Lanes lanes) {
        XmlNode node = XmlNode.element("lanes");
        for (LaneOffset offset : lanes.laneOffsets()) {
            node.child(XmlNode.element("laneOffset")
                    .polynomial("", offset.polynomial())
                    .attribute("s", offset.s()));
        }
        lanes.laneSections().forEach(section -> node.child(encodeSection(section)));
        return node;
    }

    XmlNode encodeSection(LaneSection section) {
        XmlNode node = XmlNode.element("laneSection")
                .attribute("s", section.s())
                .unlessFalse("singleSide", section.singleSide());
        if (!section.left().isEmpty()) {
            node.child(encodeSide(LaneSide.LEFT, section.left()));
        }
        node.child(encodeSide(LaneSide.CENTER, List.of(section.center())));
        if (!section.right().isEmpty()) {
            node.child(encodeSide(LaneSide.RIGHT, section.right()));
        }
        AdditionalDataEncoder.appendTo(node, section.additionalData());
        return node;
    }

    private XmlNode encodeSide(LaneSide side, List<Lane> lanes) {
        XmlNode node = XmlNode.element(side.elementName());
        lanes.forEach(lane -> node.child(encodeLane(lane)));
        return node;
    }

    XmlNode encodeLane(Lane lane) {
        XmlNode node = XmlNode.element("lane")
                .attribute("id", lane.id())
                .unlessFalse("level", lane.level())
                .attribute("type", lane.type());

        lane.link().ifPresent(link -> node.child(encodeLaneLink(link)));
        for (LaneBoundary boundary : lane.boundaries()) {
            node.child(XmlNode.element(boundary.elementName())
                    .polynomial("", boundary.polynomial())
                    .attribute("sOffset", boundary.sOffset()));
        }
        lane.roadMarks().forEach(roadMark -> node.child(encodeRoadMark(roadMark)));
        for (LaneMaterial material : lane.materials()) {
            node.child(XmlNode.element("material")
                    .attribute("friction", material.friction())
                    .optionalDouble("roughness", material.roughness())
                    .attribute("sOffset", material.sOffset())
                    .optionalText("surface", material.surface()));
        }
        for (LaneSpeed speed : lane.speeds()) {
            node.child(XmlNode.element("speed")
                    .attribute("max", speed.max().value())
                    .attribute("sOffset", speed.sOffset())
                    .unlessDefault("unit", speed.max().unit(), LaneSpeed.DEFAULT_UNIT));
        }
        for (LaneAccess access : lane.accesses()) {
            node.child(XmlNode.element("access")
                    .attribute("restriction", access.restriction())
                    .optionalEnum("rule", access.rule())
                    .attribute("sOffset", access.sOffset()));
        }
        for (LaneHeight height : lane.heights()) {
            node.child(XmlNode.element("height")
                    .unlessDefault("inner", height.inner(), Length.ZERO)
                    .unlessDefault("outer", height.outer(), Length.ZERO)
                    .attribute("sOffset", height.sOffset()));
        }
        for (LaneRule rule : lane.rules()) {
            node.child(XmlNode.element("rule")
                    .attribute("sOffset", rule.sOffset())
                    .attribute("value", rule.value()));
        }
        AdditionalDataEncoder.appendTo(node, lane.additionalData());
        return node;
    }

    private static XmlNode encodeLaneLink(LaneLink link) {
        XmlNode node = XmlNode.element("link");
        link.predecessors().forEach(id -> node.child(XmlNode.element("predecessor").attribute("id", id.intValue())));
        link.successors().forEach(id -> node.child(XmlNode.element("successor").attribute("id", id.intValue())));
        return node;
    }

    XmlNode encodeRoadMark(RoadMark roadMark) {
        XmlNode node = XmlNode.element("roadMark")
                .attribute("color", roadMark.color())
                .optionalLength("height", roadMark.height())
                .unlessDefault("laneChange", roadMark.laneChange(), RoadMark.DEFAULT_LANE_CHANGE)
                .unlessDefault("material", roadMark.material(), RoadMark.DEFAULT_MATERIAL)
                .attribute("sOffset", roadMark.sOffset())
                .attribute("type", roadMark.type())
                .optionalEnum("weight", roadMark.weight())
                .optionalLength("width", roadMark.width());
        for (RoadMarkSway sway : roadMark.sways()) {
            node.child(XmlNode.element("sway")
                    .polynomial("", sway.polynomial())
                    .attribute("ds", sway.ds()));
        }
        roadMark.detail().ifPresent(detail -> node.child(encodeTypeDetail(detail)));
        roadMark.explicit().ifPresent(explicit -> node.child(encodeExplicit(explicit)));
        return node;
    }

    private static XmlNode encodeExplicit(RoadMarkExplicit explicit) {
        XmlNode node = XmlNode.element("explicit");
        for (RoadMarkExplicitLine line : explicit.lines()) {
            node.child(XmlNode.element("line")
                    .attribute("length", line.length())
                    .optionalEnum("rule", line.rule())
                    .attribute("sOffset", line.sOffset())
                    .attribute("tOffset", line.tOffset())
                    .optionalLength("width", line.width()));
        }
        AdditionalDataEncoder.appendTo(node, explicit.additionalData());
        return node;
    }

    private static XmlNode encodeTypeDetail(RoadMarkTypeDetail detail) {
        XmlNode node = XmlNode.element("type")
                .attribute("name", detail.name())
                .attribute("width", detail.width());
        for (RoadMarkLine line : detail.lines()) {
            node.child(XmlNode.element("line")
                    .optionalEnum("color", line.color())
                    .attribute("length", line.length())
                    .optionalEnum("rule", line.rule())
                    .attribute("sOffset", line.sOffset())
                    .attribute("space", line.space())
                    .attribute("tOffset", line.tOffset())
                    .optionalLength("width", line.width()));
        }
        return node;
    }
}
