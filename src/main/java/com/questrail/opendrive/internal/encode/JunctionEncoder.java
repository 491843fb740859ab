package com.questrail.opendrive.internal.encode;

import com.questrail.opendrive.model.junction.Connection;
import com.questrail.opendrive.model.junction.ConnectionLink;
import com.questrail.opendrive.model.junction.ConnectionType;
import com.questrail.opendrive.model.junction.Junction;
import com.questrail.opendrive.model.junction.JunctionController;
import com.questrail.opendrive.model.junction.JunctionGroup;
import com.questrail.opendrive.model.junction.JunctionLaneLink;
import com.questrail.opendrive.model.junction.JunctionPriority;
import com.questrail.opendrive.model.junction.JunctionSurface;
import com.questrail.opendrive.model.junction.JunctionType;

/**
 * Encodes {@code <junction>} and {@code <junctionGroup>} elements.
 */
final class JunctionEncoder
{
    XmlNode encodeJunction(Junction junction) {
        XmlNode node = XmlNode.element("junction")
                .attribute("id", junction.id())
                .optionalText("mainRoad", junction.mainRoad())
                .optionalText("name", junction.name())
                .optionalEnum("orientation", junction.orientation())
                .optionalLength("sEnd", junction.sEnd())
                .optionalLength("sStart", junction.sStart())
                .unlessDefault("type", junction.type(), JunctionType.DEFAULT);

        junction.connections().forEach(connection -> node.child(encodeConnection(connection)));
        for (JunctionPriority priority : junction.priorities()) {
            node.child(XmlNode.element("priority")
                    .optionalText("high", priority.high())
                    .optionalText("low", priority.low()));
        }
        for (JunctionController controller : junction.controllers()) {
            node.child(XmlNode.element("controller")
                    .attribute("id", controller.id())
                    .optionalInt("sequence", controller.sequence())
                    .optionalText("type", controller.type()));
        }
        junction.surface().ifPresent(surface -> node.child(encodeSurface(surface)));
        AdditionalDataEncoder.appendTo(node, junction.additionalData());
        return node;
    }

    private static XmlNode encodeSurface(JunctionSurface surface) {
        XmlNode node = XmlNode.element("surface");
        for (JunctionSurface.Crg crg : surface.crgs()) {
            node.child(XmlNode.element("CRG")
                    .attribute("file", crg.file())
                    .attribute("mode", crg.mode())
                    .optionalEnum("purpose", crg.purpose())
                    .optionalLength("zOffset", crg.zOffset())
                    .optionalDouble("zScale", crg.zScale()));
        }
        return node;
    }

    XmlNode encodeJunctionGroup(JunctionGroup group) {
        XmlNode node = XmlNode.element("junctionGroup")
                .attribute("id", group.id())
                .optionalText("name", group.name())
                .attribute("type", group.type());
        for (String member : group.junctionReferences()) {
            node.child(XmlNode.element("junctionReference").attribute("junction", member));
        }
        AdditionalDataEncoder.appendTo(node, group.additionalData());
        return node;
    }

    private static XmlNode encodeConnection(Connection connection) {
        XmlNode node = XmlNode.element("connection")
                .optionalText("connectingRoad", connection.connectingRoad())
                .optionalEnum("contactPoint", connection.contactPoint())
                .attribute("id", connection.id())
                .optionalText("incomingRoad", connection.incomingRoad())
                .optionalText("linkedRoad", connection.linkedRoad())
                .unlessDefault("type", connection.type(), ConnectionType.DEFAULT);

        connection.predecessor().ifPresent(link -> node.child(encodeConnectionLink("predecessor", link)));
        connection.successor().ifPresent(link -> node.child(encodeConnectionLink("successor", link)));
        for (JunctionLaneLink laneLink : connection.laneLinks()) {
            node.child(XmlNode.element("laneLink")
                    .attribute("from", laneLink.from())
                    .attribute("to", laneLink.to()));
        }
        return node;
    }

    private static XmlNode encodeConnectionLink(String elementName, ConnectionLink link) {
        return XmlNode.element(elementName)
                .attribute("elementDir", link.elementDir())
                .attribute("elementId", link.elementId())
                .attribute("elementS", link.elementS())
                .attribute("elementType", link.elementType());
    }
}
