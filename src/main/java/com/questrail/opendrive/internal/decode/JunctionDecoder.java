package com.questrail.opendrive.internal.decode;

import com.questrail.opendrive.model.ContactPoint;
import com.questrail.opendrive.model.ElementDir;
import com.questrail.opendrive.model.Orientation;
import com.questrail.opendrive.model.junction.Connection;
import com.questrail.opendrive.model.junction.ConnectionLink;
import com.questrail.opendrive.model.junction.ConnectionType;
import com.questrail.opendrive.model.junction.Junction;
import com.questrail.opendrive.model.junction.JunctionController;
import com.questrail.opendrive.model.junction.JunctionGroup;
import com.questrail.opendrive.model.junction.JunctionGroupType;
import com.questrail.opendrive.model.junction.JunctionLaneLink;
import com.questrail.opendrive.model.junction.JunctionPriority;
import com.questrail.opendrive.model.junction.JunctionSurface;
import com.questrail.opendrive.model.junction.JunctionType;
import com.questrail.opendrive.model.road.CrgMode;
import com.questrail.opendrive.model.road.CrgPurpose;
import com.questrail.opendrive.model.road.LinkElementType;
import com.questrail.opendrive.units.Length;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes {@code <junction>} and {@code <junctionGroup>} elements. Road and
 * junction references are checked for id syntax only.
 */
final class JunctionDecoder
{
    Junction decodeJunction(ElementReader element) {
        String id = element.requiredId("id");
        Optional<String> name = element.optionalText("name");
        JunctionType type = element.optionalEnum("type", JunctionType.class, JunctionType.DEFAULT);
        Optional<String> mainRoad = element.optionalId("mainRoad");
        Optional<Orientation> orientation = element.optionalEnum("orientation", Orientation.class);
        Optional<Length> sStart = element.optionalNonNegativeLength("sStart");
        Optional<Length> sEnd = element.optionalNonNegativeLength("sEnd");

        List<Connection> connections = new ArrayList<>();
        List<JunctionPriority> priorities = new ArrayList<>();
        List<JunctionController> controllers = new ArrayList<>();
        JunctionSurface[] surface = new JunctionSurface[1];
        AdditionalDataCollector additional = new AdditionalDataCollector();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "connection" -> connections.add(decodeConnection(child));
                case "priority" -> priorities.add(
                        new JunctionPriority(child.optionalId("high"), child.optionalId("low")));
                case "controller" -> controllers.add(new JunctionController(
                        child.requiredId("id"), child.optionalText("type"), child.optionalInt("sequence")));
                case "surface" -> {
                    element.requireAbsent(surface[0], "surface");
                    surface[0] = decodeSurface(child);
                }
                default -> additional.acceptOrSkip(child);
            }
        });
        if (connections.isEmpty()) {
            throw element.missingChild("connection");
        }
        return new Junction(id, name, type, mainRoad, orientation, sStart, sEnd, connections, priorities,
                controllers, Optional.ofNullable(surface[0]), additional.build());
    }

    private static JunctionSurface decodeSurface(ElementReader element) {
        List<JunctionSurface.Crg> crgs = new ArrayList<>();
        element.forEachChild(child -> {
            if (child.name().equals("CRG")) {
                crgs.add(new JunctionSurface.Crg(
                        child.requiredText("file"),
                        child.requiredEnum("mode", CrgMode.class),
                        child.optionalEnum("purpose", CrgPurpose.class),
                        child.optionalLength("zOffset"),
                        child.optionalDouble("zScale")));
            } else {
                child.skipUnknown();
            }
        });
        return new JunctionSurface(crgs);
    }

    JunctionGroup decodeJunctionGroup(ElementReader element) {
        String id = element.requiredId("id");
        Optional<String> name = element.optionalText("name");
        JunctionGroupType type = element.requiredEnum("type", JunctionGroupType.class);
        List<String> members = new ArrayList<>();
        AdditionalDataCollector additional = new AdditionalDataCollector();
        element.forEachChild(child -> {
            if (child.name().equals("junctionReference")) {
                members.add(child.requiredId("junction"));
            } else {
                additional.acceptOrSkip(child);
            }
        });
        if (members.isEmpty()) {
            throw element.missingChild("junctionReference");
        }
        return new JunctionGroup(id, name, type, members, additional.build());
    }

    private static Connection decodeConnection(ElementReader element) {
        String id = element.requiredId("id");
        Optional<String> incomingRoad = element.optionalId("incomingRoad");
        Optional<String> connectingRoad = element.optionalId("connectingRoad");
        Optional<String> linkedRoad = element.optionalId("linkedRoad");
        Optional<ContactPoint> contactPoint = element.optionalEnum("contactPoint", ContactPoint.class);
        ConnectionType type = element.optionalEnum("type", ConnectionType.class, ConnectionType.DEFAULT);

        List<ConnectionLink> predecessor = new ArrayList<>(1);
        List<ConnectionLink> successor = new ArrayList<>(1);
        List<JunctionLaneLink> laneLinks = new ArrayList<>();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "predecessor" -> {
                    element.requireAbsent(predecessor.isEmpty() ? null : predecessor, "predecessor");
                    predecessor.add(decodeConnectionLink(child));
                }
                case "successor" -> {
                    element.requireAbsent(successor.isEmpty() ? null : successor, "successor");
                    successor.add(decodeConnectionLink(child));
                }
                case "laneLink" -> laneLinks.add(
                        new JunctionLaneLink(child.requiredInt("from"), child.requiredInt("to")));
                default -> child.skipUnknown();
            }
        });
        return new Connection(id, incomingRoad, connectingRoad, linkedRoad, contactPoint, type,
                predecessor.stream().findFirst(), successor.stream().findFirst(), laneLinks);
    }

    private static ConnectionLink decodeConnectionLink(ElementReader element) {
        return new ConnectionLink(
                element.requiredId("elementId"),
                element.requiredEnum("elementType", LinkElementType.class),
                element.requiredNonNegativeLength("elementS"),
                element.requiredEnum("elementDir", ElementDir.class));
    }
}
