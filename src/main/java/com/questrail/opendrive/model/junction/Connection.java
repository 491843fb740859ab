package com.questrail.opendrive.model.junction;

import com.questrail.opendrive.model.ContactPoint;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection
 * -----------------------------------------------------------------------------
 * A {@code <connection>} inside a junction: traffic entering from
 * {@code incomingRoad} continues on {@code connectingRoad}, entering it at
 * {@code contactPoint}.
 *
 * <p>Roads are referenced by id; the connection holds no pointer to them.
 * {@code linkedRoad} replaces {@code connectingRoad} in direct junctions of later
 * standard revisions and is carried through when present. {@code type} defaults to
 * {@link ConnectionType#DEFAULT}.</p>
 */
public record Connection(
        String id,
        Optional<String> incomingRoad,
        Optional<String> connectingRoad,
        Optional<String> linkedRoad,
        Optional<ContactPoint> contactPoint,
        ConnectionType type,
        Optional<ConnectionLink> predecessor,
        Optional<ConnectionLink> successor,
        List<JunctionLaneLink> laneLinks
) {
    public Connection {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(incomingRoad, "incomingRoad");
        Objects.requireNonNull(connectingRoad, "connectingRoad");
        Objects.requireNonNull(linkedRoad, "linkedRoad");
        Objects.requireNonNull(contactPoint, "contactPoint");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(predecessor, "predecessor");
        Objects.requireNonNull(successor, "successor");
        laneLinks = List.copyOf(laneLinks);
    }

    public static Connection of(String id,
                                String incomingRoad,
                                String connectingRoad,
                                ContactPoint contactPoint,
                                List<JunctionLaneLink> laneLinks) {
        return new Connection(id, Optional.of(incomingRoad), Optional.of(connectingRoad), Optional.empty(),
                Optional.of(contactPoint), ConnectionType.DEFAULT, Optional.empty(), Optional.empty(), laneLinks);
    }
}
