package com.questrail.opendrive.model.junction;

import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.model.Orientation;
import com.questrail.opendrive.units.Length;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@code <junction>}: at least one connection, plus optional priorities and
 * controller references.
 *
 * <p>{@code mainRoad}, {@code orientation}, {@code sStart} and {@code sEnd} only
 * apply to virtual junctions. {@code type} defaults to {@link JunctionType#DEFAULT}.</p>
 */
public record Junction(
        String id,
        Optional<String> name,
        JunctionType type,
        Optional<String> mainRoad,
        Optional<Orientation> orientation,
        Optional<Length> sStart,
        Optional<Length> sEnd,
        List<Connection> connections,
        List<JunctionPriority> priorities,
        List<JunctionController> controllers,
        Optional<JunctionSurface> surface,
        AdditionalData additionalData
) {
    public Junction {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(mainRoad, "mainRoad");
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(sStart, "sStart");
        Objects.requireNonNull(sEnd, "sEnd");
        Objects.requireNonNull(surface, "surface");
        Objects.requireNonNull(additionalData, "additionalData");
        connections = List.copyOf(connections);
        priorities = List.copyOf(priorities);
        controllers = List.copyOf(controllers);
        if (connections.isEmpty()) {
            throw new IllegalArgumentException("junction " + id + " requires at least one connection");
        }
    }

    public static Junction of(String id, List<Connection> connections) {
        return new Junction(id, Optional.empty(), JunctionType.DEFAULT, Optional.empty(), Optional.empty(),
                Optional.empty(), Optional.empty(), connections, List.of(), List.of(), Optional.empty(),
                AdditionalData.EMPTY);
    }

    public Optional<Connection> connection(String connectionId) {
        return connections.stream().filter(c -> c.id().equals(connectionId)).findFirst();
    }
}
