package com.questrail.opendrive.model;

import com.questrail.opendrive.model.junction.Junction;
import com.questrail.opendrive.model.junction.JunctionGroup;
import com.questrail.opendrive.model.road.Road;
import com.questrail.opendrive.model.signal.Controller;
import com.questrail.opendrive.model.signal.Signal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Document
 * -----------------------------------------------------------------------------
 * Root of the semantic model: one {@code <OpenDRIVE>} document.
 *
 * <h2>References</h2>
 * <p>Elements refer to one another by id only. The model has no structural
 * pointers between roads, junctions and controllers, so there are no ownership
 * cycles; the lookup methods on this class are the single way to follow a
 * reference.</p>
 *
 * <h2>Ownership</h2>
 * <p>All model types are immutable values. A {@code Document} returned by the
 * reader is not retained by the codec; "mutation" means deriving a new document
 * through the {@code with} methods.</p>
 */
public record Document(
        Header header,
        List<Road> roads,
        List<Controller> controllers,
        List<Junction> junctions,
        List<JunctionGroup> junctionGroups,
        AdditionalData additionalData
) {
    public Document {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(additionalData, "additionalData");
        roads = List.copyOf(roads);
        controllers = List.copyOf(controllers);
        junctions = List.copyOf(junctions);
        junctionGroups = List.copyOf(junctionGroups);
        if (roads.isEmpty()) {
            throw new IllegalArgumentException("document requires at least one road");
        }
    }

    public static Document of(Header header, List<Road> roads) {
        return new Document(header, roads, List.of(), List.of(), List.of(), AdditionalData.EMPTY);
    }

    public Optional<Road> findRoad(String id) {
        return roads.stream().filter(r -> r.id().equals(id)).findFirst();
    }

    public Optional<Junction> findJunction(String id) {
        return junctions.stream().filter(j -> j.id().equals(id)).findFirst();
    }

    public Optional<JunctionGroup> findJunctionGroup(String id) {
        return junctionGroups.stream().filter(g -> g.id().equals(id)).findFirst();
    }

    public Optional<Controller> findController(String id) {
        return controllers.stream().filter(c -> c.id().equals(id)).findFirst();
    }

    /**
     * Searches the signals of every road.
     */
    public Optional<Signal> findSignal(String id) {
        return roads.stream()
                .flatMap(r -> r.signals().stream())
                .flatMap(s -> s.signals().stream())
                .filter(s -> s.id().equals(id))
                .findFirst();
    }

    /**
     * @return roads whose {@code junction} attribute names {@code junctionId}
     */
    public List<Road> roadsInJunction(String junctionId) {
        List<Road> members = new ArrayList<>();
        for (Road road : roads) {
            if (road.junction().filter(junctionId::equals).isPresent()) {
                members.add(road);
            }
        }
        return members;
    }

    public Document withHeader(Header header) {
        return new Document(header, roads, controllers, junctions, junctionGroups, additionalData);
    }

    public Document withRoads(List<Road> roads) {
        return new Document(header, roads, controllers, junctions, junctionGroups, additionalData);
    }

    public Document withJunctions(List<Junction> junctions) {
        return new Document(header, roads, controllers, junctions, junctionGroups, additionalData);
    }

    public Document withJunctionGroups(List<JunctionGroup> junctionGroups) {
        return new Document(header, roads, controllers, junctions, junctionGroups, additionalData);
    }

    public Document withControllers(List<Controller> controllers) {
        return new Document(header, roads, controllers, junctions, junctionGroups, additionalData);
    }

    /**
     * Replaces the road with the same id, or appends {@code road} if there is none.
     */
    public Document withRoad(Road road) {
        List<Road> updated = new ArrayList<>(roads);
        boolean replaced = false;
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).id().equals(road.id())) {
                updated.set(i, road);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            updated.add(road);
        }
        return withRoads(updated);
    }
}
