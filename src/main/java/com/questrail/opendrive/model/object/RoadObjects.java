package com.questrail.opendrive.model.object;

import java.util.List;

/**
 * {@code <objects>} of a road: objects, references to objects of other roads,
 * tunnels and bridges.
 */
public record RoadObjects(
        List<RoadObject> objects,
        List<ObjectReference> references,
        List<Tunnel> tunnels,
        List<Bridge> bridges
) {
    public RoadObjects {
        objects = List.copyOf(objects);
        references = List.copyOf(references);
        tunnels = List.copyOf(tunnels);
        bridges = List.copyOf(bridges);
    }

    public static RoadObjects of(List<RoadObject> objects) {
        return new RoadObjects(objects, List.of(), List.of(), List.of());
    }
}
