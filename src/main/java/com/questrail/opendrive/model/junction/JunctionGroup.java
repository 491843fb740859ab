package com.questrail.opendrive.model.junction;

import com.questrail.opendrive.model.AdditionalData;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JunctionGroup
 * -----------------------------------------------------------------------------
 * {@code <junctionGroup>}: several junctions that belong together, for example
 * the entries of one roundabout.
 *
 * <p>{@code junctionReferences} holds the ids of the member junctions in
 * document order, one {@code <junctionReference junction="..."/>} each; a
 * group has at least one member.</p>
 */
public record JunctionGroup(
        String id,
        Optional<String> name,
        JunctionGroupType type,
        List<String> junctionReferences,
        AdditionalData additionalData
) {
    public JunctionGroup {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(additionalData, "additionalData");
        junctionReferences = List.copyOf(junctionReferences);
        if (junctionReferences.isEmpty()) {
            throw new IllegalArgumentException("junction group " + id + " has no junction references");
        }
    }
}
