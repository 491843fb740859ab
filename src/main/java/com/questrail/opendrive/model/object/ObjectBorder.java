package com.questrail.opendrive.model.object;

import com.questrail.opendrive.units.Length;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code <border>}: a curb or concrete edge of {@code width} along the outline
 * with id {@code outlineId}, either the complete outline or the corners listed
 * in {@code cornerReferences}.
 */
public record ObjectBorder(
        BorderType type,
        Length width,
        int outlineId,
        Optional<Boolean> useCompleteOutline,
        List<Integer> cornerReferences
) {
    public ObjectBorder {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(width, "width");
        Objects.requireNonNull(useCompleteOutline, "useCompleteOutline");
        cornerReferences = List.copyOf(cornerReferences);
    }
}
