package com.questrail.opendrive.model.object;

import com.questrail.opendrive.model.signal.LaneValidity;
import com.questrail.opendrive.units.Length;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code <bridge>} carrying the road from {@code s} for {@code length}.
 */
public record Bridge(
        String id,
        Length s,
        Length length,
        Optional<String> name,
        BridgeType type,
        List<LaneValidity> validities
) {
    public Bridge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(length, "length");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        validities = List.copyOf(validities);
    }
}
