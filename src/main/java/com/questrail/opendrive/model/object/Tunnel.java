package com.questrail.opendrive.model.object;

import com.questrail.opendrive.model.signal.LaneValidity;
import com.questrail.opendrive.units.Length;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code <tunnel>} over the road from {@code s} for {@code length}.
 *
 * <p>{@code lighting} and {@code daylight} are degrees in [0, 1]: 0 is dark,
 * 1 is fully lit.</p>
 */
public record Tunnel(
        String id,
        Length s,
        Length length,
        Optional<String> name,
        TunnelType type,
        Optional<Double> lighting,
        Optional<Double> daylight,
        List<LaneValidity> validities
) {
    public Tunnel {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(length, "length");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(lighting, "lighting");
        Objects.requireNonNull(daylight, "daylight");
        validities = List.copyOf(validities);
    }
}
