package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.units.Length;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <material>} of a lane.
 */
public record LaneMaterial(Length sOffset, double friction, Optional<Double> roughness, Optional<String> surface)
{
    public LaneMaterial {
        Objects.requireNonNull(sOffset, "sOffset");
        Objects.requireNonNull(roughness, "roughness");
        Objects.requireNonNull(surface, "surface");
    }
}
