package com.questrail.opendrive.model.object;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <material>} of an object's surface.
 */
public record ObjectMaterial(Optional<String> surface, Optional<Double> friction, Optional<Double> roughness)
{
    public ObjectMaterial {
        Objects.requireNonNull(surface, "surface");
        Objects.requireNonNull(friction, "friction");
        Objects.requireNonNull(roughness, "roughness");
    }
}
