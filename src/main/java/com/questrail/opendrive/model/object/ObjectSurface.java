package com.questrail.opendrive.model.object;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <surface>} of an object, optionally described by an OpenCRG file.
 */
public record ObjectSurface(Optional<Crg> crg)
{
    public ObjectSurface {
        Objects.requireNonNull(crg, "crg");
    }

    /**
     * {@code <CRG>} of an object surface. The file is recorded, never opened.
     */
    public record Crg(Optional<String> file, Optional<Boolean> hideRoadSurfaceCrg, Optional<Double> zScale)
    {
        public Crg {
            Objects.requireNonNull(file, "file");
            Objects.requireNonNull(hideRoadSurfaceCrg, "hideRoadSurfaceCrg");
            Objects.requireNonNull(zScale, "zScale");
        }
    }
}
