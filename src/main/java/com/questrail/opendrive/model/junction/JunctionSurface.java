package com.questrail.opendrive.model.junction;

import com.questrail.opendrive.model.road.CrgMode;
import com.questrail.opendrive.model.road.CrgPurpose;
import com.questrail.opendrive.units.Length;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code <surface>} of a junction: OpenCRG files covering the junction area.
 */
public record JunctionSurface(List<Crg> crgs)
{
    public JunctionSurface {
        crgs = List.copyOf(crgs);
    }

    /**
     * {@code <CRG>} of a junction surface.
     */
    public record Crg(
            String file,
            CrgMode mode,
            Optional<CrgPurpose> purpose,
            Optional<Length> zOffset,
            Optional<Double> zScale
    ) {
        public Crg {
            Objects.requireNonNull(file, "file");
            Objects.requireNonNull(mode, "mode");
            Objects.requireNonNull(purpose, "purpose");
            Objects.requireNonNull(zOffset, "zOffset");
            Objects.requireNonNull(zScale, "zScale");
        }
    }
}
