package com.questrail.opendrive.model.road;

import com.questrail.opendrive.units.Angle;
import com.questrail.opendrive.units.Length;

import java.util.Objects;
import java.util.Optional;

/**
 * RoadCrg
 * -----------------------------------------------------------------------------
 * {@code <CRG>}: attaches an OpenCRG road surface file to the road between
 * {@code sStart} and {@code sEnd}.
 *
 * <p>The file is recorded, never opened. {@code mode} says how the CRG data
 * is placed relative to the reference line; the offsets and {@code zScale}
 * shift and scale it.</p>
 */
public record RoadCrg(
        String file,
        Length sStart,
        Length sEnd,
        CrgOrientation orientation,
        CrgMode mode,
        Optional<CrgPurpose> purpose,
        Optional<Length> sOffset,
        Optional<Length> tOffset,
        Optional<Length> zOffset,
        Optional<Double> zScale,
        Optional<Angle> hOffset
) {
    public RoadCrg {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(sStart, "sStart");
        Objects.requireNonNull(sEnd, "sEnd");
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(purpose, "purpose");
        Objects.requireNonNull(sOffset, "sOffset");
        Objects.requireNonNull(tOffset, "tOffset");
        Objects.requireNonNull(zOffset, "zOffset");
        Objects.requireNonNull(zScale, "zScale");
        Objects.requireNonNull(hOffset, "hOffset");
    }
}
