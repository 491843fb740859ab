package com.questrail.opendrive.model.road;

import java.util.List;

/**
 * {@code <lateralProfile>}: superelevation records followed by shape records.
 */
public record LateralProfile(List<Superelevation> superelevations, List<LateralShape> shapes)
{
    public LateralProfile {
        superelevations = List.copyOf(superelevations);
        shapes = List.copyOf(shapes);
    }
}
