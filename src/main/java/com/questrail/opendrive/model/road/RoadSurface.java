package com.questrail.opendrive.model.road;

import java.util.List;

/**
 * {@code <surface>} of a road: the OpenCRG files describing its surface.
 */
public record RoadSurface(List<RoadCrg> crgs)
{
    public RoadSurface {
        crgs = List.copyOf(crgs);
    }
}
