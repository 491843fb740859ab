package com.questrail.opendrive.model.road;

import java.util.List;

/**
 * {@code <elevationProfile>}.
 */
public record ElevationProfile(List<Elevation> elevations)
{
    public ElevationProfile {
        elevations = List.copyOf(elevations);
    }
}
