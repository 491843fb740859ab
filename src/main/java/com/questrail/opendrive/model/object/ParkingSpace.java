package com.questrail.opendrive.model.object;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <parkingSpace>} details of a parking space object. {@code restrictions}
 * is free text, for example "no trailers".
 */
public record ParkingSpace(ParkingAccess access, Optional<String> restrictions)
{
    public ParkingSpace {
        Objects.requireNonNull(access, "access");
        Objects.requireNonNull(restrictions, "restrictions");
    }
}
