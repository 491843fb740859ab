package com.questrail.opendrive.model;

import com.questrail.opendrive.units.Length;

import java.util.Objects;

/**
 * {@code <error>} of a data quality record: absolute and relative deviations in
 * the horizontal plane and in height.
 */
public record DataQualityError(Length xyAbsolute, Length zAbsolute, Length xyRelative, Length zRelative)
{
    public DataQualityError {
        Objects.requireNonNull(xyAbsolute, "xyAbsolute");
        Objects.requireNonNull(zAbsolute, "zAbsolute");
        Objects.requireNonNull(xyRelative, "xyRelative");
        Objects.requireNonNull(zRelative, "zRelative");
    }
}
