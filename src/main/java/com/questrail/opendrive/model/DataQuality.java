package com.questrail.opendrive.model;

import java.util.Objects;
import java.util.Optional;

/**
 * DataQuality
 * -----------------------------------------------------------------------------
 * {@code <dataQuality>}: accuracy and provenance of the element it is attached to.
 *
 * <p>Both parts are optional. An element carries at most one
 * {@code <dataQuality>}; it is part of the schema's additional data group and
 * is written after any {@code include} and {@code userData} children.</p>
 */
public record DataQuality(Optional<DataQualityError> error, Optional<RawData> rawData)
{
    public DataQuality {
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(rawData, "rawData");
    }
}
