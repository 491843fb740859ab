package com.questrail.opendrive.model;

import com.questrail.opendrive.OpenDriveVersion;
import com.questrail.opendrive.units.Length;

import java.util.Objects;
import java.util.Optional;

/**
 * Header
 * -----------------------------------------------------------------------------
 * Document metadata: the standard revision the document declares, naming and
 * dating information, the bounding box, and the geographic reference.
 *
 * <p>{@code geoReference} holds the projection definition (a PROJ string) as
 * found in the CDATA section. Surrounding whitespace is not significant and is
 * stripped on construction. The codec never interprets it.</p>
 *
 * <p>Headers are immutable; use the {@code with} methods to derive a changed copy.</p>
 */
public record Header(
        int revMajor,
        int revMinor,
        Optional<String> name,
        Optional<String> version,
        Optional<String> date,
        Optional<Length> north,
        Optional<Length> south,
        Optional<Length> east,
        Optional<Length> west,
        Optional<String> vendor,
        Optional<String> geoReference,
        Optional<HeaderOffset> offset,
        AdditionalData additionalData
) {
    public Header {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(north, "north");
        Objects.requireNonNull(south, "south");
        Objects.requireNonNull(east, "east");
        Objects.requireNonNull(west, "west");
        Objects.requireNonNull(vendor, "vendor");
        Objects.requireNonNull(geoReference, "geoReference");
        geoReference = geoReference.map(String::strip);
        Objects.requireNonNull(offset, "offset");
        Objects.requireNonNull(additionalData, "additionalData");
    }

    /**
     * A header declaring the implemented standard revision and nothing else.
     */
    public static Header current() {
        return new Header(OpenDriveVersion.STANDARD_REV_MAJOR, OpenDriveVersion.STANDARD_REV_MINOR,
                Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
                Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
                AdditionalData.EMPTY);
    }

    public Header withName(String name) {
        return new Header(revMajor, revMinor, Optional.ofNullable(name), version, date, north, south, east, west,
                vendor, geoReference, offset, additionalData);
    }

    public Header withGeoReference(String geoReference) {
        return new Header(revMajor, revMinor, name, version, date, north, south, east, west,
                vendor, Optional.ofNullable(geoReference), offset, additionalData);
    }

    public Header withOffset(HeaderOffset offset) {
        return new Header(revMajor, revMinor, name, version, date, north, south, east, west,
                vendor, geoReference, Optional.ofNullable(offset), additionalData);
    }
}
