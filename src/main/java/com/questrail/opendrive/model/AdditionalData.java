package com.questrail.opendrive.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The schema's extension group ({@code include*}, {@code userData*},
 * {@code dataQuality?}) that may follow the regular children of most elements.
 */
public record AdditionalData(List<Include> includes, List<UserData> userData, Optional<DataQuality> dataQuality)
{
    public static final AdditionalData EMPTY = new AdditionalData(List.of(), List.of(), Optional.empty());

    public AdditionalData {
        includes = List.copyOf(includes);
        userData = List.copyOf(userData);
        Objects.requireNonNull(dataQuality, "dataQuality");
    }

    public static AdditionalData of(List<Include> includes, List<UserData> userData) {
        return new AdditionalData(includes, userData, Optional.empty());
    }

    public boolean isEmpty() {
        return includes.isEmpty() && userData.isEmpty() && dataQuality.isEmpty();
    }

    public AdditionalData withDataQuality(DataQuality dataQuality) {
        return new AdditionalData(includes, userData, Optional.of(dataQuality));
    }
}
