package com.questrail.opendrive.model;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <rawData>}: where the data came from and what was done to it.
 * {@code date} is kept as written (the schema's {@code xs:string}).
 */
public record RawData(
        String date,
        RawDataSource source,
        Optional<String> sourceComment,
        PostProcessing postProcessing,
        Optional<String> postProcessingComment
) {
    public RawData {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sourceComment, "sourceComment");
        Objects.requireNonNull(postProcessing, "postProcessing");
        Objects.requireNonNull(postProcessingComment, "postProcessingComment");
    }
}
