package com.questrail.opendrive.model.signal;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <reference>}: links a signal to an object or another signal, such as
 * the stop line that belongs to a stop sign.
 */
public record SignalElementReference(ReferencedElementType elementType, String elementId, Optional<String> type)
{
    public SignalElementReference {
        Objects.requireNonNull(elementType, "elementType");
        Objects.requireNonNull(elementId, "elementId");
        Objects.requireNonNull(type, "type");
    }
}
