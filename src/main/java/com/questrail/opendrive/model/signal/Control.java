package com.questrail.opendrive.model.signal;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <control>}: one signal driven by a controller.
 */
public record Control(String signalId, Optional<String> type)
{
    public Control {
        Objects.requireNonNull(signalId, "signalId");
        Objects.requireNonNull(type, "type");
    }
}
