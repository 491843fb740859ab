package com.questrail.opendrive.model.signal;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <dependency>}: another signal whose meaning depends on this one, for
 * example a supplementary plate. {@code id} names the dependent signal.
 */
public record SignalDependency(String id, Optional<String> type)
{
    public SignalDependency {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
    }
}
