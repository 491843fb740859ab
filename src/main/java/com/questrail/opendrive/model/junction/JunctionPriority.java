package com.questrail.opendrive.model.junction;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <priority>}: the road with id {@code high} has right of way over {@code low}.
 */
public record JunctionPriority(Optional<String> high, Optional<String> low)
{
    public JunctionPriority {
        Objects.requireNonNull(high, "high");
        Objects.requireNonNull(low, "low");
    }
}
