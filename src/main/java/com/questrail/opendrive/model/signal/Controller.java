package com.questrail.opendrive.model.signal;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A top-level {@code <controller>} grouping signals that switch together.
 * Signals are referenced by id.
 */
public record Controller(String id, Optional<String> name, Optional<Integer> sequence, List<Control> controls)
{
    public Controller {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(sequence, "sequence");
        controls = List.copyOf(controls);
    }
}
