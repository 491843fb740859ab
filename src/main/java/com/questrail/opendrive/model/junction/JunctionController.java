package com.questrail.opendrive.model.junction;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code <controller>} reference inside a junction; {@code id} names a top-level controller.
 */
public record JunctionController(String id, Optional<String> type, Optional<Integer> sequence)
{
    public JunctionController {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sequence, "sequence");
    }
}
