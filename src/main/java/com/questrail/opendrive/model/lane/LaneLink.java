package com.questrail.opendrive.model.lane;

import java.util.List;

/**
 * {@code <link>} of a lane: ids of lanes in the preceding and succeeding lane sections.
 */
public record LaneLink(List<Integer> predecessors, List<Integer> successors)
{
    public LaneLink {
        predecessors = List.copyOf(predecessors);
        successors = List.copyOf(successors);
    }
}
