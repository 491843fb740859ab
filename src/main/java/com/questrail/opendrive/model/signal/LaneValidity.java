package com.questrail.opendrive.model.signal;

/**
 * {@code <validity>}: the inclusive lane id range a signal or object applies to.
 */
public record LaneValidity(int fromLane, int toLane)
{
    public boolean covers(int laneId) {
        return laneId >= Math.min(fromLane, toLane) && laneId <= Math.max(fromLane, toLane);
    }
}
