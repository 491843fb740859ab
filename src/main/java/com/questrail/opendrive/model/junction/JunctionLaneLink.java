package com.questrail.opendrive.model.junction;

/**
 * {@code <laneLink>}: lane {@code from} of the incoming road continues as lane
 * {@code to} of the connecting road.
 */
public record JunctionLaneLink(int from, int to)
{
}
