package com.questrail.opendrive;

import com.questrail.opendrive.geometry.Geometry;
import com.questrail.opendrive.geometry.Line;
import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.model.Header;
import com.questrail.opendrive.model.lane.Lane;
import com.questrail.opendrive.model.lane.LaneSection;
import com.questrail.opendrive.model.lane.LaneType;
import com.questrail.opendrive.model.lane.LaneWidth;
import com.questrail.opendrive.model.lane.Lanes;
import com.questrail.opendrive.model.lane.RoadMark;
import com.questrail.opendrive.model.lane.RoadMarkColor;
import com.questrail.opendrive.model.lane.RoadMarkType;
import com.questrail.opendrive.model.road.PlanView;
import com.questrail.opendrive.model.road.Road;
import com.questrail.opendrive.units.Length;

import java.util.List;

/**
 * Small hand-built models shared by tests.
 */
public final class TestDocuments
{
    private TestDocuments() {
    }

    public static PlanView straight(double length) {
        return PlanView.of(Geometry.of(0.0, 0.0, 0.0, 0.0, length, new Line()));
    }

    public static Lane centerLane() {
        return Lane.builder(0, LaneType.NONE)
                .addRoadMark(RoadMark.simple(0.0, RoadMarkType.SOLID, RoadMarkColor.STANDARD))
                .build();
    }

    public static Lane drivingLane(int id) {
        return Lane.builder(id, LaneType.DRIVING)
                .addBoundary(LaneWidth.constant(0.0, 3.5))
                .build();
    }

    public static Lanes singleSection(List<Lane> left, List<Lane> right) {
        return Lanes.of(new LaneSection(Length.ZERO, false, left, centerLane(), right, AdditionalData.EMPTY));
    }

    public static Road straightRoad(String id, double length) {
        return Road.builder(id, straight(length), singleSection(List.of(), List.of(drivingLane(-1)))).build();
    }

    public static Document singleRoad(Road road) {
        return Document.of(Header.current(), List.of(road));
    }
}
