package com.questrail.opendrive.model;

import com.questrail.opendrive.TestDocuments;
import com.questrail.opendrive.model.lane.LaneSection;
import com.questrail.opendrive.model.road.Road;
import com.questrail.opendrive.model.road.TrafficRule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DocumentTest
{
    @Test
    void findsRoadsById()
    {
        Document document = Document.of(Header.current(),
                List.of(TestDocuments.straightRoad("1", 10.0), TestDocuments.straightRoad("2", 20.0)));
        assertEquals(20.0, document.findRoad("2").orElseThrow().length().meters(), 0.0);
        assertTrue(document.findRoad("3").isEmpty());
        assertTrue(document.findJunction("1").isEmpty());
    }

    @Test
    void withRoadReplacesInPlaceOrAppends()
    {
        Document document = Document.of(Header.current(),
                List.of(TestDocuments.straightRoad("1", 10.0), TestDocuments.straightRoad("2", 20.0)));

        Road lht = Road.builder("1", TestDocuments.straight(10.0), document.roads().get(0).lanes())
                .withRule(TrafficRule.LHT)
                .build();
        Document replaced = document.withRoad(lht);
        assertEquals(2, replaced.roads().size());
        assertEquals(TrafficRule.LHT, replaced.roads().get(0).rule());
        assertEquals(TrafficRule.RHT, document.roads().get(0).rule());

        Document appended = document.withRoad(TestDocuments.straightRoad("9", 5.0));
        assertEquals(List.of("1", "2", "9"), appended.roads().stream().map(Road::id).toList());
    }

    @Test
    void roadsInJunctionFiltersByMembership()
    {
        Road connector = Road.builder("7", TestDocuments.straight(5.0), TestDocuments.straightRoad("x", 5.0).lanes())
                .withJunction("100")
                .build();
        Document document = Document.of(Header.current(), List.of(TestDocuments.straightRoad("1", 10.0), connector));
        assertEquals(List.of(connector), document.roadsInJunction("100"));
        assertTrue(document.roadsInJunction("200").isEmpty());
    }

    @Test
    void lanesAreReplacedAndLookedUpById()
    {
        Road road = TestDocuments.straightRoad("1", 10.0)
                .withLanes(TestDocuments.singleSection(
                        List.of(TestDocuments.drivingLane(1)),
                        List.of(TestDocuments.drivingLane(-1), TestDocuments.drivingLane(-2))));
        LaneSection section = road.lanes().laneSections().get(0);
        assertEquals(-2, section.lane(-2).orElseThrow().id());
        assertEquals(0, section.lane(0).orElseThrow().id());
        assertTrue(section.lane(3).isEmpty());
    }

    @Test
    void documentRequiresARoad()
    {
        assertThrows(IllegalArgumentException.class, () -> Document.of(Header.current(), List.of()));
    }

    @Test
    void sentinelJunctionIdIsNotAMembership()
    {
        assertThrows(IllegalArgumentException.class,
                () -> Road.builder("1", TestDocuments.straight(1.0), TestDocuments.straightRoad("x", 1.0).lanes())
                        .withJunction(Road.NO_JUNCTION)
                        .build());
    }
}
