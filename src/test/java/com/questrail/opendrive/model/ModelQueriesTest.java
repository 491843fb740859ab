package com.questrail.opendrive.model;

import com.questrail.opendrive.TestDocuments;
import com.questrail.opendrive.model.junction.Connection;
import com.questrail.opendrive.model.junction.ConnectionType;
import com.questrail.opendrive.model.junction.Junction;
import com.questrail.opendrive.model.junction.JunctionLaneLink;
import com.questrail.opendrive.model.junction.JunctionType;
import com.questrail.opendrive.model.road.MaxSpeed;
import com.questrail.opendrive.model.road.RoadSpeed;
import com.questrail.opendrive.model.signal.Control;
import com.questrail.opendrive.model.signal.Controller;
import com.questrail.opendrive.model.signal.LaneValidity;
import com.questrail.opendrive.units.Angle;
import com.questrail.opendrive.units.Length;
import com.questrail.opendrive.units.Speed;
import com.questrail.opendrive.units.SpeedUnit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class ModelQueriesTest
{
    @Test
    void controllersAndJunctionsAreAddedByCopy()
    {
        Document base = TestDocuments.singleRoad(TestDocuments.straightRoad("1", 10.0));
        Controller controller = new Controller("30", Optional.of("ctrl"), Optional.empty(),
                List.of(new Control("20", Optional.empty())));
        Connection connection = new Connection("0", Optional.of("1"), Optional.of("2"), Optional.empty(),
                Optional.of(ContactPoint.START), ConnectionType.DEFAULT, Optional.empty(), Optional.empty(),
                List.of(new JunctionLaneLink(-1, -1)));
        Junction junction = new Junction("100", Optional.empty(), JunctionType.DEFAULT, Optional.empty(),
                Optional.empty(), Optional.empty(), Optional.empty(), List.of(connection), List.of(), List.of(),
                Optional.empty(), AdditionalData.EMPTY);

        Document updated = base.withControllers(List.of(controller)).withJunctions(List.of(junction));
        assertEquals(controller, updated.findController("30").orElseThrow());
        assertEquals(junction, updated.findJunction("100").orElseThrow());
        assertTrue(base.controllers().isEmpty());
        assertTrue(base.junctions().isEmpty());
    }

    @Test
    void headerOffsetIsReplaced()
    {
        HeaderOffset offset = new HeaderOffset(Length.of(1.0), Length.of(2.0), Length.ZERO, Angle.ZERO);
        Header header = Header.current().withName("net").withOffset(offset);
        assertEquals(offset, header.offset().orElseThrow());
        assertEquals("net", header.name().orElseThrow());
        assertTrue(header.withOffset(null).offset().isEmpty());
    }

    @Test
    void validityRangeIsInclusiveInEitherOrder()
    {
        LaneValidity validity = new LaneValidity(-1, -3);
        assertTrue(validity.covers(-1));
        assertTrue(validity.covers(-2));
        assertTrue(validity.covers(-3));
        assertFalse(validity.covers(0));
    }

    @Test
    void roadSpeedAsSpeedOnlyForNumericLimits()
    {
        assertEquals(Optional.of(Speed.of(50.0, SpeedUnit.KILOMETERS_PER_HOUR)),
                new RoadSpeed(MaxSpeed.of(50.0), SpeedUnit.KILOMETERS_PER_HOUR).asSpeed());
        assertTrue(new RoadSpeed(MaxSpeed.noLimit(), SpeedUnit.METERS_PER_SECOND).asSpeed().isEmpty());
        assertEquals("no limit", MaxSpeed.noLimit().toXml());
    }

    @Test
    void opaqueLeafHasNoContent()
    {
        OpaqueElement leaf = OpaqueElement.leaf("vendorTag", Map.of("k", "v"));
        assertTrue(leaf.children().isEmpty());
        assertEquals("", leaf.text());
        assertEquals("v", leaf.attributes().get("k"));
    }
}
