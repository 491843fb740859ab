package com.questrail.opendrive;

import com.questrail.opendrive.model.DataQuality;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.model.Orientation;
import com.questrail.opendrive.model.PostProcessing;
import com.questrail.opendrive.model.RawDataSource;
import com.questrail.opendrive.model.junction.JunctionGroup;
import com.questrail.opendrive.model.junction.JunctionGroupType;
import com.questrail.opendrive.model.junction.JunctionSurface;
import com.questrail.opendrive.model.lane.RoadMark;
import com.questrail.opendrive.model.lane.RoadMarkExplicitLine;
import com.questrail.opendrive.model.lane.RoadMarkRule;
import com.questrail.opendrive.model.object.BorderType;
import com.questrail.opendrive.model.object.BridgeType;
import com.questrail.opendrive.model.object.ObjectMarking;
import com.questrail.opendrive.model.object.ObjectRepeat;
import com.questrail.opendrive.model.object.Outline;
import com.questrail.opendrive.model.object.OutlineCorner;
import com.questrail.opendrive.model.object.OutlineFillType;
import com.questrail.opendrive.model.object.ParkingAccess;
import com.questrail.opendrive.model.object.RoadObject;
import com.questrail.opendrive.model.object.RoadObjects;
import com.questrail.opendrive.model.object.SideType;
import com.questrail.opendrive.model.object.Tunnel;
import com.questrail.opendrive.model.road.CrgMode;
import com.questrail.opendrive.model.road.CrgPurpose;
import com.questrail.opendrive.model.road.Road;
import com.questrail.opendrive.model.road.RoadCrg;
import com.questrail.opendrive.model.signal.ReferencedElementType;
import com.questrail.opendrive.model.signal.Signal;
import com.questrail.opendrive.model.signal.SignalPosition;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RoadFurnitureTest
 * -----------------------------------------------------------------------------
 * Reads and writes the detailed road content of {@code road-furniture.xodr}:
 * object geometry, tunnels and bridges, signal relations, explicit road marks,
 * CRG surfaces, junction groups and data quality records.
 */
final class RoadFurnitureTest
{
    private final OpenDriveCodec codec = OpenDriveCodec.strict();
    private final Document document = codec.parse(Fixtures.bytes("road-furniture.xodr"));
    private final Road road = document.findRoad("1").orElseThrow();

    private RoadObject object(String id)
    {
        return road.objects().orElseThrow().objects().stream()
                .filter(o -> o.id().equals(id))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void readsRepeatedObject()
    {
        RoadObject rail = object("10");
        ObjectRepeat repeat = rail.repeats().get(0);
        assertEquals(100.0, repeat.length().meters(), 0.0);
        assertEquals(-4.5, repeat.tEnd().meters(), 0.0);
        assertEquals(0.1, repeat.zOffsetEnd().orElseThrow().meters(), 0.0);
        assertTrue(repeat.widthStart().isEmpty());
        assertEquals(Optional.of("steel"), rail.materials().get(0).surface());
        assertEquals(0.4, rail.materials().get(0).friction().orElseThrow(), 0.0);
    }

    @Test
    void readsOutlineWithMarking()
    {
        RoadObject crosswalk = object("11");
        Outline outline = crosswalk.outline().orElseThrow();
        assertEquals(OutlineFillType.ASPHALT, outline.fillType().orElseThrow());
        assertEquals(3, outline.corners().size());
        OutlineCorner.Local second = (OutlineCorner.Local) outline.corners().get(1);
        assertEquals(4.0, second.u().meters(), 0.0);
        assertEquals(Optional.of(1), second.id());

        ObjectMarking marking = crosswalk.markings().get(0);
        assertEquals(SideType.FRONT, marking.side().orElseThrow());
        assertEquals(List.of(0, 1), marking.cornerReferences());
        assertEquals(-1, crosswalk.validities().get(0).fromLane());
    }

    @Test
    void readsOutlinesBorderAndSurface()
    {
        RoadObject island = object("12");
        assertTrue(island.outline().isEmpty());
        Outline outline = island.outlines().get(0);
        assertTrue(outline.outer().orElseThrow());
        OutlineCorner.Road last = (OutlineCorner.Road) outline.corners().get(2);
        assertTrue(last.id().isEmpty());

        assertEquals(ParkingAccess.HANDICAPPED, island.parkingSpace().orElseThrow().access());
        assertEquals(Optional.of("max 2h"), island.parkingSpace().orElseThrow().restrictions());
        assertEquals(BorderType.CURB, island.borders().get(0).type());
        assertEquals(1, island.borders().get(0).outlineId());
        assertTrue(island.borders().get(0).cornerReferences().isEmpty());
        assertEquals(Optional.of(true), island.surface().orElseThrow().crg().orElseThrow().hideRoadSurfaceCrg());
    }

    @Test
    void readsReferencesTunnelsAndBridges()
    {
        RoadObjects objects = road.objects().orElseThrow();
        assertEquals(Orientation.MINUS, objects.references().get(0).orientation());
        assertEquals(5.0, objects.references().get(0).validLength().orElseThrow().meters(), 0.0);

        Tunnel tunnel = objects.tunnels().get(0);
        assertEquals(Optional.of("Hill Tunnel"), tunnel.name());
        assertEquals(0.2, tunnel.daylight().orElseThrow(), 0.0);
        assertEquals(BridgeType.STEEL, objects.bridges().get(0).type());
        assertTrue(objects.bridges().get(0).name().isEmpty());
    }

    @Test
    void readsSignalRelationsAndPositions()
    {
        Signal sign = document.findSignal("20").orElseThrow();
        assertEquals("21", sign.dependencies().get(0).id());
        assertEquals(ReferencedElementType.OBJECT, sign.references().get(0).elementType());
        assertEquals("11", sign.references().get(0).elementId());
        SignalPosition.Road onRoad = (SignalPosition.Road) sign.position().orElseThrow();
        assertEquals("1", onRoad.roadId());
        assertTrue(onRoad.roll().isEmpty());

        Signal speedLimit = document.findSignal("21").orElseThrow();
        SignalPosition.Inertial inertial = (SignalPosition.Inertial) speedLimit.position().orElseThrow();
        assertEquals(29.0, inertial.x().meters(), 0.0);
        assertEquals(3.14, inertial.hdg().radians(), 0.0);
    }

    @Test
    void readsSwayAndExplicitRoadMark()
    {
        RoadMark mark = road.lanes().laneSections().get(0).center().roadMarks().get(0);
        assertEquals(2, mark.sways().size());
        assertEquals(50.0, mark.sways().get(1).ds().meters(), 0.0);
        assertEquals(-0.01, mark.sways().get(1).polynomial().b(), 0.0);

        List<RoadMarkExplicitLine> lines = mark.explicit().orElseThrow().lines();
        assertEquals(2, lines.size());
        assertEquals(RoadMarkRule.CAUTION, lines.get(0).rule().orElseThrow());
        assertTrue(lines.get(1).width().isEmpty());
    }

    @Test
    void readsSurfacesAndJunctionGroup()
    {
        RoadCrg crg = road.surface().orElseThrow().crgs().get(0);
        assertEquals("road.crg", crg.file());
        assertEquals(CrgMode.ATTACHED, crg.mode());
        assertEquals(1.5, crg.zScale().orElseThrow(), 0.0);

        JunctionSurface surface = document.findJunction("100").orElseThrow().surface().orElseThrow();
        assertEquals(CrgMode.GLOBAL, surface.crgs().get(0).mode());
        assertEquals(CrgPurpose.FRICTION, surface.crgs().get(0).purpose().orElseThrow());

        JunctionGroup group = document.findJunctionGroup("500").orElseThrow();
        assertEquals(JunctionGroupType.ROUNDABOUT, group.type());
        assertEquals(List.of("100", "101"), group.junctionReferences());
    }

    @Test
    void readsDataQuality()
    {
        DataQuality quality = road.additionalData().dataQuality().orElseThrow();
        assertEquals(0.05, quality.error().orElseThrow().xyAbsolute().meters(), 0.0);
        assertEquals(RawDataSource.SENSOR, quality.rawData().orElseThrow().source());
        assertEquals(PostProcessing.CLEANED, quality.rawData().orElseThrow().postProcessing());
        assertEquals(Optional.of("lidar pass 2"), quality.rawData().orElseThrow().sourceComment());
    }

    @Test
    void serializedFurnitureReadsBackEqualAndIsIdempotent()
    {
        byte[] first = codec.serialize(document);
        Document reread = codec.parse(first);
        assertEquals(document, reread);
        assertArrayEquals(first, codec.serialize(reread));

        String xml = new String(first, StandardCharsets.UTF_8);
        assertTrue(xml.contains("<cornerReference id=\"1\"/>"), xml);
        assertTrue(xml.contains("<junctionReference junction=\"101\"/>"), xml);
    }
}
